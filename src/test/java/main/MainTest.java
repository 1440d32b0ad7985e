package main;

import gambit.contracts.MoveGenerator;
import gambit.contracts.PositionFactory;
import gambit.impl.MoveGeneratorImpl;
import gambit.impl.PositionFactoryImpl;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MainTest {

    @Test
    void badNumericArgumentsFallBack() {
        assertEquals(3, Main.parseIntOr("3", 2));
        assertEquals(1, Main.parseIntOr(" 1 ", 2));
        assertEquals(2, Main.parseIntOr("hard", 2));
        assertEquals(3, Main.parseIntOr("", 3));
    }

    @Test
    void benchPositionsParseAndPerftCountsMatch() {
        PositionFactory pf = new PositionFactoryImpl();
        MoveGenerator mg = new MoveGeneratorImpl(pf);

        assertEquals(8902, Main.perft(pf.fromFen(Main.BENCH_FENS.get(0)), 3, pf, mg));
        assertEquals(14, Main.perft(pf.fromFen(Main.BENCH_FENS.get(2)), 1, pf, mg));
        for (String fen : Main.BENCH_FENS) {
            assertEquals(1, Main.perft(pf.fromFen(fen), 0, pf, mg));
        }
    }
}
