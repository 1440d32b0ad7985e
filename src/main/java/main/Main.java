// File: Main.java
package main;

import gambit.contracts.ConsoleHandler;
import gambit.contracts.Game;
import gambit.contracts.MoveGenerator;
import gambit.contracts.PositionFactory;
import gambit.impl.ConsoleHandlerImpl;
import gambit.impl.GameImpl;
import gambit.impl.MoveGeneratorImpl;
import gambit.impl.PositionFactoryImpl;
import gambit.model.Move;
import gambit.model.Position;
import gambit.model.UndoRecord;

import java.util.List;

/**
 * Wire everything together and run the console loop.
 *
 * <pre>
 *   Main [level]        play against the engine (level 1-3, or -Dgambit.level)
 *   Main bench [depth]  perft benchmark
 * </pre>
 */
public final class Main {

    static final List<String> BENCH_FENS = List.of(
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w - - 0 1",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w - - 0 1",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1",
            "r3k2r/Pppp1ppp/1b3nbN/nP6/BBP1P3/q4N2/Pp1P2PP/R2Q1RK1 w - - 0 1",
            "rnbq1k1r/pp1Pbppp/2p5/8/2B5/8/PPP1NnPP/RNBQK2R w - - 1 8"
    );

    public static void main(String[] args) {
        if (args.length > 0 && "bench".equalsIgnoreCase(args[0])) {
            int depth = (args.length > 1) ? parseIntOr(args[1], 3) : 3;
            runPerftBench(depth);
            return;
        }

        int defaultLevel = Integer.getInteger("gambit.level", 2);
        int level = (args.length > 0) ? parseIntOr(args[0], defaultLevel) : defaultLevel;

        System.out.println("Gambit Chess Engine");

        try (Game game = new GameImpl(level)) {
            ConsoleHandler console = new ConsoleHandlerImpl(game, System.in, System.out);
            console.runLoop();
        }
    }

    /** Parses {@code s}, or prints the usage line and returns {@code fallback}. */
    static int parseIntOr(String s, int fallback) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            System.err.println("not a number: " + s + " (using " + fallback + ")");
            System.err.println("usage: Main [level] | Main bench [depth]");
            return fallback;
        }
    }

    private static void runPerftBench(int depth) {
        PositionFactory pf = new PositionFactoryImpl();
        MoveGenerator mg = new MoveGeneratorImpl(pf);

        long totalNodes = 0, totalTimeMs = 0;

        for (String fen : BENCH_FENS) {
            Position root = pf.fromFen(fen);
            long t0 = System.nanoTime();
            long nodes = perft(root, depth, pf, mg);
            long ms = (System.nanoTime() - t0) / 1_000_000;

            totalNodes += nodes;
            totalTimeMs += ms;
        }

        long totalNps = totalTimeMs > 0 ? (1000L * totalNodes) / totalTimeMs : 0;
        System.out.printf("Nodes searched: %d%n", totalNodes);
        System.out.printf("nps: %d%n", totalNps);
        System.out.println("benchok");
    }

    static long perft(Position pos, int depth, PositionFactory pf, MoveGenerator mg) {
        if (depth == 0) return 1;

        long nodes = 0;
        for (Move m : mg.generateLegalMoves(pos)) {
            UndoRecord u = pf.makeMove(pos, m);
            nodes += perft(pos, depth - 1, pf, mg);
            pf.undoMove(pos, u);
        }
        return nodes;
    }
}
