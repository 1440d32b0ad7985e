package gambit.impl;

import gambit.contracts.*;
import gambit.model.Move;
import gambit.model.Position;
import gambit.records.SearchResult;
import gambit.records.SearchSpec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static gambit.constants.CoreConstants.SCORE_NONE;
import static org.junit.jupiter.api.Assertions.*;

class SearchImplTest {

    private static final PositionFactory PF   = new PositionFactoryImpl();
    private static final MoveGenerator   GEN  = new MoveGeneratorImpl(PF);
    private static final Evaluator       EVAL = new EvaluatorImpl();
    private static final MoveOrderer     ORDERER = new MoveOrdererImpl();

    private static Search rootWith(Searcher searcher, long seed) {
        return new SearchImpl(PF, GEN, EVAL, ORDERER, searcher, new Random(seed));
    }

    private static Search fullStack() {
        Searcher ab = new AlphaBetaSearcherImpl(PF, GEN, EVAL, ORDERER, new TranspositionTableImpl());
        return rootWith(ab, 1);
    }

    private static SearchSpec spec(int depth, double p) {
        return new SearchSpec.Builder().depth(depth).blunderProbability(p).build();
    }

    @Test
    void certainBlunderReturnsFirstOrderedMoveUnsearched() {
        Position pos = PF.fromFen("7k/8/8/3q4/8/8/8/K2R4 w - - 0 1");
        Searcher mustNotRun = (p, d, a, b) -> { throw new AssertionError("searched"); };

        SearchResult r = rootWith(mustNotRun, 7).search(pos, spec(3, 1.0));

        List<Move> ordered = GEN.generateLegalMoves(pos);
        ORDERER.orderMoves(pos, ordered);
        assertEquals(ordered.get(0), r.bestMove());
        assertTrue(r.blunder());
        assertEquals(SCORE_NONE, r.score());
    }

    @Test
    void withoutBlundersEveryRootMoveIsSearchedOnce() {
        Position pos = PF.startPosition();
        List<Integer> depths = new ArrayList<>();
        Searcher counting = (p, d, a, b) -> { depths.add(d); return 0; };

        SearchResult r = rootWith(counting, 7).search(pos, spec(4, 0.0));

        assertEquals(20, depths.size());
        assertTrue(depths.stream().allMatch(d -> d == 3));
        assertFalse(r.blunder());
        assertEquals(4, r.depth());
        // all ties: the first ordered move wins
        assertEquals(GEN.generateLegalMoves(pos).get(0), r.bestMove());
    }

    @Test
    void bestScoreWinsAndTiesKeepTheEarlierMove() {
        Position pos = PF.fromFen("4k3/8/8/8/8/8/8/4K3 w - - 0 1");
        List<Move> ordered = GEN.generateLegalMoves(pos);
        ORDERER.orderMoves(pos, ordered);
        // searcher scores are from the opponent's view: the root negates them
        int[] childScores = {5, -7, -7, 3, 0};
        int[] call = {0};
        Searcher scripted = (p, d, a, b) -> childScores[call[0]++];

        SearchResult r = rootWith(scripted, 7).search(pos, spec(1, 0.0));

        assertEquals(ordered.get(1), r.bestMove());
        assertEquals(7, r.score());
    }

    @Test
    void capturesTheHangingQueen() {
        SearchResult r = fullStack().search(PF.fromFen("7k/8/8/3q4/8/8/8/K2R4 w - - 0 1"), spec(2, 0.0));
        assertEquals("d1d5", r.bestMove().toUci());
        assertEquals(500, r.score());
    }

    @Test
    void findsMateInOne() {
        Position pos = PF.fromFen("7k/8/6K1/8/8/8/8/Q7 w - - 0 1");
        SearchResult r = fullStack().search(pos, spec(2, 0.0));

        PF.makeMove(pos, r.bestMove());
        assertTrue(GEN.isInCheck(pos, pos.sideToMove()));
        assertTrue(GEN.generateLegalMoves(pos).isEmpty());
    }

    @Test
    void noLegalMoveIsAnError() {
        Position mated = PF.fromFen("Q6k/8/6K1/8/8/8/8/8 b - - 0 1");
        assertThrows(IllegalStateException.class, () -> fullStack().search(mated, spec(2, 0.0)));

        Position stalemated = PF.fromFen("k7/8/1Q6/8/8/8/8/7K b - - 0 1");
        assertThrows(IllegalStateException.class, () -> fullStack().search(stalemated, spec(2, 0.0)));
    }

    @Test
    void lopsidedMaterialExtendsTheDepth() {
        for (String fen : List.of(
                "4k3/8/8/8/8/8/8/QQ2K3 w - - 0 1",      // white ahead
                "qq2k3/8/8/8/8/8/8/4K3 w - - 0 1")) {   // white behind
            List<Integer> depths = new ArrayList<>();
            Searcher counting = (p, d, a, b) -> { depths.add(d); return 0; };

            SearchResult r = rootWith(counting, 7).search(PF.fromFen(fen), spec(1, 0.0));

            assertEquals(3, r.depth(), fen);
            assertTrue(depths.stream().allMatch(d -> d == 2), fen);
        }
    }

    @Test
    void balancedMaterialKeepsTheDepth() {
        SearchImpl root = new SearchImpl(PF, GEN, EVAL, ORDERER, (p, d, a, b) -> 0, new Random(1));
        assertEquals(0, root.materialExtension(PF.startPosition()));
        // queen, rook and pawn up is exactly the threshold; a second pawn crosses it
        assertEquals(0, root.materialExtension(PF.fromFen("4k3/8/8/8/8/8/P7/QR2K3 w - - 0 1")));
        assertEquals(2, root.materialExtension(PF.fromFen("4k3/8/8/8/8/8/PP6/QR2K3 w - - 0 1")));
    }

    @Test
    void rootPositionIsRestored() {
        Position pos = PF.fromFen("r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w - - 0 1");
        Position before = pos.copy();
        fullStack().search(pos, spec(2, 0.0));
        assertEquals(before, pos);
    }

    @Test
    void sameSeedSameBlunders() {
        Position pos = PF.startPosition();
        Searcher flat = (p, d, a, b) -> 0;
        Search first = rootWith(flat, 99);
        Search second = rootWith(flat, 99);
        for (int i = 0; i < 5; i++) {
            assertEquals(first.search(pos, spec(2, 0.35)), second.search(pos, spec(2, 0.35)));
        }
    }
}
