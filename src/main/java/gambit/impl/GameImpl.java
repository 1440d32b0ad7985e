package gambit.impl;

import gambit.constants.Difficulty;
import gambit.contracts.*;
import gambit.model.Move;
import gambit.model.Piece;
import gambit.model.Piece.Color;
import gambit.model.Position;
import gambit.model.Squares;
import gambit.records.SearchResult;
import gambit.records.SearchSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.random.RandomGenerator;

/**
 * Session object: owns the position, the result cache and the search stack wired around them.
 *
 * <p>Every public method runs under this object's monitor, so a search started through
 * {@link #computeAiMoveAsync()} and calls from the host thread never touch the position or the
 * cache at the same time. Separate {@code GameImpl} instances share nothing.
 */
public final class GameImpl implements Game {

    private static final Logger logger = LoggerFactory.getLogger(GameImpl.class);

    /* ── engine parts ─────────────────────────────────────────── */
    private final PositionFactory    positionFactory;
    private final MoveGenerator      moveGenerator;
    private final TranspositionTable transpositionTable;
    private final Search             search;

    /* ── session state (guarded by this) ─────────────────────── */
    private Position   position;
    private Difficulty difficulty;
    private final List<Piece> playerCaptures = new ArrayList<>();
    private final List<Piece> engineCaptures = new ArrayList<>();
    private String lastMove = "";

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "gambit-search");
        t.setDaemon(true);
        return t;
    });

    public GameImpl(int level) {
        this(level, new Random());
    }

    public GameImpl(int level, RandomGenerator random) {
        this(level, random, new TranspositionTableImpl());
    }

    GameImpl(int level, RandomGenerator random, TranspositionTable transpositionTable) {
        this.positionFactory    = new PositionFactoryImpl();
        this.moveGenerator      = new MoveGeneratorImpl(positionFactory);
        Evaluator evaluator     = new EvaluatorImpl();
        this.transpositionTable = transpositionTable;
        Searcher searcher = new AlphaBetaSearcherImpl(
                positionFactory, moveGenerator, evaluator, new MoveOrdererImpl(), transpositionTable);
        this.search = new SearchImpl(
                positionFactory, moveGenerator, evaluator, new MoveOrdererImpl(), searcher, random);
        newGame(level);
    }

    /* ── life-cycle ───────────────────────────────────────────── */

    @Override
    public synchronized void newGame(int level) {
        position = positionFactory.startPosition();
        resetHistory();
        applyDifficulty(level);
        logger.info("New game, difficulty {}", difficulty);
    }

    @Override
    public synchronized void setDifficulty(int level) {
        applyDifficulty(level);
        logger.info("Difficulty set to {}", difficulty);
    }

    private void applyDifficulty(int level) {
        difficulty = Difficulty.fromLevel(level);
        transpositionTable.clear();
    }

    @Override
    public synchronized Difficulty difficulty() {
        return difficulty;
    }

    @Override
    public synchronized void setPosition(String fen) {
        position = positionFactory.fromFen(fen);
        resetHistory();
        logger.debug("Position set: {}", fen);
    }

    private void resetHistory() {
        playerCaptures.clear();
        engineCaptures.clear();
        lastMove = "";
    }

    /* ── moves ────────────────────────────────────────────────── */

    @Override
    public synchronized List<String> legalMoves() {
        List<String> out = new ArrayList<>();
        for (Move m : moveGenerator.generateLegalMoves(position)) {
            out.add(m.toUci());
        }
        return out;
    }

    @Override
    public synchronized boolean applyPlayerMove(String s) {
        if (s == null || s.length() != 4) return false;
        int from = Squares.fromAlgebraic(s.substring(0, 2));
        int to   = Squares.fromAlgebraic(s.substring(2, 4));
        if (from == Squares.NO_SQUARE || to == Squares.NO_SQUARE) return false;

        for (Move m : moveGenerator.generateLegalMoves(position)) {
            if (m.from() == from && m.to() == to) {
                positionFactory.makeMove(position, m);
                if (m.isCapture()) playerCaptures.add(m.captured());
                lastMove = "Player: " + s.substring(0, 2) + "-" + s.substring(2, 4);
                logger.debug("Player move {}", m);
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized String computeAiMove() {
        SearchSpec spec = new SearchSpec.Builder()
                .depth(difficulty.searchDepth())
                .blunderProbability(difficulty.blunderProbability())
                .build();
        SearchResult result = search.search(position, spec);

        Move m = result.bestMove();
        positionFactory.makeMove(position, m);
        if (m.isCapture()) engineCaptures.add(m.captured());
        lastMove = "Engine: " + m.toUci();
        logger.debug("Engine move {} (score {}, depth {}, random {}, nodes {})",
                m, result.score(), result.depth(), result.blunder(), result.nodes());
        return m.toUci();
    }

    @Override
    public CompletableFuture<String> computeAiMoveAsync() {
        return CompletableFuture.supplyAsync(this::computeAiMove, worker);
    }

    /* ── queries ──────────────────────────────────────────────── */

    @Override
    public synchronized Piece[] boardSnapshot() {
        return position.snapshot();
    }

    @Override
    public synchronized Color sideToMove() {
        return position.sideToMove();
    }

    @Override
    public synchronized boolean inCheck() {
        return moveGenerator.isInCheck(position, position.sideToMove());
    }

    @Override
    public synchronized boolean isCheckmate() {
        return inCheck() && moveGenerator.generateLegalMoves(position).isEmpty();
    }

    @Override
    public synchronized boolean isStalemate() {
        return !inCheck() && moveGenerator.generateLegalMoves(position).isEmpty();
    }

    @Override
    public synchronized List<Piece> playerCaptures() {
        return List.copyOf(playerCaptures);
    }

    @Override
    public synchronized List<Piece> engineCaptures() {
        return List.copyOf(engineCaptures);
    }

    @Override
    public synchronized String lastMove() {
        return lastMove;
    }

    @Override
    public synchronized String toFen() {
        return positionFactory.toFen(position);
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
