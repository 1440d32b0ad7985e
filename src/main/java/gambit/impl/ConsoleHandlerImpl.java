package gambit.impl;

import gambit.contracts.ConsoleHandler;
import gambit.contracts.Game;
import gambit.model.Piece;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Scanner;
import java.util.stream.Collectors;

/**
 * Text front-end: one command per line.
 *
 * <pre>
 *   new [level]   start over (level 1-3, default: keep current)
 *   level n       change difficulty only
 *   fen [fen]     print the position, or load one
 *   board         print the board
 *   moves         list legal moves
 *   go            let the engine move
 *   e2e4          play a move; the engine answers unless the game is over
 *   quit
 * </pre>
 */
public final class ConsoleHandlerImpl implements ConsoleHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleHandlerImpl.class);

    private final Game        game;
    private final InputStream in;
    private final PrintStream out;

    public ConsoleHandlerImpl(Game game, InputStream in, PrintStream out) {
        this.game = game;
        this.in   = in;
        this.out  = out;
    }

    /* ── main loop ─────────────────────────────────────────────── */
    @Override public void runLoop() {
        printBoard();
        try (Scanner sc = new Scanner(in, StandardCharsets.UTF_8)) {
            while (sc.hasNextLine()) {
                String line = sc.nextLine().trim();
                if (!line.isEmpty() && handle(line)) break;   // “quit” → exit
            }
        }
    }

    /* ── router ───────────────────────────────────────────────── */
    private boolean handle(String cmd) {
        String[] t = cmd.split("\\s+", 2);

        return switch (t[0]) {
            case "quit"  -> true;
            case "new"   -> { cmdNew(t);   yield false; }
            case "level" -> { cmdLevel(t); yield false; }
            case "fen"   -> { cmdFen(t);   yield false; }
            case "board" -> { printBoard(); yield false; }
            case "moves" -> { out.println(String.join(" ", game.legalMoves())); yield false; }
            case "go"    -> { engineMove(); yield false; }
            default      -> { cmdMove(t[0]); yield false; }
        };
    }

    /* ── commands ─────────────────────────────────────────────── */
    private void cmdNew(String[] t) {
        Integer level = t.length > 1 ? parseLevel(t[1]) : Integer.valueOf(game.difficulty().level());
        if (level == null) return;
        game.newGame(level);
        printBoard();
    }

    private void cmdLevel(String[] t) {
        Integer level = t.length > 1 ? parseLevel(t[1]) : null;
        if (level == null) {
            if (t.length == 1) error("usage: level <1-3>");
            return;
        }
        game.setDifficulty(level);
        out.println("difficulty " + game.difficulty());
    }

    private void cmdFen(String[] t) {
        if (t.length == 1) {
            out.println(game.toFen());
            return;
        }
        try {
            game.setPosition(t[1]);
            printBoard();
        } catch (IllegalArgumentException e) {
            error("bad fen: " + e.getMessage());
        }
    }

    private void cmdMove(String mv) {
        if (!game.applyPlayerMove(mv)) {
            error("illegal move or unknown command: " + mv);
            return;
        }
        out.println(game.lastMove());
        if (!printStatus()) engineMove();
    }

    private void engineMove() {
        if (isOver()) {
            printStatus();
            return;
        }
        game.computeAiMove();
        out.println(game.lastMove());
        printBoard();
        printStatus();
    }

    /* ── helpers ──────────────────────────────────────────────── */
    private Integer parseLevel(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            error("not a level: " + s);
            return null;
        }
    }

    private boolean isOver() {
        return game.isCheckmate() || game.isStalemate();
    }

    /** @return {@code true} when the game is over */
    private boolean printStatus() {
        if (game.isCheckmate()) {
            out.println("checkmate - " + game.sideToMove().opposite() + " wins");
            return true;
        }
        if (game.isStalemate()) {
            out.println("stalemate - draw");
            return true;
        }
        if (game.inCheck()) out.println("check");
        return false;
    }

    private void printBoard() {
        Piece[] cells = game.boardSnapshot();
        StringBuilder sb = new StringBuilder(100);
        for (int rank = 0; rank < 8; rank++) {
            sb.append(8 - rank).append(' ');
            for (int file = 0; file < 8; file++) {
                Piece p = cells[rank * 8 + file];
                sb.append(p == null ? '.' : p.symbol()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("  a b c d e f g h\n");
        sb.append(game.sideToMove()).append(" to move");
        out.println(sb);
        printCaptures("player", game.playerCaptures());
        printCaptures("engine", game.engineCaptures());
    }

    private void printCaptures(String who, List<Piece> caps) {
        if (caps.isEmpty()) return;
        out.println(who + " captured: " + caps.stream().map(Piece::toString).collect(Collectors.joining(" ")));
    }

    private void error(String msg) {
        logger.warn(msg);
        out.println("error: " + msg);
    }
}
