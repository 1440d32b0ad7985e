package gambit.impl;

import gambit.contracts.Game;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleHandlerImplTest {

    private static String run(Game game, String script) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        new ConsoleHandlerImpl(game, new ByteArrayInputStream(script.getBytes(StandardCharsets.UTF_8)), out).runLoop();
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsTheBoardOnStartup() {
        try (Game game = new GameImpl(2, new Random(1))) {
            String out = run(game, "quit\n");
            assertTrue(out.contains("8 r n b q k b n r"));
            assertTrue(out.contains("1 R N B Q K B N R"));
            assertTrue(out.contains("WHITE to move"));
        }
    }

    @Test
    void playerMoveIsAnsweredByTheEngine() {
        try (Game game = new GameImpl(1, new Random(1))) {
            String out = run(game, "e2e4\nquit\n");
            assertTrue(out.contains("Player: e2-e4"));
            assertTrue(out.contains("Engine: "));
            assertEquals(gambit.model.Piece.Color.WHITE, game.sideToMove());
        }
    }

    @Test
    void unknownInputIsReported() {
        try (Game game = new GameImpl(2, new Random(1))) {
            String out = run(game, "e2e5\nfen nonsense\nlevel x\nquit\n");
            assertTrue(out.contains("error: illegal move or unknown command: e2e5"));
            assertTrue(out.contains("error: bad fen"));
            assertTrue(out.contains("error: not a level: x"));
        }
    }

    @Test
    void levelAndFenCommands() {
        try (Game game = new GameImpl(2, new Random(1))) {
            String out = run(game, "level 3\nfen 4k3/8/8/8/8/8/8/4K3 w - - 0 1\nfen\nmoves\nquit\n");
            assertTrue(out.contains("difficulty HARD"));
            assertTrue(out.contains("4k3/8/8/8/8/8/8/4K3 w - - 0 1"));
            assertTrue(out.contains("e1d1"));
        }
    }

    @Test
    void gameEndIsAnnounced() {
        try (Game game = new GameImpl(2, new Random(1))) {
            String out = run(game, "fen Q6k/8/6K1/8/8/8/8/8 b - - 0 1\ngo\n"
                    + "fen k7/8/1Q6/8/8/8/8/7K b - - 0 1\ngo\nquit\n");
            assertTrue(out.contains("checkmate - WHITE wins"));
            assertTrue(out.contains("stalemate - draw"));
        }
    }

    @Test
    void commandsAfterQuitAreIgnored() {
        try (Game game = new GameImpl(2, new Random(1))) {
            run(game, "quit\ne2e4\n");
            assertEquals(gambit.model.Piece.Color.WHITE, game.sideToMove());
            assertEquals("", game.lastMove());
        }
    }
}
