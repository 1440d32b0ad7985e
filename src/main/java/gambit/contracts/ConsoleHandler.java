package gambit.contracts;

/**
 * Line-oriented text front-end for a {@link Game}.
 */
public interface ConsoleHandler {

    /**
     * Reads and processes commands until "quit" is received or the input stream is closed.
     */
    void runLoop();
}
