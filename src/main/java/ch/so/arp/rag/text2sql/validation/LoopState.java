package ch.so.arp.rag.text2sql.validation;

/**
 * States of the generate, check and execute cycle.
 */
public enum LoopState {

    GENERATE(false),
    SYNTAX_CHECK(false),
    EXECUTE(false),
    /** A candidate passed every check. */
    SUCCESS(true),
    /** The attempt budget is used up. */
    EXHAUSTED(true),
    /** A candidate was not a single read-only query. */
    REJECTED(true),
    /** The caller cancelled the query. */
    CANCELLED(true);

    private final boolean terminal;

    LoopState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
