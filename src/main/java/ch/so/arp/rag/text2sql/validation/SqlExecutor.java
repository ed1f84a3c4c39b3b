package ch.so.arp.rag.text2sql.validation;

/**
 * Runs a validated read-only statement against the target database.
 */
@FunctionalInterface
public interface SqlExecutor {

    /**
     * @return {@code success} with the rows, or {@code execution_error} with the engine message
     */
    ValidationOutcome execute(String sql);
}
