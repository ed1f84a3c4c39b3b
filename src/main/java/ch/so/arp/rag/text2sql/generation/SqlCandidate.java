package ch.so.arp.rag.text2sql.generation;

import java.util.Objects;

/**
 * One generated statement.
 *
 * @param rawOutput the complete model response
 * @param sql the isolated statement, {@code null} if none could be isolated
 * @param dialect dialect the statement was requested in
 * @param attempt 1-based generation attempt
 */
public record SqlCandidate(String rawOutput, String sql, SqlDialect dialect, int attempt) {

    public SqlCandidate {
        rawOutput = rawOutput == null ? "" : rawOutput;
        Objects.requireNonNull(dialect, "dialect");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
    }

    public static SqlCandidate unparsable(String rawOutput, SqlDialect dialect, int attempt) {
        return new SqlCandidate(rawOutput, null, dialect, attempt);
    }

    public boolean hasSql() {
        return sql != null;
    }
}
