package ch.so.arp.rag.text2sql.generation;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Isolates the SQL statement in a free-text model response.
 *
 * <p>Rules, in order:
 * <ol>
 * <li>{@code <think>} blocks are ignored.</li>
 * <li>Fenced blocks labelled {@code sql} (or with a dialect name) win. One
 * distinct statement is a match, several are ambiguous.</li>
 * <li>Otherwise unlabelled fences whose body starts with a SQL keyword are
 * treated the same way.</li>
 * <li>Otherwise the first line that starts with a SQL keyword opens the
 * statement, which runs to the first {@code ;} or blank line.</li>
 * </ol>
 * Trailing semicolons are removed from the result.
 */
public class SqlExtractor {

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>.*?</think>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCE = Pattern.compile("```[ \\t]*([A-Za-z0-9_+-]*)[^\\n]*\\n(.*?)```",
            Pattern.DOTALL);
    private static final Set<String> SQL_LABELS = Set.of("sql", "mysql", "postgresql", "postgres", "psql", "h2",
            "plsql", "tsql");
    private static final Pattern LEADING_KEYWORD = Pattern.compile(
            "^\\s*(SELECT|WITH|INSERT|UPDATE|DELETE|MERGE|REPLACE|CREATE|ALTER|DROP|TRUNCATE|GRANT|REVOKE)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_WITH_KEYWORD = Pattern.compile(
            "(?m)^[ \\t]*(?:SELECT|WITH|INSERT|UPDATE|DELETE|MERGE|REPLACE|CREATE|ALTER|DROP|TRUNCATE|GRANT|REVOKE)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STATEMENT_END = Pattern.compile(";|\\n[ \\t]*\\r?\\n");

    public Extraction extract(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            return Extraction.none("The response is empty");
        }
        String text = THINK_BLOCK.matcher(rawOutput).replaceAll("");

        Set<String> labelled = new LinkedHashSet<>();
        Set<String> unlabelled = new LinkedHashSet<>();
        Matcher fence = FENCE.matcher(text);
        while (fence.find()) {
            String label = fence.group(1).toLowerCase(Locale.ROOT);
            String body = clean(fence.group(2));
            if (body.isEmpty()) {
                continue;
            }
            if (SQL_LABELS.contains(label)) {
                labelled.add(body);
            } else if (label.isEmpty() && LEADING_KEYWORD.matcher(body).find()) {
                unlabelled.add(body);
            }
        }
        if (!labelled.isEmpty()) {
            return fromFences(labelled, "sql");
        }
        if (!unlabelled.isEmpty()) {
            return fromFences(unlabelled, "unlabelled");
        }

        Matcher keyword = LINE_WITH_KEYWORD.matcher(text);
        if (keyword.find()) {
            String rest = text.substring(keyword.start());
            Matcher end = STATEMENT_END.matcher(rest);
            String statement = end.find() ? rest.substring(0, end.start()) : rest;
            String sql = clean(statement);
            if (!sql.isEmpty()) {
                return Extraction.found(sql);
            }
        }
        return Extraction.none("The response contains no SQL statement");
    }

    private Extraction fromFences(Set<String> bodies, String kind) {
        if (bodies.size() > 1) {
            return Extraction.ambiguous("The response contains " + bodies.size() + " different " + kind
                    + " code blocks");
        }
        return Extraction.found(bodies.iterator().next());
    }

    static String clean(String sql) {
        String trimmed = sql.strip();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).stripTrailing();
        }
        return trimmed;
    }

    /**
     * Result of an extraction: a statement, nothing, or several competing
     * statements.
     */
    public record Extraction(Status status, String sql, String reason) {

        static Extraction found(String sql) {
            return new Extraction(Status.FOUND, sql, "");
        }

        static Extraction none(String reason) {
            return new Extraction(Status.NONE, null, reason);
        }

        static Extraction ambiguous(String reason) {
            return new Extraction(Status.AMBIGUOUS, null, reason);
        }

        public boolean isFound() {
            return status == Status.FOUND;
        }
    }

    public enum Status {
        FOUND,
        NONE,
        AMBIGUOUS
    }
}
