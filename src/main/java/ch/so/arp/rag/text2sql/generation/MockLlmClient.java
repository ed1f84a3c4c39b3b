package ch.so.arp.rag.text2sql.generation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic {@link LlmClient} used in local development where no model
 * endpoint should be contacted. It answers with a simple query over the first
 * table of the schema context.
 */
public class MockLlmClient implements LlmClient {

    private static final Pattern FIRST_TABLE = Pattern.compile("^# Table: (\\S+)", Pattern.MULTILINE);

    @Override
    public String complete(String prompt, GenerationOptions options) {
        Matcher matcher = FIRST_TABLE.matcher(prompt);
        String sql;
        if (!matcher.find()) {
            sql = "SELECT 1";
        } else if (prompt.contains("Aggregate with COUNT")) {
            sql = "SELECT COUNT(*) AS row_count FROM " + matcher.group(1);
        } else {
            sql = "SELECT * FROM " + matcher.group(1) + " LIMIT 10";
        }
        return "[mocked answer]\n```sql\n" + sql + "\n```";
    }
}
