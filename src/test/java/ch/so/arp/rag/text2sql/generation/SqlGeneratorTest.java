package ch.so.arp.rag.text2sql.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class SqlGeneratorTest {

    @Test
    void wrapsExtractedStatementInCandidate() {
        AtomicInteger calls = new AtomicInteger();
        LlmClient llmClient = (prompt, options) -> {
            calls.incrementAndGet();
            assertThat(options.temperature()).isZero();
            return "```sql\nSELECT 1;\n```";
        };
        SqlGenerator generator = new SqlGenerator(llmClient, new SqlExtractor(), GenerationOptions.defaults(),
                SqlDialect.H2);

        SqlCandidate candidate = generator.generate("prompt", 2);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(candidate.sql()).isEqualTo("SELECT 1");
        assertThat(candidate.rawOutput()).isEqualTo("```sql\nSELECT 1;\n```");
        assertThat(candidate.dialect()).isEqualTo(SqlDialect.H2);
        assertThat(candidate.attempt()).isEqualTo(2);
    }

    @Test
    void unparsableResponseRaisesParseExceptionWithRawOutput() {
        SqlGenerator generator = new SqlGenerator((prompt, options) -> "Sorry, no idea.", new SqlExtractor(),
                GenerationOptions.defaults(), SqlDialect.MYSQL);

        assertThatThrownBy(() -> generator.generate("prompt", 1))
                .isInstanceOfSatisfying(GenerationParseException.class,
                        ex -> assertThat(ex.getRawOutput()).isEqualTo("Sorry, no idea."));
    }

    @Test
    void mockClientQueriesFirstTableOfContext() {
        MockLlmClient client = new MockLlmClient();

        assertThat(client.complete("## Schema context\n<!-- x -->\n# Table: orders\n...", GenerationOptions.defaults()))
                .contains("SELECT * FROM orders LIMIT 10");
        assertThat(client.complete("# Table: orders\n- Aggregate with COUNT(...).", GenerationOptions.defaults()))
                .contains("SELECT COUNT(*) AS row_count FROM orders");
        assertThat(client.complete("no tables", GenerationOptions.defaults())).contains("SELECT 1");
    }
}
