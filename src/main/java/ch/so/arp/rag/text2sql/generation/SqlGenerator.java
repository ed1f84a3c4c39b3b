package ch.so.arp.rag.text2sql.generation;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a prompt into a {@link SqlCandidate} with exactly one model call.
 * Retries are left to the repair loop.
 */
public class SqlGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlGenerator.class);

    private final LlmClient llmClient;
    private final SqlExtractor extractor;
    private final GenerationOptions options;
    private final SqlDialect dialect;

    public SqlGenerator(LlmClient llmClient, SqlExtractor extractor, GenerationOptions options, SqlDialect dialect) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.options = Objects.requireNonNull(options, "options");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    /**
     * @throws GenerationParseException if the response holds no single SQL statement
     * @throws LlmServiceException if the model call fails
     */
    public SqlCandidate generate(String prompt, int attempt) {
        String raw = llmClient.complete(prompt, options);
        SqlExtractor.Extraction extraction = extractor.extract(raw);
        if (!extraction.isFound()) {
            LOGGER.debug("Attempt {}: no SQL extracted ({}): {}", attempt, extraction.status(), extraction.reason());
            throw new GenerationParseException(extraction.reason(), raw);
        }
        LOGGER.debug("Attempt {}: extracted SQL {}", attempt, extraction.sql());
        return new SqlCandidate(raw, extraction.sql(), dialect, attempt);
    }

    public SqlDialect dialect() {
        return dialect;
    }
}
