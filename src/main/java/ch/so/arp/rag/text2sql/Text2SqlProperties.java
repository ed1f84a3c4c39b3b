package ch.so.arp.rag.text2sql;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import ch.so.arp.rag.text2sql.generation.SqlDialect;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Settings of the text-to-SQL engine. Bound once at startup and passed to the
 * components through their constructors.
 */
@Validated
@ConfigurationProperties(prefix = "rag.text2sql")
public class Text2SqlProperties {

    /**
     * SQL dialect generated statements must conform to.
     */
    @NotNull
    private SqlDialect dialect = SqlDialect.MYSQL;

    /**
     * Use a deterministic language model and embedding double instead of the
     * OpenAI API.
     */
    private boolean mockOpenai = true;

    /**
     * Keep the knowledge base in memory instead of a pgvector table.
     */
    private boolean mockVectorStore = true;

    @Valid
    private final Retrieval retrieval = new Retrieval();

    @Valid
    private final Prompt prompt = new Prompt();

    @Valid
    private final Validation validation = new Validation();

    @Valid
    private final KnowledgeBase knowledgeBase = new KnowledgeBase();

    @Valid
    private final Metadata metadata = new Metadata();

    public SqlDialect getDialect() {
        return dialect;
    }

    public void setDialect(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public boolean isMockOpenai() {
        return mockOpenai;
    }

    public void setMockOpenai(boolean mockOpenai) {
        this.mockOpenai = mockOpenai;
    }

    public boolean isMockVectorStore() {
        return mockVectorStore;
    }

    public void setMockVectorStore(boolean mockVectorStore) {
        this.mockVectorStore = mockVectorStore;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Prompt getPrompt() {
        return prompt;
    }

    public Validation getValidation() {
        return validation;
    }

    public KnowledgeBase getKnowledgeBase() {
        return knowledgeBase;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public static class Retrieval {

        /**
         * Number of chunks retrieved per question, not counting extra pinned tables.
         */
        @Min(1)
        private int topK = 3;

        /**
         * Minimum cosine score of a chunk that was not named in the question.
         */
        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double scoreThreshold = 0.5d;

        /**
         * Also search with the intent-enhanced query and merge the results.
         */
        private boolean hybridSearch = true;

        /**
         * Tables added through foreign keys of the retrieved tables, 0 disables the expansion.
         */
        @Min(0)
        private int relatedTables = 2;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getScoreThreshold() {
            return scoreThreshold;
        }

        public void setScoreThreshold(double scoreThreshold) {
            this.scoreThreshold = scoreThreshold;
        }

        public boolean isHybridSearch() {
            return hybridSearch;
        }

        public void setHybridSearch(boolean hybridSearch) {
            this.hybridSearch = hybridSearch;
        }

        public int getRelatedTables() {
            return relatedTables;
        }

        public void setRelatedTables(int relatedTables) {
            this.relatedTables = relatedTables;
        }
    }

    public static class Prompt {

        /**
         * Token budget of the schema context section.
         */
        @Min(1)
        private int tokenBudget = 3000;

        private boolean fewShotExamples = true;

        public int getTokenBudget() {
            return tokenBudget;
        }

        public void setTokenBudget(int tokenBudget) {
            this.tokenBudget = tokenBudget;
        }

        public boolean isFewShotExamples() {
            return fewShotExamples;
        }

        public void setFewShotExamples(boolean fewShotExamples) {
            this.fewShotExamples = fewShotExamples;
        }
    }

    public static class Validation {

        /**
         * Maximum number of generator calls per question, the first one included.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Execute validated statements. When false only syntax and policy are checked.
         */
        private boolean execute = true;

        @Min(1)
        private int maxRows = 100;

        private Duration executionTimeout = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public boolean isExecute() {
            return execute;
        }

        public void setExecute(boolean execute) {
            this.execute = execute;
        }

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }

        public Duration getExecutionTimeout() {
            return executionTimeout;
        }

        public void setExecutionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
        }
    }

    public static class KnowledgeBase {

        @Min(1)
        private int embeddingBatchSize = 16;

        /**
         * Threads used to embed batches in parallel during a build.
         */
        @Min(1)
        private int embeddingThreads = 4;

        /**
         * Dimensions of the deterministic embeddings used with mocks.
         */
        @Min(1)
        private int mockEmbeddingDimensions = 1024;

        /**
         * Optional JSON or YAML document with business rules loaded at startup.
         */
        private String businessRulesLocation;

        /**
         * Build the knowledge base when the application starts.
         */
        private boolean buildOnStartup = false;

        public int getEmbeddingBatchSize() {
            return embeddingBatchSize;
        }

        public void setEmbeddingBatchSize(int embeddingBatchSize) {
            this.embeddingBatchSize = embeddingBatchSize;
        }

        public int getEmbeddingThreads() {
            return embeddingThreads;
        }

        public void setEmbeddingThreads(int embeddingThreads) {
            this.embeddingThreads = embeddingThreads;
        }

        public int getMockEmbeddingDimensions() {
            return mockEmbeddingDimensions;
        }

        public void setMockEmbeddingDimensions(int mockEmbeddingDimensions) {
            this.mockEmbeddingDimensions = mockEmbeddingDimensions;
        }

        public String getBusinessRulesLocation() {
            return businessRulesLocation;
        }

        public void setBusinessRulesLocation(String businessRulesLocation) {
            this.businessRulesLocation = businessRulesLocation;
        }

        public boolean isBuildOnStartup() {
            return buildOnStartup;
        }

        public void setBuildOnStartup(boolean buildOnStartup) {
            this.buildOnStartup = buildOnStartup;
        }
    }

    public static class Metadata {

        public enum Source {
            JDBC,
            SCHEMA_FILE
        }

        @NotNull
        private Source source = Source.JDBC;

        /**
         * Schema to read with the JDBC source; the connection default when unset.
         */
        private String schema;

        /**
         * JSON schema description used with the {@code SCHEMA_FILE} source.
         */
        private String schemaFile;

        public Source getSource() {
            return source;
        }

        public void setSource(Source source) {
            this.source = source;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public String getSchemaFile() {
            return schemaFile;
        }

        public void setSchemaFile(String schemaFile) {
            this.schemaFile = schemaFile;
        }
    }
}
