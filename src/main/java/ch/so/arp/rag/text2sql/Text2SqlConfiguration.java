package ch.so.arp.rag.text2sql;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import ch.so.arp.rag.text2sql.generation.GenerationOptions;
import ch.so.arp.rag.text2sql.generation.LlmClient;
import ch.so.arp.rag.text2sql.generation.MockLlmClient;
import ch.so.arp.rag.text2sql.generation.OpenAiLlmClient;
import ch.so.arp.rag.text2sql.generation.SqlExtractor;
import ch.so.arp.rag.text2sql.generation.SqlGenerator;
import ch.so.arp.rag.text2sql.knowledge.DeterministicEmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.EmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.InMemoryKnowledgeBase;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBase;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseBuilder;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseSnapshotCodec;
import ch.so.arp.rag.text2sql.knowledge.OpenAiEmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.PostgresKnowledgeBase;
import ch.so.arp.rag.text2sql.knowledge.TableChunker;
import ch.so.arp.rag.text2sql.metadata.JdbcMetadataExtractor;
import ch.so.arp.rag.text2sql.metadata.MetadataExtractor;
import ch.so.arp.rag.text2sql.metadata.SchemaFileMetadataExtractor;
import ch.so.arp.rag.text2sql.query.ContextRetriever;
import ch.so.arp.rag.text2sql.query.PromptBuilder;
import ch.so.arp.rag.text2sql.query.QueryAnalyzer;
import ch.so.arp.rag.text2sql.query.TokenCounter;
import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.BusinessRuleStore;
import ch.so.arp.rag.text2sql.rules.BusinessRulesDocumentReader;
import ch.so.arp.rag.text2sql.validation.JdbcSqlExecutor;
import ch.so.arp.rag.text2sql.validation.SqlExecutor;
import ch.so.arp.rag.text2sql.validation.SqlRepairLoop;
import ch.so.arp.rag.text2sql.validation.SqlStatementValidator;
import ch.so.arp.rag.text2sql.validation.ValidationOutcome;

/**
 * Central configuration wiring the text-to-SQL components together. The
 * {@code mock-openai} and {@code mock-vector-store} toggles decide whether
 * deterministic doubles or the real infrastructure are used.
 */
@Configuration
@EnableConfigurationProperties({ Text2SqlProperties.class, OpenAiClientProperties.class })
public class Text2SqlConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(Text2SqlConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "embeddingExecutor")
    public ExecutorService embeddingExecutor(Text2SqlProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getKnowledgeBase().getEmbeddingThreads(), runnable -> {
            Thread thread = new Thread(runnable, "embedding-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.text2sql.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.text2sql.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new OpenAiLlmClient(restClientBuilder(properties, restClientBuilder), properties.getBaseUrl(),
                properties.getApiKey(), properties.getModel());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.text2sql.mock-openai", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(Text2SqlProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getKnowledgeBase().getMockEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.text2sql.mock-openai", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new OpenAiEmbeddingProvider(restClientBuilder(properties, restClientBuilder), properties.getBaseUrl(),
                properties.getApiKey(), properties.getEmbeddingModel(), properties.getEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.text2sql.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public KnowledgeBase inMemoryKnowledgeBase() {
        return new InMemoryKnowledgeBase();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.text2sql.mock-vector-store", havingValue = "false")
    public KnowledgeBase postgresKnowledgeBase(JdbcClient jdbcClient,
            ObjectProvider<PlatformTransactionManager> transactionManager, ObjectProvider<ObjectMapper> objectMapper) {
        PlatformTransactionManager manager = transactionManager.getIfAvailable();
        TransactionOperations transactions = manager != null
                ? new TransactionTemplate(manager)
                : TransactionOperations.withoutTransaction();
        return new PostgresKnowledgeBase(jdbcClient, transactions, objectMapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataExtractor metadataExtractor(Text2SqlProperties properties, ObjectProvider<DataSource> dataSource,
            ResourceLoader resourceLoader, ObjectProvider<ObjectMapper> objectMapper) {
        Text2SqlProperties.Metadata metadata = properties.getMetadata();
        switch (metadata.getSource()) {
            case SCHEMA_FILE:
                if (metadata.getSchemaFile() == null || metadata.getSchemaFile().isBlank()) {
                    throw new IllegalStateException(
                            "rag.text2sql.metadata.schema-file is required when the metadata source is schema-file");
                }
                return new SchemaFileMetadataExtractor(resourceLoader.getResource(metadata.getSchemaFile()),
                        objectMapper(objectMapper));
            case JDBC:
            default:
                DataSource source = dataSource.getIfAvailable();
                if (source == null) {
                    throw new IllegalStateException("A DataSource is required when the metadata source is jdbc");
                }
                return new JdbcMetadataExtractor(source, metadata.getSchema());
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public BusinessRuleStore businessRuleStore(Text2SqlProperties properties, ResourceLoader resourceLoader,
            ObjectProvider<ObjectMapper> objectMapper) {
        String location = properties.getKnowledgeBase().getBusinessRulesLocation();
        if (location == null || location.isBlank()) {
            return new BusinessRuleStore();
        }
        List<BusinessRule> rules = new BusinessRulesDocumentReader(objectMapper(objectMapper))
                .read(resourceLoader.getResource(location));
        LOGGER.info("Loaded {} business rules from {}", rules.size(), location);
        return new BusinessRuleStore(rules);
    }

    @Bean
    public TableChunker tableChunker() {
        return new TableChunker();
    }

    @Bean
    public KnowledgeBaseBuilder knowledgeBaseBuilder(MetadataExtractor extractor, BusinessRuleStore ruleStore,
            TableChunker chunker, EmbeddingProvider embeddingProvider, KnowledgeBase knowledgeBase,
            ExecutorService embeddingExecutor, Text2SqlProperties properties) {
        return new KnowledgeBaseBuilder(extractor, ruleStore, chunker, embeddingProvider, knowledgeBase,
                embeddingExecutor, properties.getKnowledgeBase().getEmbeddingBatchSize());
    }

    @Bean
    public KnowledgeBaseSnapshotCodec knowledgeBaseSnapshotCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new KnowledgeBaseSnapshotCodec(objectMapper(objectMapper));
    }

    @Bean
    public QueryAnalyzer queryAnalyzer(Clock clock) {
        return new QueryAnalyzer(clock);
    }

    @Bean
    public ContextRetriever contextRetriever(EmbeddingProvider embeddingProvider, KnowledgeBase knowledgeBase,
            Text2SqlProperties properties) {
        return new ContextRetriever(embeddingProvider, knowledgeBase, properties.getRetrieval().getRelatedTables());
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenCounter tokenCounter() {
        return new TokenCounter();
    }

    @Bean
    public PromptBuilder promptBuilder(Text2SqlProperties properties, TokenCounter tokenCounter) {
        return new PromptBuilder(properties.getDialect(), properties.getPrompt().getTokenBudget(),
                properties.getPrompt().isFewShotExamples(), tokenCounter);
    }

    @Bean
    public SqlGenerator sqlGenerator(LlmClient llmClient, Text2SqlProperties properties,
            OpenAiClientProperties openAiProperties) {
        GenerationOptions options = new GenerationOptions(openAiProperties.getTemperature(),
                openAiProperties.getMaxTokens());
        return new SqlGenerator(llmClient, new SqlExtractor(), options, properties.getDialect());
    }

    @Bean
    public SqlStatementValidator sqlStatementValidator(Text2SqlProperties properties) {
        return new SqlStatementValidator(properties.getDialect());
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlExecutor sqlExecutor(ObjectProvider<DataSource> dataSource, Text2SqlProperties properties) {
        DataSource source = dataSource.getIfAvailable();
        if (source == null) {
            LOGGER.warn("No DataSource available, generated SQL cannot be executed");
            return sql -> ValidationOutcome.executionError("No target database is configured");
        }
        Text2SqlProperties.Validation validation = properties.getValidation();
        return new JdbcSqlExecutor(source, validation.getMaxRows(), validation.getExecutionTimeout());
    }

    @Bean
    public SqlRepairLoop sqlRepairLoop(SqlGenerator generator, SqlStatementValidator validator, SqlExecutor executor,
            PromptBuilder promptBuilder, Text2SqlProperties properties) {
        return new SqlRepairLoop(generator, validator, executor, promptBuilder,
                properties.getValidation().getMaxAttempts(), properties.getValidation().isExecute());
    }

    @Bean
    public Text2SqlService text2SqlService(KnowledgeBaseBuilder builder, KnowledgeBase knowledgeBase,
            BusinessRuleStore ruleStore, MetadataExtractor extractor, QueryAnalyzer analyzer,
            ContextRetriever retriever, SqlRepairLoop repairLoop, SqlStatementValidator validator,
            KnowledgeBaseSnapshotCodec snapshotCodec, EmbeddingProvider embeddingProvider,
            Text2SqlProperties properties) {
        return new Text2SqlService(builder, knowledgeBase, ruleStore, extractor, analyzer, retriever, repairLoop,
                validator, snapshotCodec, embeddingProvider, properties);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.text2sql.knowledge-base.build-on-startup", havingValue = "true")
    public ApplicationRunner knowledgeBaseStartupBuild(Text2SqlService service) {
        return args -> service.build(false, List.of());
    }

    private static RestClient.Builder restClientBuilder(OpenAiClientProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return restClientBuilder.getIfAvailable(RestClient::builder).clone().requestFactory(requestFactory);
    }

    private static ObjectMapper objectMapper(ObjectProvider<ObjectMapper> objectMapper) {
        return objectMapper.getIfAvailable(() -> JsonMapper.builder().findAndAddModules().build());
    }
}
