package ch.so.arp.rag.text2sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import com.fasterxml.jackson.databind.json.JsonMapper;

import ch.so.arp.rag.text2sql.generation.GenerationOptions;
import ch.so.arp.rag.text2sql.generation.LlmClient;
import ch.so.arp.rag.text2sql.generation.SqlDialect;
import ch.so.arp.rag.text2sql.generation.SqlExtractor;
import ch.so.arp.rag.text2sql.generation.SqlGenerator;
import ch.so.arp.rag.text2sql.knowledge.BuildReport;
import ch.so.arp.rag.text2sql.knowledge.DeterministicEmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.InMemoryKnowledgeBase;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseBuilder;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseSnapshotCodec;
import ch.so.arp.rag.text2sql.knowledge.TableChunker;
import ch.so.arp.rag.text2sql.metadata.JdbcMetadataExtractor;
import ch.so.arp.rag.text2sql.metadata.TableMetadata;
import ch.so.arp.rag.text2sql.query.ContextRetriever;
import ch.so.arp.rag.text2sql.query.PromptBuilder;
import ch.so.arp.rag.text2sql.query.QueryAnalyzer;
import ch.so.arp.rag.text2sql.query.RetrievedChunk;
import ch.so.arp.rag.text2sql.query.TokenCounter;
import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.BusinessRuleStore;
import ch.so.arp.rag.text2sql.rules.RuleKind;
import ch.so.arp.rag.text2sql.validation.CancellationToken;
import ch.so.arp.rag.text2sql.validation.JdbcSqlExecutor;
import ch.so.arp.rag.text2sql.validation.SqlRepairLoop;
import ch.so.arp.rag.text2sql.validation.SqlStatementValidator;
import ch.so.arp.rag.text2sql.validation.ValidationOutcome;

class Text2SqlServiceTest {

    private static final String COUNT_PER_USER =
            "```sql\nSELECT user_id, COUNT(*) AS order_count FROM orders GROUP BY user_id ORDER BY user_id\n```";

    private final Deque<String> answers = new ArrayDeque<>();
    private final List<String> prompts = new ArrayList<>();

    private InMemoryKnowledgeBase knowledgeBase;
    private BusinessRuleStore ruleStore;
    private Text2SqlService service;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:service-" + System.nanoTime() + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource("db/shop.sql"));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);

        Text2SqlProperties properties = new Text2SqlProperties();
        properties.getRetrieval().setScoreThreshold(-1.0d);
        knowledgeBase = new InMemoryKnowledgeBase();
        ruleStore = new BusinessRuleStore(List.of(BusinessRule.general(RuleKind.METRIC, "GMV",
                "SUM(orders.payment_amount) of paid orders")));
        service = createService(dataSource, properties);
    }

    private Text2SqlService createService(DataSource dataSource, Text2SqlProperties properties) {
        JdbcMetadataExtractor extractor = new JdbcMetadataExtractor(dataSource, null);
        DeterministicEmbeddingProvider embeddings = new DeterministicEmbeddingProvider(1024);
        KnowledgeBaseBuilder builder = new KnowledgeBaseBuilder(extractor, ruleStore, new TableChunker(), embeddings,
                knowledgeBase, Runnable::run, 4);
        LlmClient llm = (prompt, options) -> {
            prompts.add(prompt);
            String next = answers.poll();
            return next == null ? "no more answers" : next;
        };
        SqlGenerator generator = new SqlGenerator(llm, new SqlExtractor(), GenerationOptions.defaults(),
                SqlDialect.MYSQL);
        SqlStatementValidator validator = new SqlStatementValidator(SqlDialect.MYSQL);
        SqlRepairLoop loop = new SqlRepairLoop(generator, validator, new JdbcSqlExecutor(dataSource, 100, null),
                new PromptBuilder(SqlDialect.MYSQL, 3000, true, new TokenCounter()), 3, true);
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
        return new Text2SqlService(builder, knowledgeBase, ruleStore, extractor, new QueryAnalyzer(clock),
                new ContextRetriever(embeddings, knowledgeBase), loop, validator,
                new KnowledgeBaseSnapshotCodec(JsonMapper.builder().findAndAddModules().build()), embeddings,
                properties);
    }

    @Test
    void buildsKnowledgeBaseFromDatabase() {
        BuildReport report = service.build(false, List.of());

        assertThat(report.skipped()).isFalse();
        assertThat(report.tables()).isEqualTo(2);
        assertThat(report.verified()).isTrue();
        assertThat(knowledgeBase.tableNames()).contains("orders", "users");

        assertThat(service.build(false, null).skipped()).isTrue();
    }

    @Test
    void answersCountPerUser() {
        service.build(false, List.of());
        answers.add(COUNT_PER_USER);

        QueryResult result = service.query("统计每个用户的订单数量", true);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.outcome().label()).isEqualTo("success");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.finalSql()).startsWith("SELECT user_id, COUNT(*)");
        assertThat(result.result().rowCount()).isEqualTo(3);
        assertThat(result.result().columns()).containsExactly("user_id", "order_count");
        assertThat(result.intermediate()).isNotNull();
        assertThat(result.intermediate().retrievedChunks()).extracting(RetrievedChunk::tableName).contains("orders");
        assertThat(prompts.get(0)).contains("# Table: orders").contains("**GMV**");
    }

    @Test
    void answersCurrentMonthGmvWithMetricRule() {
        service.build(false, List.of());
        answers.add("```sql\nSELECT SUM(payment_amount) AS gmv FROM orders WHERE order_status = 2 "
                + "AND created_at >= '2024-03-01' AND created_at < '2024-04-01'\n```");

        QueryResult result = service.query("本月GMV是多少", true);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(prompts.get(0)).contains("**GMV**").contains("SUM(orders.payment_amount) of paid orders")
                .contains("2024-03-01");
        assertThat(result.intermediate().intent().timeRange().start()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(result.finalSql()).contains("SUM(payment_amount)").contains("created_at >= '2024-03-01'")
                .contains("created_at < '2024-04-01'");
        assertThat(result.result().columns()).containsExactly("gmv");
        assertThat(((Number) result.result().rows().get(0).get(0)).doubleValue()).isEqualTo(150.5d);
    }

    @Test
    void intermediateArtifactsOnlyOnRequest() {
        service.build(false, List.of());
        answers.add(COUNT_PER_USER);

        assertThat(service.query("统计每个用户的订单数量", false).intermediate()).isNull();
    }

    @Test
    void repairsSyntaxError() {
        service.build(false, List.of());
        answers.add("```sql\nSELECT user_id, FROM orders\n```");
        answers.add(COUNT_PER_USER);

        QueryResult result = service.query("统计每个用户的订单数量", false);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(prompts.get(1)).contains("## Previous attempt failed").contains("syntax_error")
                .contains("Error position: line 1, column ");
    }

    @Test
    void repairsExecutionError() {
        service.build(false, List.of());
        answers.add("```sql\nSELECT SUM(amount) FROM orders\n```");
        answers.add("```sql\nSELECT SUM(payment_amount) AS total FROM orders\n```");

        QueryResult result = service.query("订单总金额是多少", false);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(prompts.get(1)).contains("execution_error").contains("SELECT SUM(amount) FROM orders");
    }

    @Test
    void reportsLastFailureWhenBudgetIsExhausted() {
        service.build(false, List.of());
        answers.add("```sql\nSELECT missing FROM orders\n```");
        answers.add("```sql\nSELECT missing FROM orders\n```");
        answers.add("```sql\nSELECT missing FROM orders\n```");

        QueryResult result = service.query("统计每个用户的订单数量", false);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.outcome()).isEqualTo(QueryOutcome.EXECUTION_ERROR);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.finalSql()).isNull();
        assertThat(result.lastCandidate()).isEqualTo("SELECT missing FROM orders");
        assertThat(result.lastOutcome().message()).isNotBlank();
    }

    @Test
    void rejectsWritingStatement() {
        service.build(false, List.of());
        answers.add("```sql\nDELETE FROM orders\n```");

        QueryResult result = service.query("删除所有订单", false);

        assertThat(result.outcome()).isEqualTo(QueryOutcome.POLICY_VIOLATION);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.finalSql()).isNull();
        assertThat(service.validate("SELECT COUNT(*) FROM orders").isSuccess()).isTrue();
    }

    @Test
    void cancelledQueryMakesNoModelCall() {
        service.build(false, List.of());
        CancellationToken token = new CancellationToken();
        token.cancel();

        QueryResult result = service.query("统计每个用户的订单数量", false, token);

        assertThat(result.outcome()).isEqualTo(QueryOutcome.CANCELLED);
        assertThat(result.lastCandidate()).isNull();
        assertThat(prompts).isEmpty();
    }

    @Test
    void rejectsBlankQuestion() {
        assertThatThrownBy(() -> service.query(" ", false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validatesWithoutExecuting() {
        ValidationOutcome outcome = service.validate("UPDATE orders SET order_status = 3");

        assertThat(outcome.kind()).isEqualTo(ValidationOutcome.Kind.POLICY_VIOLATION);
    }

    @Test
    void describesSchema() {
        assertThat(service.describeSchema()).extracting(TableMetadata::name).containsExactly("orders", "users");
        assertThat(service.describeTable("ORDERS")).get().extracting(TableMetadata::comment).isEqualTo("订单表");
        assertThat(service.describeTable("payments")).isEmpty();
    }

    @Test
    void addedRuleReachesNextBuild() {
        service.build(false, List.of());

        assertThat(service.addBusinessRule(BusinessRule.forTable("orders", RuleKind.SYNONYM, "orders", "购买记录")))
                .isEmpty();
        assertThat(service.addBusinessRule(BusinessRule.forTable("orders", RuleKind.SYNONYM, "orders", "订购")))
                .isPresent();
        BuildReport report = service.build(true, List.of());

        assertThat(report.embedded()).isGreaterThanOrEqualTo(1);
        assertThat(knowledgeBase.list()).filteredOn(chunk -> "orders".equals(chunk.tableName()))
                .singleElement().satisfies(chunk -> assertThat(chunk.text()).contains("订购"));
        assertThat(service.businessRules()).hasSize(2);
    }

    @Test
    void exportsAndImportsKnowledgeBase() {
        service.build(false, List.of());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        service.exportKnowledgeBase(out);
        int exported = knowledgeBase.count();

        knowledgeBase.clear();
        assertThat(knowledgeBase.isEmpty()).isTrue();
        int imported = service.importKnowledgeBase(new ByteArrayInputStream(out.toByteArray()));

        assertThat(imported).isEqualTo(exported);
        assertThat(service.exportKnowledgeBase().chunks()).hasSize(exported);
    }

    @Test
    void reportsStats() {
        service.build(false, List.of());

        KnowledgeBaseStats stats = service.stats();

        assertThat(stats.tables()).contains("orders", "users");
        assertThat(stats.chunks()).isGreaterThanOrEqualTo(2);
        assertThat(stats.businessRules()).isEqualTo(1);
        assertThat(stats.embeddingModel()).isEqualTo("deterministic-1024");
        assertThat(stats.dialect()).isEqualTo(SqlDialect.MYSQL);
        assertThat(stats.maxAttempts()).isEqualTo(3);
        assertThat(stats.executionEnabled()).isTrue();
    }
}
