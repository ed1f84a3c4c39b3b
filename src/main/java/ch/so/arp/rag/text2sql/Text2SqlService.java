package ch.so.arp.rag.text2sql;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.text2sql.generation.SqlCandidate;
import ch.so.arp.rag.text2sql.knowledge.BuildReport;
import ch.so.arp.rag.text2sql.knowledge.EmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBase;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseBuilder;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseSnapshotCodec;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeChunk;
import ch.so.arp.rag.text2sql.metadata.MetadataExtractor;
import ch.so.arp.rag.text2sql.metadata.TableMetadata;
import ch.so.arp.rag.text2sql.query.ContextRetriever;
import ch.so.arp.rag.text2sql.query.QueryAnalyzer;
import ch.so.arp.rag.text2sql.query.QueryIntent;
import ch.so.arp.rag.text2sql.query.RetrievedContext;
import ch.so.arp.rag.text2sql.query.SchemaVocabulary;
import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.BusinessRuleStore;
import ch.so.arp.rag.text2sql.validation.CancellationToken;
import ch.so.arp.rag.text2sql.validation.ExecutionResult;
import ch.so.arp.rag.text2sql.validation.RepairLoopResult;
import ch.so.arp.rag.text2sql.validation.SqlRepairLoop;
import ch.so.arp.rag.text2sql.validation.SqlStatementValidator;
import ch.so.arp.rag.text2sql.validation.ValidationOutcome;

/**
 * Entry point of the engine: builds the knowledge base offline and answers
 * questions online.
 */
public class Text2SqlService {

    private static final Logger LOGGER = LoggerFactory.getLogger(Text2SqlService.class);

    private final KnowledgeBaseBuilder builder;
    private final KnowledgeBase knowledgeBase;
    private final BusinessRuleStore ruleStore;
    private final MetadataExtractor extractor;
    private final QueryAnalyzer analyzer;
    private final ContextRetriever retriever;
    private final SqlRepairLoop repairLoop;
    private final SqlStatementValidator validator;
    private final KnowledgeBaseSnapshotCodec snapshotCodec;
    private final EmbeddingProvider embeddingProvider;
    private final Text2SqlProperties properties;

    private volatile SchemaVocabulary vocabulary;

    public Text2SqlService(KnowledgeBaseBuilder builder, KnowledgeBase knowledgeBase, BusinessRuleStore ruleStore,
            MetadataExtractor extractor, QueryAnalyzer analyzer, ContextRetriever retriever,
            SqlRepairLoop repairLoop, SqlStatementValidator validator, KnowledgeBaseSnapshotCodec snapshotCodec,
            EmbeddingProvider embeddingProvider, Text2SqlProperties properties) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
        this.ruleStore = Objects.requireNonNull(ruleStore, "ruleStore");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.repairLoop = Objects.requireNonNull(repairLoop, "repairLoop");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.snapshotCodec = Objects.requireNonNull(snapshotCodec, "snapshotCodec");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Build the knowledge base.
     *
     * @param force rebuild even if the index already holds chunks
     * @param rules additional business rules, may be {@code null}
     */
    public BuildReport build(boolean force, Collection<BusinessRule> rules) {
        BuildReport report = builder.build(force, rules == null ? List.of() : rules);
        vocabulary = null;
        return report;
    }

    public QueryResult query(String question, boolean showIntermediate) {
        return query(question, showIntermediate, new CancellationToken());
    }

    /**
     * Answer a question. Failures the repair loop can handle are reported in
     * the result; only service failures are thrown.
     */
    public QueryResult query(String question, boolean showIntermediate, CancellationToken cancellation) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        if (knowledgeBase.isEmpty()) {
            LOGGER.warn("Answering a question with an empty knowledge base; build it first");
        }
        QueryIntent intent = analyzer.analyze(question, vocabulary());
        RetrievedContext context = retriever.retrieve(intent, properties.getRetrieval().getTopK(),
                properties.getRetrieval().getScoreThreshold(), properties.getRetrieval().isHybridSearch());
        RepairLoopResult loop = repairLoop.run(intent, context, ruleStore.general(), vocabulary(), cancellation);

        ValidationOutcome lastOutcome = loop.lastOutcome().orElse(null);
        QueryOutcome outcome = QueryOutcome.of(loop.state(), lastOutcome);
        String lastCandidate = loop.lastCandidate().map(this::candidateText).orElse(null);
        String finalSql = outcome == QueryOutcome.SUCCESS ? lastCandidate : null;
        ExecutionResult result = outcome == QueryOutcome.SUCCESS && lastOutcome != null ? lastOutcome.result() : null;
        QueryArtifacts artifacts = showIntermediate
                ? new QueryArtifacts(intent, context.chunks(), loop.prompts(), loop.history())
                : null;

        if (outcome == QueryOutcome.SUCCESS) {
            LOGGER.info("Answered question after {} attempt(s) using tables {}", loop.attempts(),
                    context.tableNames());
        } else {
            LOGGER.info("Question ended with {} after {} attempt(s)", outcome.label(), loop.attempts());
        }
        return new QueryResult(question, finalSql, outcome, loop.attempts(), lastCandidate, lastOutcome, result,
                artifacts);
    }

    /**
     * Check syntax and the read-only policy without executing.
     */
    public ValidationOutcome validate(String sql) {
        return validator.check(sql, vocabulary());
    }

    public List<TableMetadata> describeSchema() {
        return extractor.extract();
    }

    public Optional<TableMetadata> describeTable(String table) {
        return extractor.extract().stream().filter(metadata -> metadata.name().equalsIgnoreCase(table)).findFirst();
    }

    /**
     * Store a rule. Chunks pick it up on the next build.
     *
     * @return the rule that was replaced, if any
     */
    public Optional<BusinessRule> addBusinessRule(BusinessRule rule) {
        Optional<BusinessRule> previous = ruleStore.put(rule);
        LOGGER.info("{} {} rule '{}' for scope {}", previous.isPresent() ? "Replaced" : "Added",
                rule.kind().label(), rule.key(), rule.scope());
        return previous;
    }

    public List<BusinessRule> businessRules() {
        return ruleStore.all();
    }

    public KnowledgeBaseSnapshotCodec.Snapshot exportKnowledgeBase() {
        return snapshotCodec.toSnapshot(knowledgeBase.list());
    }

    public void exportKnowledgeBase(OutputStream out) {
        snapshotCodec.write(knowledgeBase.list(), out);
    }

    /**
     * Replace the knowledge base with a snapshot.
     *
     * @return number of imported chunks
     */
    public int importKnowledgeBase(KnowledgeBaseSnapshotCodec.Snapshot snapshot) {
        return importChunks(snapshotCodec.fromSnapshot(snapshot));
    }

    public int importKnowledgeBase(InputStream in) {
        return importChunks(snapshotCodec.read(in));
    }

    private int importChunks(List<KnowledgeChunk> chunks) {
        builder.importChunks(chunks);
        vocabulary = null;
        return chunks.size();
    }

    public KnowledgeBaseStats stats() {
        return new KnowledgeBaseStats(knowledgeBase.count(), new ArrayList<>(knowledgeBase.tableNames()),
                ruleStore.size(), embeddingProvider.modelId(), properties.getDialect(),
                repairLoop.maxAttempts(), repairLoop.executes());
    }

    private SchemaVocabulary vocabulary() {
        SchemaVocabulary current = vocabulary;
        if (current == null) {
            current = SchemaVocabulary.fromChunks(knowledgeBase.list());
            vocabulary = current;
        }
        return current;
    }

    private String candidateText(SqlCandidate candidate) {
        return candidate.hasSql() ? candidate.sql() : candidate.rawOutput();
    }
}
