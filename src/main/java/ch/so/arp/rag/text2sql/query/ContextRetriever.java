package ch.so.arp.rag.text2sql.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.text2sql.knowledge.ChunkFilter;
import ch.so.arp.rag.text2sql.knowledge.EmbeddingProvider;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBase;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeChunk;
import ch.so.arp.rag.text2sql.knowledge.ScoredChunk;
import ch.so.arp.rag.text2sql.knowledge.VectorMath;

/**
 * Selects the table chunks for a question. Candidates come from a similarity
 * search with the question and, in hybrid mode, a second search with the
 * intent-enhanced query. Candidates below the score threshold are dropped
 * unless the question names their table; named tables are always included and
 * ranked first. Tables joined to the selected ones by a foreign key follow the
 * ranked chunks, up to {@code relatedTables} of them, even when their own
 * score is below the threshold.
 */
public class ContextRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextRetriever.class);

    static final Comparator<RetrievedChunk> ORDER = Comparator
            .comparing((RetrievedChunk chunk) -> !chunk.pinned())
            .thenComparing(Comparator.comparingDouble(RetrievedChunk::score).reversed())
            .thenComparing(RetrievedChunk::id);

    private final EmbeddingProvider embeddingProvider;
    private final KnowledgeBase knowledgeBase;
    private final int relatedTables;

    public ContextRetriever(EmbeddingProvider embeddingProvider, KnowledgeBase knowledgeBase) {
        this(embeddingProvider, knowledgeBase, 2);
    }

    public ContextRetriever(EmbeddingProvider embeddingProvider, KnowledgeBase knowledgeBase, int relatedTables) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
        if (relatedTables < 0) {
            throw new IllegalArgumentException("relatedTables must not be negative");
        }
        this.relatedTables = relatedTables;
    }

    /**
     * Retrieve at most {@code topK} chunks, or more if more tables are pinned,
     * plus the tables related to them by foreign keys.
     */
    public RetrievedContext retrieve(QueryIntent intent, int topK, double scoreThreshold, boolean hybridSearch) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        ChunkFilter tablesOnly = ChunkFilter.kind(KnowledgeChunk.KIND_TABLE);
        float[] questionVector = embeddingProvider.embed(intent.question());

        Map<String, ScoredChunk> candidates = new LinkedHashMap<>();
        knowledgeBase.search(questionVector, topK, tablesOnly).forEach(scored -> merge(candidates, scored));
        if (hybridSearch && !intent.enhancedQuery().equals(intent.question())) {
            float[] enhancedVector = embeddingProvider.embed(intent.enhancedQuery());
            knowledgeBase.search(enhancedVector, topK, tablesOnly).forEach(scored -> merge(candidates, scored));
        }
        LOGGER.debug("Similarity search returned {} candidates: {}", candidates.size(), candidates.keySet());

        Set<String> pinnedTables = intent.pinnedTables();
        Map<String, RetrievedChunk> selected = new LinkedHashMap<>();
        for (ScoredChunk scored : candidates.values()) {
            boolean pinned = isPinned(scored.chunk(), pinnedTables);
            if (pinned || scored.score() >= scoreThreshold) {
                selected.put(scored.id(), new RetrievedChunk(scored.chunk(), scored.score(), pinned));
            }
        }
        int pinnedCount = 0;
        for (String table : pinnedTables) {
            String id = KnowledgeChunk.tableChunkId(table);
            if (!selected.containsKey(id)) {
                Optional<KnowledgeChunk> chunk = knowledgeBase.findById(id);
                if (chunk.isPresent() && chunk.get().hasEmbedding()) {
                    double score = VectorMath.cosine(questionVector, chunk.get().embedding());
                    selected.put(id, new RetrievedChunk(chunk.get(), score, true));
                } else {
                    LOGGER.debug("Question names table {} but the knowledge base has no chunk for it", table);
                    continue;
                }
            }
            pinnedCount++;
        }

        int limit = Math.max(topK, pinnedCount);
        List<RetrievedChunk> ranked = new ArrayList<>(selected.values());
        ranked.sort(ORDER);
        List<RetrievedChunk> core = new ArrayList<>(ranked.subList(0, Math.min(limit, ranked.size())));
        core.addAll(related(core, candidates.values(), questionVector));
        RetrievedContext context = new RetrievedContext(core);
        LOGGER.debug("Retrieved context {} (pinned {})", context.chunkIds(), pinnedTables);
        return context;
    }

    /**
     * Tables referenced by the selected chunks come first, then candidates
     * that reference a selected table. Both groups keep the selection order.
     */
    private List<RetrievedChunk> related(List<RetrievedChunk> selected, Collection<ScoredChunk> candidates,
            float[] questionVector) {
        if (relatedTables == 0 || selected.isEmpty()) {
            return List.of();
        }
        Set<String> present = new HashSet<>();
        selected.forEach(chunk -> present.add(chunk.id()));
        Map<String, RetrievedChunk> related = new LinkedHashMap<>();
        for (RetrievedChunk chunk : selected) {
            for (String table : chunk.chunk().referencedTables()) {
                String id = KnowledgeChunk.tableChunkId(table);
                if (related.size() < relatedTables && !present.contains(id) && !related.containsKey(id)) {
                    knowledgeBase.findById(id)
                            .filter(KnowledgeChunk::hasEmbedding)
                            .ifPresent(found -> related.put(id, new RetrievedChunk(found,
                                    VectorMath.cosine(questionVector, found.embedding()), false)));
                }
            }
        }
        for (ScoredChunk candidate : candidates) {
            if (related.size() >= relatedTables) {
                break;
            }
            String id = candidate.id();
            if (present.contains(id) || related.containsKey(id)) {
                continue;
            }
            boolean referencesSelected = candidate.chunk().referencedTables().stream()
                    .anyMatch(table -> selected.stream().anyMatch(chunk -> table.equalsIgnoreCase(chunk.tableName())));
            if (referencesSelected) {
                related.put(id, new RetrievedChunk(candidate.chunk(), candidate.score(), false));
            }
        }
        if (!related.isEmpty()) {
            LOGGER.debug("Added tables related by foreign keys: {}", related.keySet());
        }
        return new ArrayList<>(related.values());
    }

    private void merge(Map<String, ScoredChunk> candidates, ScoredChunk scored) {
        candidates.merge(scored.id(), scored, (left, right) -> left.score() >= right.score() ? left : right);
    }

    private boolean isPinned(KnowledgeChunk chunk, Set<String> pinnedTables) {
        return chunk.tableName() != null
                && pinnedTables.stream().anyMatch(table -> table.equalsIgnoreCase(chunk.tableName()));
    }
}
