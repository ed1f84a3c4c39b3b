package ch.so.arp.rag.text2sql.knowledge;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.text2sql.metadata.MetadataExtractor;
import ch.so.arp.rag.text2sql.metadata.TableMetadata;
import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.BusinessRuleStore;

/**
 * Offline pipeline that turns database metadata and business rules into an
 * embedded, searchable knowledge base.
 *
 * <p>Extraction, chunking and embedding all finish before the index is
 * touched, so a failing build leaves the previous content in place. The index
 * is then updated in place: the new set is upserted first, stale chunks are
 * deleted afterwards and every chunk is checked to rank first for its own
 * vector. Stored vectors are reused only when their text and their dimension
 * still match the active embedding model.
 */
public class KnowledgeBaseBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeBaseBuilder.class);

    private static final double SELF_MATCH_TOLERANCE = 1.0e-6;

    private final MetadataExtractor extractor;
    private final BusinessRuleStore ruleStore;
    private final TableChunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final KnowledgeBase knowledgeBase;
    private final Executor embeddingExecutor;
    private final int batchSize;
    private final ReentrantLock buildLock = new ReentrantLock();
    private int providerDimensions = -1;

    public KnowledgeBaseBuilder(MetadataExtractor extractor, BusinessRuleStore ruleStore, TableChunker chunker,
            EmbeddingProvider embeddingProvider, KnowledgeBase knowledgeBase, Executor embeddingExecutor,
            int batchSize) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.ruleStore = Objects.requireNonNull(ruleStore, "ruleStore");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
        this.embeddingExecutor = Objects.requireNonNull(embeddingExecutor, "embeddingExecutor");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
    }

    /**
     * Build or refresh the knowledge base.
     *
     * @param force rebuild even when the index already holds chunks
     * @param additionalRules rules used for this build and kept in the rule store once it succeeded, may be empty
     * @return what the build did
     */
    public BuildReport build(boolean force, Collection<BusinessRule> additionalRules) {
        buildLock.lock();
        try {
            knowledgeBase.initialize();
            if (!force && !knowledgeBase.isEmpty()) {
                int existing = knowledgeBase.count();
                LOGGER.info("Knowledge base already holds {} chunks, skipping build", existing);
                return BuildReport.skipped(existing);
            }
            return rebuild(additionalRules == null ? List.of() : additionalRules);
        } finally {
            buildLock.unlock();
        }
    }

    /**
     * Replace the whole index with imported chunks. Runs under the build lock
     * so it never interleaves with a build.
     *
     * @throws KnowledgeBaseException if the vectors were made by a model of another dimension
     */
    public void importChunks(List<KnowledgeChunk> chunks) {
        buildLock.lock();
        try {
            if (!chunks.isEmpty()) {
                int expected = providerDimensions();
                for (KnowledgeChunk chunk : chunks) {
                    int length = chunk.hasEmbedding() ? chunk.embedding().length : 0;
                    if (length != expected) {
                        throw new KnowledgeBaseException("Chunk " + chunk.id() + " has " + length
                                + " dimensions but " + embeddingProvider.modelId() + " produces " + expected);
                    }
                }
            }
            knowledgeBase.initialize();
            knowledgeBase.replaceAll(chunks);
            LOGGER.info("Imported {} chunks into the knowledge base", chunks.size());
        } finally {
            buildLock.unlock();
        }
    }

    private BuildReport rebuild(Collection<BusinessRule> additionalRules) {
        long start = System.nanoTime();
        LOGGER.info("Knowledge base build started");
        try {
            List<TableMetadata> tables = extractor.extract();
            BusinessRuleStore effectiveRules = new BusinessRuleStore(ruleStore.all());
            effectiveRules.putAll(additionalRules);
            List<KnowledgeChunk> rendered = chunker.chunk(tables, effectiveRules);
            LOGGER.debug("Rendered {} chunks for {} tables", rendered.size(), tables.size());

            EmbeddedChunks embedded = embed(rendered);
            knowledgeBase.upsert(embedded.chunks());

            Set<String> currentTables = new TreeSet<>();
            tables.forEach(table -> currentTables.add(table.name()));
            List<String> removedTables = new ArrayList<>();
            for (String table : knowledgeBase.tableNames()) {
                if (!currentTables.contains(table)) {
                    knowledgeBase.delete(table);
                    removedTables.add(table);
                }
            }
            Set<String> newIds = new TreeSet<>();
            embedded.chunks().forEach(chunk -> newIds.add(chunk.id()));
            List<String> removedIds = new ArrayList<>();
            for (KnowledgeChunk existing : knowledgeBase.list()) {
                if (!newIds.contains(existing.id()) && knowledgeBase.deleteById(existing.id())) {
                    removedIds.add(existing.id());
                }
            }
            if (!removedTables.isEmpty()) {
                LOGGER.info("Removed chunks of vanished tables {}", removedTables);
            }

            ruleStore.putAll(additionalRules);
            List<String> failures = verifySelfMatch(embedded.chunks());

            BuildReport report = new BuildReport(false, tables.size(), embedded.chunks().size(),
                    embedded.freshlyEmbedded(), removedTables, removedIds, failures,
                    Duration.ofNanos(System.nanoTime() - start));
            if (report.verified()) {
                LOGGER.info("Knowledge base build finished: {} tables, {} chunks, {} embedded in {} ms",
                        report.tables(), report.chunks(), report.embedded(), report.elapsed().toMillis());
            } else {
                LOGGER.warn("Knowledge base build finished but self-match failed for {}", failures);
            }
            return report;
        } catch (RuntimeException ex) {
            LOGGER.error("Knowledge base build aborted: {}", ex.getMessage());
            throw ex;
        }
    }

    /**
     * Embed every chunk whose content changed. Chunks identical to the stored
     * version keep their vector as long as it has the provider's dimension; the
     * rest are embedded in parallel batches and put back into input order.
     */
    private EmbeddedChunks embed(List<KnowledgeChunk> rendered) {
        Map<Integer, KnowledgeChunk> result = new LinkedHashMap<>();
        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < rendered.size(); i++) {
            KnowledgeChunk chunk = rendered.get(i);
            Optional<KnowledgeChunk> stored = knowledgeBase.findById(chunk.id());
            if (stored.isPresent() && stored.get().hasEmbedding() && stored.get().sameContent(chunk)
                    && stored.get().embedding().length == providerDimensions()) {
                result.put(i, stored.get());
            } else {
                pending.add(i);
            }
        }

        List<CompletableFuture<List<float[]>>> batches = new ArrayList<>();
        List<List<Integer>> batchIndexes = new ArrayList<>();
        for (int from = 0; from < pending.size(); from += batchSize) {
            List<Integer> indexes = pending.subList(from, Math.min(from + batchSize, pending.size()));
            List<String> texts = indexes.stream().map(index -> rendered.get(index).text()).toList();
            batchIndexes.add(indexes);
            batches.add(CompletableFuture.supplyAsync(() -> embeddingProvider.embedBatch(texts), embeddingExecutor));
        }

        for (int b = 0; b < batches.size(); b++) {
            List<float[]> vectors = join(batches.get(b));
            List<Integer> indexes = batchIndexes.get(b);
            if (vectors.size() != indexes.size()) {
                throw new EmbeddingServiceException("Embedding batch returned " + vectors.size()
                        + " vectors for " + indexes.size() + " texts");
            }
            for (int k = 0; k < indexes.size(); k++) {
                int index = indexes.get(k);
                result.put(index, rendered.get(index).withEmbedding(vectors.get(k)));
            }
        }

        List<KnowledgeChunk> ordered = new ArrayList<>(rendered.size());
        for (int i = 0; i < rendered.size(); i++) {
            ordered.add(result.get(i));
        }
        return new EmbeddedChunks(ordered, pending.size());
    }

    private int providerDimensions() {
        if (providerDimensions < 0) {
            providerDimensions = embeddingProvider.dimensions();
        }
        return providerDimensions;
    }

    private List<float[]> join(CompletableFuture<List<float[]>> batch) {
        try {
            return batch.join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof EmbeddingServiceException embeddingFailure) {
                throw embeddingFailure;
            }
            throw new EmbeddingServiceException("Embedding batch failed: " + cause.getMessage(), cause);
        }
    }

    private List<String> verifySelfMatch(List<KnowledgeChunk> chunks) {
        List<String> failures = new ArrayList<>();
        for (KnowledgeChunk chunk : chunks) {
            List<ScoredChunk> top = knowledgeBase.search(chunk.embedding(), 1, ChunkFilter.none());
            if (top.isEmpty()) {
                failures.add(chunk.id());
                continue;
            }
            ScoredChunk best = top.get(0);
            if (!best.id().equals(chunk.id())) {
                double own = VectorMath.cosine(chunk.embedding(), chunk.embedding());
                if (best.score() > own + SELF_MATCH_TOLERANCE) {
                    failures.add(chunk.id());
                }
            }
        }
        return failures;
    }

    private record EmbeddedChunks(List<KnowledgeChunk> chunks, int freshlyEmbedded) {
    }
}
