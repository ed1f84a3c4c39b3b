package ch.so.arp.rag.text2sql.knowledge;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Knowledge base held in a concurrent map with an exhaustive cosine scan.
 * Chunks are immutable, so concurrent searches during a rebuild see either the
 * old or the new version of a chunk.
 */
public class InMemoryKnowledgeBase implements KnowledgeBase {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryKnowledgeBase.class);

    private volatile ConcurrentMap<String, KnowledgeChunk> chunks = new ConcurrentHashMap<>();

    @Override
    public void upsert(Collection<KnowledgeChunk> newChunks) {
        KnowledgeBase.requireEmbedded(newChunks);
        newChunks.forEach(chunk -> chunks.put(chunk.id(), chunk));
        LOGGER.debug("Upserted {} chunks, index now holds {}", newChunks.size(), chunks.size());
    }

    @Override
    public int delete(String tableName) {
        int before = chunks.size();
        chunks.values().removeIf(chunk -> Objects.equals(chunk.tableName(), tableName));
        return before - chunks.size();
    }

    @Override
    public boolean deleteById(String id) {
        return chunks.remove(id) != null;
    }

    @Override
    public List<ScoredChunk> search(float[] queryVector, int topK, ChunkFilter filter) {
        Objects.requireNonNull(queryVector, "queryVector");
        if (topK <= 0) {
            return List.of();
        }
        ChunkFilter effective = filter == null ? ChunkFilter.none() : filter;
        return chunks.values().stream()
                .filter(effective::matches)
                .map(chunk -> new ScoredChunk(chunk, VectorMath.cosine(queryVector, chunk.embedding())))
                .sorted(ScoredChunk.RANKING)
                .limit(topK)
                .toList();
    }

    @Override
    public Optional<KnowledgeChunk> findById(String id) {
        return Optional.ofNullable(chunks.get(id));
    }

    @Override
    public List<KnowledgeChunk> list() {
        return chunks.values().stream().sorted(Comparator.comparing(KnowledgeChunk::id)).toList();
    }

    @Override
    public int count() {
        return chunks.size();
    }

    @Override
    public Set<String> tableNames() {
        Set<String> names = new TreeSet<>();
        chunks.values().stream()
                .map(KnowledgeChunk::tableName)
                .filter(Objects::nonNull)
                .forEach(names::add);
        return names;
    }

    @Override
    public void clear() {
        chunks.clear();
    }

    @Override
    public void replaceAll(Collection<KnowledgeChunk> newChunks) {
        KnowledgeBase.requireEmbedded(newChunks);
        ConcurrentMap<String, KnowledgeChunk> replacement = new ConcurrentHashMap<>();
        newChunks.forEach(chunk -> replacement.put(chunk.id(), chunk));
        chunks = replacement;
        LOGGER.info("Replaced knowledge base content with {} chunks", replacement.size());
    }
}
