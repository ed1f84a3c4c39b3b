package ch.so.arp.rag.text2sql.knowledge;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Vector index over {@link KnowledgeChunk knowledge chunks}. Chunks are keyed
 * by id; upserting a chunk with a known id replaces it as a whole, so readers
 * never observe a partially written chunk.
 */
public interface KnowledgeBase {

    /**
     * Prepare the backing store. Called before the first write; implementations
     * that need no setup keep the default.
     */
    default void initialize() {
    }

    /**
     * Insert or replace the given chunks. Every chunk must carry an embedding.
     */
    void upsert(Collection<KnowledgeChunk> chunks);

    /**
     * Delete every chunk whose source table is {@code tableName}.
     *
     * @return the number of deleted chunks
     */
    int delete(String tableName);

    boolean deleteById(String id);

    /**
     * Similarity search by cosine score, highest first, ties broken by chunk id.
     */
    List<ScoredChunk> search(float[] queryVector, int topK, ChunkFilter filter);

    Optional<KnowledgeChunk> findById(String id);

    /**
     * All chunks ordered by id.
     */
    List<KnowledgeChunk> list();

    int count();

    /**
     * Names of the source tables that currently have at least one chunk.
     */
    Set<String> tableNames();

    void clear();

    /**
     * Replace the complete content of the index with the given chunks.
     */
    void replaceAll(Collection<KnowledgeChunk> chunks);

    default boolean isEmpty() {
        return count() == 0;
    }

    static void requireEmbedded(Collection<KnowledgeChunk> chunks) {
        for (KnowledgeChunk chunk : chunks) {
            if (!chunk.hasEmbedding()) {
                throw new KnowledgeBaseException("Chunk " + chunk.id() + " has no embedding");
            }
        }
    }
}
