package ch.so.arp.rag.text2sql.query;

import java.util.Objects;

import ch.so.arp.rag.text2sql.knowledge.KnowledgeChunk;

/**
 * A chunk selected for a question.
 *
 * @param chunk the knowledge chunk
 * @param score cosine similarity between question and chunk
 * @param pinned whether the chunk was included because the question named its table
 */
public record RetrievedChunk(KnowledgeChunk chunk, double score, boolean pinned) {

    public RetrievedChunk {
        Objects.requireNonNull(chunk, "chunk");
    }

    public String id() {
        return chunk.id();
    }

    public String tableName() {
        return chunk.tableName();
    }
}
