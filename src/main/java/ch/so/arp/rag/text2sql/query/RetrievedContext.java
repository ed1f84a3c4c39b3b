package ch.so.arp.rag.text2sql.query;

import java.util.List;
import java.util.Objects;

/**
 * Ranked, de-duplicated chunks for one question: pinned chunks first, then by
 * descending score, ties by chunk id. Tables added through foreign keys come
 * last.
 */
public record RetrievedContext(List<RetrievedChunk> chunks) {

    public RetrievedContext {
        chunks = List.copyOf(chunks);
    }

    public static RetrievedContext empty() {
        return new RetrievedContext(List.of());
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int size() {
        return chunks.size();
    }

    public List<String> tableNames() {
        return chunks.stream().map(RetrievedChunk::tableName).filter(Objects::nonNull).toList();
    }

    public List<String> chunkIds() {
        return chunks.stream().map(RetrievedChunk::id).toList();
    }

    public boolean contains(String chunkId) {
        return chunks.stream().anyMatch(chunk -> chunk.id().equals(chunkId));
    }
}
