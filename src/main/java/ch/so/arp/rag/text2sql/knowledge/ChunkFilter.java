package ch.so.arp.rag.text2sql.knowledge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equality filter over chunk metadata. Every entry must match for a chunk to
 * pass; the empty filter matches everything.
 */
public record ChunkFilter(Map<String, String> equalTo) {

    private static final ChunkFilter NONE = new ChunkFilter(Map.of());

    public ChunkFilter {
        equalTo = equalTo == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(equalTo));
    }

    public static ChunkFilter none() {
        return NONE;
    }

    public static ChunkFilter kind(String kind) {
        return new ChunkFilter(Map.of(KnowledgeChunk.META_KIND, kind));
    }

    public static ChunkFilter table(String tableName) {
        return new ChunkFilter(Map.of(KnowledgeChunk.META_TABLE_NAME, tableName));
    }

    public ChunkFilter and(String key, String value) {
        Map<String, String> combined = new LinkedHashMap<>(equalTo);
        combined.put(key, value);
        return new ChunkFilter(combined);
    }

    public boolean isEmpty() {
        return equalTo.isEmpty();
    }

    public boolean matches(KnowledgeChunk chunk) {
        for (Map.Entry<String, String> entry : equalTo.entrySet()) {
            String actual = KnowledgeChunk.META_KIND.equals(entry.getKey()) ? chunk.kind()
                    : chunk.metadata().get(entry.getKey());
            if (!entry.getValue().equals(actual)) {
                return false;
            }
        }
        return true;
    }
}
