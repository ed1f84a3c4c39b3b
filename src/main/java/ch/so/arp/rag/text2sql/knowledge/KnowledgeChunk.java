package ch.so.arp.rag.text2sql.knowledge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A retrievable document of schema and business knowledge. The id is derived
 * from the table name and chunk kind so that a rebuild replaces the previous
 * version of the chunk instead of adding a second one.
 *
 * <p>The embedding is {@code null} until the chunk has been embedded; only
 * embedded chunks can be stored in a {@link KnowledgeBase}.
 */
public record KnowledgeChunk(
        String id,
        String tableName,
        String text,
        @JsonIgnore float[] embedding,
        Map<String, String> metadata) {

    public static final String KIND_TABLE = "table";
    public static final String KIND_BUSINESS_RULES = "business_rules";

    public static final String META_KIND = "kind";
    public static final String META_TABLE_NAME = "table_name";
    public static final String META_COLUMNS = "columns";
    public static final String META_PRIMARY_KEY = "primary_key";
    public static final String META_FOREIGN_KEYS = "foreign_keys";
    public static final String META_DOMAIN = "domain";

    public static final String BUSINESS_RULES_ID = "business_rules";

    public KnowledgeChunk {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Chunk id must not be blank");
        }
        Objects.requireNonNull(text, "text");
        embedding = embedding == null ? null : embedding.clone();
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static String tableChunkId(String tableName) {
        return "table_" + tableName;
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    public String kind() {
        return metadata.getOrDefault(META_KIND, KIND_TABLE);
    }

    /**
     * Tables this table points to through its foreign keys, in key order and
     * without duplicates.
     */
    public List<String> referencedTables() {
        String keys = metadata.get(META_FOREIGN_KEYS);
        if (keys == null || keys.isBlank()) {
            return List.of();
        }
        List<String> tables = new ArrayList<>();
        for (String key : keys.split(",")) {
            int arrow = key.indexOf("->");
            if (arrow < 0) {
                continue;
            }
            String target = key.substring(arrow + 2).trim();
            int dot = target.lastIndexOf('.');
            String table = dot > 0 ? target.substring(0, dot) : target;
            if (!table.isEmpty() && !tables.contains(table)) {
                tables.add(table);
            }
        }
        return tables;
    }

    public KnowledgeChunk withEmbedding(float[] vector) {
        return new KnowledgeChunk(id, tableName, text, vector, metadata);
    }

    /**
     * Whether both chunks carry the same id, table, text and metadata,
     * ignoring the embedding.
     */
    public boolean sameContent(KnowledgeChunk other) {
        return other != null && id.equals(other.id) && Objects.equals(tableName, other.tableName)
                && text.equals(other.text) && metadata.equals(other.metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KnowledgeChunk other)) {
            return false;
        }
        return sameContent(other) && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tableName, text, metadata) * 31 + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "KnowledgeChunk[id=" + id + ", tableName=" + tableName + ", textLength=" + text.length()
                + ", dimensions=" + (embedding == null ? 0 : embedding.length) + ", metadata=" + metadata + "]";
    }
}
