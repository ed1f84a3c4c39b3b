package ch.so.arp.rag.text2sql.knowledge;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads and writes portable knowledge base snapshots of the form
 * {@code {"chunks":[{"id","tableName","text","embedding","metadata"}]}}.
 * The order of chunks carries no meaning; ids must be unique.
 */
public class KnowledgeBaseSnapshotCodec {

    private final ObjectMapper objectMapper;

    public KnowledgeBaseSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public void write(List<KnowledgeChunk> chunks, OutputStream out) {
        List<SnapshotChunk> entries = chunks.stream().map(SnapshotChunk::of).toList();
        try {
            objectMapper.writeValue(out, new Snapshot(entries));
        } catch (IOException ex) {
            throw new KnowledgeBaseException("Knowledge base snapshot could not be written", ex);
        }
    }

    public Snapshot toSnapshot(List<KnowledgeChunk> chunks) {
        return new Snapshot(chunks.stream().map(SnapshotChunk::of).toList());
    }

    public List<KnowledgeChunk> read(InputStream in) {
        Snapshot snapshot;
        try {
            snapshot = objectMapper.readValue(in, Snapshot.class);
        } catch (IOException ex) {
            throw new KnowledgeBaseException("Knowledge base snapshot is not readable: " + ex.getMessage(), ex);
        }
        return fromSnapshot(snapshot);
    }

    /**
     * Validate a snapshot and convert it to chunks.
     *
     * @throws KnowledgeBaseException if ids repeat, an entry lacks a vector or
     *         the vectors differ in length
     */
    public List<KnowledgeChunk> fromSnapshot(Snapshot snapshot) {
        if (snapshot == null || snapshot.chunks() == null) {
            throw new KnowledgeBaseException("Knowledge base snapshot has no 'chunks' array");
        }
        Set<String> seen = new HashSet<>();
        List<KnowledgeChunk> chunks = new ArrayList<>(snapshot.chunks().size());
        int dimensions = -1;
        for (SnapshotChunk entry : snapshot.chunks()) {
            if (entry.id() == null || entry.id().isBlank()) {
                throw new KnowledgeBaseException("Snapshot entry without id");
            }
            if (!seen.add(entry.id())) {
                throw new KnowledgeBaseException("Duplicate chunk id '" + entry.id() + "' in snapshot");
            }
            if (entry.embedding() == null || entry.embedding().length == 0) {
                throw new KnowledgeBaseException("Chunk '" + entry.id() + "' has no embedding");
            }
            if (dimensions >= 0 && entry.embedding().length != dimensions) {
                throw new KnowledgeBaseException("Chunk '" + entry.id() + "' has " + entry.embedding().length
                        + " dimensions, expected " + dimensions);
            }
            dimensions = entry.embedding().length;
            chunks.add(new KnowledgeChunk(entry.id(), entry.tableName(), entry.text() == null ? "" : entry.text(),
                    entry.embedding(), entry.metadata()));
        }
        return chunks;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Snapshot(List<SnapshotChunk> chunks) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SnapshotChunk(String id, String tableName, String text, float[] embedding,
            Map<String, String> metadata) {

        static SnapshotChunk of(KnowledgeChunk chunk) {
            return new SnapshotChunk(chunk.id(), chunk.tableName(), chunk.text(), chunk.embedding(), chunk.metadata());
        }
    }
}
