package ch.so.arp.rag.text2sql.knowledge;

import java.util.Comparator;
import java.util.Objects;

/**
 * A chunk returned by a similarity search together with its cosine score.
 */
public record ScoredChunk(KnowledgeChunk chunk, double score) {

    /** Highest score first, ties broken by chunk id. */
    public static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparing(scored -> scored.chunk().id());

    public ScoredChunk {
        Objects.requireNonNull(chunk, "chunk");
    }

    public String id() {
        return chunk.id();
    }
}
