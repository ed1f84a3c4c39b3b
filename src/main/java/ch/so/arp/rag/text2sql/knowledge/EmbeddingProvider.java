package ch.so.arp.rag.text2sql.knowledge;

import java.util.List;

/**
 * Strategy abstraction used to compute embeddings for chunk texts and
 * questions. Implementations can either call a remote embedding API or provide
 * deterministic vectors that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws EmbeddingServiceException if the service fails
     */
    float[] embed(String text);

    /**
     * Embed several texts at once. The returned list has the same size and
     * order as {@code texts}.
     */
    default List<float[]> embedBatch(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }

    /**
     * Length of the vectors this provider returns. The default embeds a short
     * text once to find out.
     */
    default int dimensions() {
        return embed("dimensions").length;
    }

    /**
     * Identifies the model so that vectors of different models are not mixed.
     */
    String modelId();
}
