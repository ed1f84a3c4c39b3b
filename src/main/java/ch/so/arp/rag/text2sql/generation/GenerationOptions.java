package ch.so.arp.rag.text2sql.generation;

/**
 * Sampling parameters for one completion.
 *
 * @param temperature creativity of the model, 0 for the most deterministic output
 * @param maxTokens maximum number of tokens the model may generate
 */
public record GenerationOptions(double temperature, int maxTokens) {

    public GenerationOptions {
        if (temperature < 0) {
            throw new IllegalArgumentException("temperature must not be negative");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(0.0d, 1024);
    }
}
