package ch.so.arp.rag.text2sql.generation;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke an OpenAI compatible API or return predictable responses for testing.
 */
@FunctionalInterface
public interface LlmClient {

    /**
     * Complete the prompt.
     *
     * @param prompt the full prompt text
     * @param options sampling parameters
     * @return the generated text
     * @throws LlmServiceException if the service fails, {@link LlmTimeoutException} on timeout
     */
    String complete(String prompt, GenerationOptions options);
}
