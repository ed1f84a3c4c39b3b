package ch.so.arp.rag.text2sql.generation;

/**
 * The language model did not answer within the configured read timeout.
 */
public class LlmTimeoutException extends LlmServiceException {

    public LlmTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
