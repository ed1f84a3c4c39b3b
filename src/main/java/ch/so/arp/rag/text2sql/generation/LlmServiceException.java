package ch.so.arp.rag.text2sql.generation;

import ch.so.arp.rag.text2sql.Text2SqlException;

/**
 * Raised when the language model service cannot be reached or answers with an
 * error.
 */
public class LlmServiceException extends Text2SqlException {

    public LlmServiceException(String message) {
        super(message);
    }

    public LlmServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
