package ch.so.arp.rag.text2sql.knowledge;

import ch.so.arp.rag.text2sql.Text2SqlException;

/**
 * Raised when the embedding service cannot produce a vector. A chunk that
 * failed to embed is never stored with a placeholder vector.
 */
public class EmbeddingServiceException extends Text2SqlException {

    public EmbeddingServiceException(String message) {
        super(message);
    }

    public EmbeddingServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
