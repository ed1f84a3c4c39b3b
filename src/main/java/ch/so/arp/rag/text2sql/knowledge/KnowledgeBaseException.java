package ch.so.arp.rag.text2sql.knowledge;

import ch.so.arp.rag.text2sql.Text2SqlException;

/**
 * Raised when chunks cannot be persisted, or a snapshot cannot be read or
 * written.
 */
public class KnowledgeBaseException extends Text2SqlException {

    public KnowledgeBaseException(String message) {
        super(message);
    }

    public KnowledgeBaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
