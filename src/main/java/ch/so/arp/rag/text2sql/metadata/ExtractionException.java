package ch.so.arp.rag.text2sql.metadata;

import ch.so.arp.rag.text2sql.Text2SqlException;

/**
 * Raised when the metadata source cannot be reached or its schema cannot be
 * read. A build that hits this error publishes nothing.
 */
public class ExtractionException extends Text2SqlException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
