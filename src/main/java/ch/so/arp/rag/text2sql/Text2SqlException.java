package ch.so.arp.rag.text2sql;

/**
 * Base class of all failures raised by the text-to-SQL engine. Recoverable
 * validation problems are reported as values and never use this hierarchy.
 */
public class Text2SqlException extends RuntimeException {

    public Text2SqlException(String message) {
        super(message);
    }

    public Text2SqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
