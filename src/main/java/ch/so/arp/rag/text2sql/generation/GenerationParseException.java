package ch.so.arp.rag.text2sql.generation;

import ch.so.arp.rag.text2sql.Text2SqlException;

/**
 * No single SQL statement could be isolated from a model response.
 */
public class GenerationParseException extends Text2SqlException {

    private final String rawOutput;

    public GenerationParseException(String message, String rawOutput) {
        super(message);
        this.rawOutput = rawOutput;
    }

    public String getRawOutput() {
        return rawOutput;
    }
}
