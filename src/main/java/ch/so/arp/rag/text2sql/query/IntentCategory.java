package ch.so.arp.rag.text2sql.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of what a question asks for.
 */
public enum IntentCategory {

    AGGREGATION("aggregation"),
    EXTREME("extreme"),
    AVERAGE("average"),
    RANKING("ranking"),
    TREND("trend"),
    PROPORTION("proportion"),
    SIMPLE("simple");

    private final String label;

    IntentCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
