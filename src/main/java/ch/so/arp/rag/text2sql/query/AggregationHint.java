package ch.so.arp.rag.text2sql.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate function suggested by the wording of a question.
 */
public enum AggregationHint {

    SUM("sum"),
    AVG("avg"),
    MAX("max"),
    MIN("min"),
    COUNT("count");

    private final String label;

    AggregationHint(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String sqlFunction() {
        return name();
    }
}
