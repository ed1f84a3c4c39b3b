package ch.so.arp.rag.text2sql.query;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A condition spelled out in the question, such as {@code 金额大于100}. The
 * field is the wording of the question and not necessarily a column name.
 */
public record ComparisonFilter(String field, Operator operator, String value) {

    public ComparisonFilter {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public String describe() {
        return field + " " + operator.symbol() + " " + value;
    }

    public enum Operator {
        GT("gt", ">"),
        GTE("gte", ">="),
        LT("lt", "<"),
        LTE("lte", "<="),
        EQ("eq", "="),
        NE("ne", "<>"),
        IN("in", "IN"),
        NOT_IN("not_in", "NOT IN");

        private final String label;
        private final String symbol;

        Operator(String label, String symbol) {
            this.label = label;
            this.symbol = symbol;
        }

        @JsonValue
        public String label() {
            return label;
        }

        public String symbol() {
            return symbol;
        }
    }
}
