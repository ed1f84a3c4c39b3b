package ch.so.arp.rag.text2sql.rules;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of domain knowledge a {@link BusinessRule} can carry.
 */
public enum RuleKind {

    /** Natural-language definition of a business term. */
    TERM("term"),
    /** Named metric, usually an aggregate SQL expression. */
    METRIC("metric"),
    /** Meaning of the coded values of a column. */
    ENUM_VALUE("enum_value"),
    /** Derived value expressed as a SQL fragment. */
    CALCULATION("calculation"),
    /** Comma separated alternative names for a table or column. */
    SYNONYM("synonym");

    private final String label;

    RuleKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static RuleKind fromLabel(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.label.equals(normalized) || kind.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown rule kind '" + value + "'"));
    }
}
