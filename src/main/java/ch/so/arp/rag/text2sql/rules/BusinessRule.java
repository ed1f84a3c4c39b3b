package ch.so.arp.rag.text2sql.rules;

import java.util.Locale;
import java.util.Objects;

/**
 * A single piece of user supplied domain knowledge. Rules are keyed by
 * {@code (scope, kind, key)}; the scope is either {@value #GENERAL_SCOPE} or
 * the name of the table the rule belongs to.
 */
public record BusinessRule(String scope, RuleKind kind, String key, String value) {

    public static final String GENERAL_SCOPE = "general";

    public BusinessRule {
        scope = scope == null || scope.isBlank() ? GENERAL_SCOPE : scope.trim();
        Objects.requireNonNull(kind, "kind");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Business rule key must not be blank");
        }
        key = key.trim();
        value = value == null ? "" : value.trim();
    }

    public static BusinessRule general(RuleKind kind, String key, String value) {
        return new BusinessRule(GENERAL_SCOPE, kind, key, value);
    }

    public static BusinessRule forTable(String table, RuleKind kind, String key, String value) {
        return new BusinessRule(table, kind, key, value);
    }

    public boolean isGeneral() {
        return GENERAL_SCOPE.equalsIgnoreCase(scope);
    }

    public Id id() {
        return new Id(scope.toLowerCase(Locale.ROOT), kind, key.toLowerCase(Locale.ROOT));
    }

    /**
     * Identity of a rule; a later rule with the same id replaces the earlier one.
     */
    public record Id(String scope, RuleKind kind, String key) {
    }
}
