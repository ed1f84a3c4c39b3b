package ch.so.arp.rag.text2sql.rules;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import ch.so.arp.rag.text2sql.metadata.ColumnMetadata;
import ch.so.arp.rag.text2sql.metadata.Identifiers;
import ch.so.arp.rag.text2sql.metadata.TableMetadata;

/**
 * Holds business rules keyed by scope, kind and key. Writes are last-one-wins
 * and keep no history. Safe for concurrent use.
 */
public class BusinessRuleStore {

    private static final Comparator<BusinessRule> ORDER = Comparator
            .comparing((BusinessRule rule) -> rule.isGeneral() ? "" : rule.scope().toLowerCase(Locale.ROOT))
            .thenComparing(BusinessRule::kind)
            .thenComparing(rule -> rule.key().toLowerCase(Locale.ROOT));

    private final ConcurrentMap<BusinessRule.Id, BusinessRule> rules = new ConcurrentHashMap<>();

    public BusinessRuleStore() {
    }

    public BusinessRuleStore(Collection<BusinessRule> initialRules) {
        putAll(initialRules);
    }

    /**
     * Store the rule, replacing any rule with the same scope, kind and key.
     *
     * @return the replaced rule, if any
     */
    public Optional<BusinessRule> put(BusinessRule rule) {
        return Optional.ofNullable(rules.put(rule.id(), rule));
    }

    public void putAll(Collection<BusinessRule> newRules) {
        newRules.forEach(this::put);
    }

    public Optional<BusinessRule> find(String scope, RuleKind kind, String key) {
        return Optional.ofNullable(rules.get(new BusinessRule(scope, kind, key, "").id()));
    }

    public List<BusinessRule> all() {
        return rules.values().stream().sorted(ORDER).toList();
    }

    public List<BusinessRule> general() {
        return rules.values().stream().filter(BusinessRule::isGeneral).sorted(ORDER).toList();
    }

    public List<BusinessRule> general(RuleKind kind) {
        return general().stream().filter(rule -> rule.kind() == kind).toList();
    }

    public List<BusinessRule> forTable(String table) {
        return rules.values().stream()
                .filter(rule -> !rule.isGeneral() && rule.scope().equalsIgnoreCase(table))
                .sorted(ORDER)
                .toList();
    }

    /**
     * Rules that belong in the knowledge chunk of the given table: every rule
     * scoped to the table, plus every general rule whose key or value names the
     * table or one of its columns as a whole identifier.
     */
    public List<BusinessRule> applicableTo(TableMetadata table) {
        return rules.values().stream()
                .filter(rule -> rule.isGeneral() ? mentionsTable(rule, table) : rule.scope().equalsIgnoreCase(table.name()))
                .sorted(ORDER)
                .toList();
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public void clear() {
        rules.clear();
    }

    private boolean mentionsTable(BusinessRule rule, TableMetadata table) {
        String text = rule.key() + " " + rule.value();
        if (Identifiers.mentions(text, table.name())) {
            return true;
        }
        for (ColumnMetadata column : table.columns()) {
            if (Identifiers.mentions(text, column.name())) {
                return true;
            }
        }
        return false;
    }
}
