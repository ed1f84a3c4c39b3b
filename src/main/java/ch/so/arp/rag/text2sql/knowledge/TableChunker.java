package ch.so.arp.rag.text2sql.knowledge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import ch.so.arp.rag.text2sql.metadata.ColumnMetadata;
import ch.so.arp.rag.text2sql.metadata.ForeignKeyRef;
import ch.so.arp.rag.text2sql.metadata.TableMetadata;
import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.BusinessRuleStore;
import ch.so.arp.rag.text2sql.rules.RuleKind;

/**
 * Renders one self-contained Markdown document per table and, when general
 * rules exist, one cross-table document with all of them. The output is a pure
 * function of the tables and rules: rebuilding from the same input yields the
 * same ids and texts.
 */
public class TableChunker {

    static final String DESCRIPTION_TERM = "description";
    static final String DOMAIN_TERM = "domain";

    private static final Pattern ENUM_IN_COMMENT = Pattern.compile("(\\d+)\\s*=\\s*([^,，;；\\s]+)");

    private static final Map<String, List<String>> TABLE_WORD_SYNONYMS = Map.of(
            "order", List.of("订单", "交易记录"),
            "user", List.of("用户", "客户"),
            "customer", List.of("客户", "用户"),
            "product", List.of("产品", "商品"));

    private static final Map<String, List<String>> COLUMN_WORD_SYNONYMS = Map.of(
            "amount", List.of("金额", "销售额"),
            "price", List.of("价格", "金额"),
            "status", List.of("状态"),
            "time", List.of("时间", "日期"),
            "date", List.of("日期", "时间"),
            "at", List.of("时间", "日期"));

    public List<KnowledgeChunk> chunk(List<TableMetadata> tables, BusinessRuleStore rules) {
        List<KnowledgeChunk> chunks = new ArrayList<>(tables.size() + 1);
        for (TableMetadata table : tables) {
            chunks.add(chunkTable(table, tables, rules));
        }
        List<BusinessRule> general = rules.general();
        if (!general.isEmpty()) {
            chunks.add(businessRulesChunk(general));
        }
        return chunks;
    }

    KnowledgeChunk chunkTable(TableMetadata table, List<TableMetadata> allTables, BusinessRuleStore rules) {
        List<BusinessRule> applicable = rules.applicableTo(table);
        StringBuilder text = new StringBuilder();
        text.append("# Table: ").append(table.name()).append("\n\n");

        text.append("## Description\n").append(description(table, applicable)).append("\n\n");

        text.append("## Schema\n```sql\n").append(ddl(table)).append("\n```\n\n");

        text.append("## Columns\n");
        for (ColumnMetadata column : table.columns()) {
            text.append("- **").append(column.name()).append("**: ").append(column.type());
            if (!column.nullable()) {
                text.append(" NOT NULL");
            }
            if (column.hasComment()) {
                text.append(" - ").append(column.comment());
            }
            if (table.isPrimaryKey(column.name())) {
                text.append(" (PK)");
            }
            table.foreignKey(column.name()).ifPresent(fk -> text.append(" (FK -> ")
                    .append(fk.referencedTable()).append('.').append(fk.referencedColumn()).append(')'));
            text.append('\n');
        }

        List<String> relationships = relationships(table, allTables);
        if (!relationships.isEmpty()) {
            text.append("\n## Relationships\n");
            relationships.forEach(line -> text.append("- ").append(line).append('\n'));
        }

        appendRules(text, "Business Terms", applicable, RuleKind.TERM);
        appendRules(text, "Metrics", applicable, RuleKind.METRIC);
        appendRules(text, "Calculations", applicable, RuleKind.CALCULATION);

        Map<String, String> enums = enumValues(table, applicable);
        if (!enums.isEmpty()) {
            text.append("\n## Enum Values\n");
            enums.forEach((column, gloss) -> text.append("- **").append(column).append("**: ").append(gloss)
                    .append('\n'));
        }

        appendSynonyms(text, table, applicable);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(KnowledgeChunk.META_KIND, KnowledgeChunk.KIND_TABLE);
        metadata.put(KnowledgeChunk.META_TABLE_NAME, table.name());
        metadata.put(KnowledgeChunk.META_COLUMNS, String.join(",", table.columnNames()));
        if (!table.primaryKey().isEmpty()) {
            metadata.put(KnowledgeChunk.META_PRIMARY_KEY, String.join(",", table.primaryKey()));
        }
        if (!table.foreignKeys().isEmpty()) {
            metadata.put(KnowledgeChunk.META_FOREIGN_KEYS, table.foreignKeys().stream()
                    .map(fk -> fk.describe(table.name()))
                    .collect(Collectors.joining(",")));
        }
        tableTerm(table, applicable, DOMAIN_TERM).ifPresent(domain -> metadata.put(KnowledgeChunk.META_DOMAIN, domain));

        return new KnowledgeChunk(KnowledgeChunk.tableChunkId(table.name()), table.name(), text.toString(), null,
                metadata);
    }

    KnowledgeChunk businessRulesChunk(List<BusinessRule> general) {
        StringBuilder text = new StringBuilder("# Business Rules and Definitions\n");
        appendRules(text, "General Terms", general, RuleKind.TERM);
        appendRules(text, "Business Metrics", general, RuleKind.METRIC);
        appendRules(text, "Calculation Rules", general, RuleKind.CALCULATION);
        appendRules(text, "Enum Values", general, RuleKind.ENUM_VALUE);
        appendRules(text, "Synonyms", general, RuleKind.SYNONYM);
        return new KnowledgeChunk(KnowledgeChunk.BUSINESS_RULES_ID, null, text.toString(), null,
                Map.of(KnowledgeChunk.META_KIND, KnowledgeChunk.KIND_BUSINESS_RULES));
    }

    static String ddl(TableMetadata table) {
        List<String> definitions = new ArrayList<>();
        for (ColumnMetadata column : table.columns()) {
            definitions.add("    " + column.name() + " " + column.type() + (column.nullable() ? "" : " NOT NULL"));
        }
        if (!table.primaryKey().isEmpty()) {
            definitions.add("    PRIMARY KEY (" + String.join(", ", table.primaryKey()) + ")");
        }
        for (ForeignKeyRef fk : table.foreignKeys()) {
            definitions.add("    FOREIGN KEY (" + fk.column() + ") REFERENCES " + fk.referencedTable() + " ("
                    + fk.referencedColumn() + ")");
        }
        return "CREATE TABLE " + table.name() + " (\n" + String.join(",\n", definitions) + "\n)";
    }

    private String description(TableMetadata table, List<BusinessRule> applicable) {
        if (table.hasComment()) {
            return table.comment();
        }
        return tableTerm(table, applicable, DESCRIPTION_TERM)
                .orElse("Table " + table.name() + " with columns " + String.join(", ", table.columnNames()) + ".");
    }

    private Optional<String> tableTerm(TableMetadata table, List<BusinessRule> applicable, String key) {
        return applicable.stream()
                .filter(rule -> !rule.isGeneral() && rule.kind() == RuleKind.TERM && rule.key().equalsIgnoreCase(key))
                .map(BusinessRule::value)
                .filter(value -> !value.isEmpty())
                .findFirst();
    }

    private List<String> relationships(TableMetadata table, List<TableMetadata> allTables) {
        List<String> lines = new ArrayList<>();
        table.foreignKeys().forEach(fk -> lines.add(fk.describe(table.name())));
        for (TableMetadata other : allTables) {
            if (other.name().equalsIgnoreCase(table.name())) {
                continue;
            }
            for (ForeignKeyRef fk : other.foreignKeys()) {
                if (fk.referencedTable().equalsIgnoreCase(table.name())) {
                    lines.add(fk.describe(other.name()));
                }
            }
        }
        return lines;
    }

    private void appendRules(StringBuilder text, String heading, List<BusinessRule> rules, RuleKind kind) {
        List<BusinessRule> matching = rules.stream()
                .filter(rule -> rule.kind() == kind)
                .filter(rule -> rule.isGeneral() || !isStructuralTerm(rule))
                .toList();
        if (matching.isEmpty()) {
            return;
        }
        text.append("\n## ").append(heading).append('\n');
        matching.forEach(rule -> text.append("- **").append(rule.key()).append("**: ").append(rule.value())
                .append('\n'));
    }

    private boolean isStructuralTerm(BusinessRule rule) {
        return rule.kind() == RuleKind.TERM
                && (rule.key().equalsIgnoreCase(DESCRIPTION_TERM) || rule.key().equalsIgnoreCase(DOMAIN_TERM));
    }

    private Map<String, String> enumValues(TableMetadata table, List<BusinessRule> applicable) {
        Map<String, String> values = new LinkedHashMap<>();
        for (ColumnMetadata column : table.columns()) {
            if (!column.hasComment()) {
                continue;
            }
            Matcher matcher = ENUM_IN_COMMENT.matcher(column.comment());
            List<String> glosses = new ArrayList<>();
            while (matcher.find()) {
                glosses.add(matcher.group(1) + " means '" + matcher.group(2) + "'");
            }
            if (!glosses.isEmpty()) {
                values.put(column.name(), String.join(", ", glosses));
            }
        }
        applicable.stream()
                .filter(rule -> rule.kind() == RuleKind.ENUM_VALUE && !rule.isGeneral())
                .forEach(rule -> values.put(rule.key(), rule.value()));
        return values;
    }

    private void appendSynonyms(StringBuilder text, TableMetadata table, List<BusinessRule> applicable) {
        Set<String> tableSynonyms = new LinkedHashSet<>(wordSynonyms(table.name(), TABLE_WORD_SYNONYMS));
        Map<String, Set<String>> columnSynonyms = new LinkedHashMap<>();
        for (ColumnMetadata column : table.columns()) {
            Set<String> synonyms = new LinkedHashSet<>(wordSynonyms(column.name(), COLUMN_WORD_SYNONYMS));
            if (!synonyms.isEmpty()) {
                columnSynonyms.put(column.name(), synonyms);
            }
        }
        for (BusinessRule rule : applicable) {
            if (rule.kind() != RuleKind.SYNONYM || rule.isGeneral()) {
                continue;
            }
            List<String> names = splitList(rule.value());
            if (rule.key().equalsIgnoreCase(table.name()) || rule.key().equalsIgnoreCase("table")) {
                tableSynonyms.addAll(names);
            } else {
                String column = table.column(rule.key()).map(ColumnMetadata::name).orElse(rule.key());
                columnSynonyms.computeIfAbsent(column, key -> new LinkedHashSet<>()).addAll(names);
            }
        }
        if (tableSynonyms.isEmpty() && columnSynonyms.isEmpty()) {
            return;
        }
        text.append("\n## Synonyms\n");
        if (!tableSynonyms.isEmpty()) {
            text.append("- Table: ").append(String.join(", ", tableSynonyms)).append('\n');
        }
        if (!columnSynonyms.isEmpty()) {
            text.append("- Columns:\n");
            columnSynonyms.forEach((column, names) -> text.append("  - ").append(column).append(": ")
                    .append(String.join(", ", names)).append('\n'));
        }
    }

    private static List<String> wordSynonyms(String identifier, Map<String, List<String>> dictionary) {
        List<String> synonyms = new ArrayList<>();
        for (String word : identifier.toLowerCase(Locale.ROOT).split("_")) {
            String singular = word.endsWith("s") && word.length() > 3 ? word.substring(0, word.length() - 1) : word;
            List<String> found = dictionary.getOrDefault(word, dictionary.get(singular));
            if (found != null) {
                synonyms.addAll(found);
            }
        }
        return synonyms;
    }

    private static List<String> splitList(String value) {
        List<String> names = new ArrayList<>();
        for (String part : value.split("[,，]")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                names.add(trimmed);
            }
        }
        return names;
    }
}
