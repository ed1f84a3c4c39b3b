package ch.so.arp.rag.text2sql.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import ch.so.arp.rag.text2sql.knowledge.KnowledgeChunk;

/**
 * Table and column names known to the knowledge base. Used to recognise
 * explicit mentions of schema objects in a question.
 */
public final class SchemaVocabulary {

    private static final SchemaVocabulary EMPTY = new SchemaVocabulary(Map.of());

    private final Map<String, List<String>> columnsByTable;

    public SchemaVocabulary(Map<String, List<String>> columnsByTable) {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        columnsByTable.forEach((table, columns) -> copy.put(table, List.copyOf(columns)));
        this.columnsByTable = Collections.unmodifiableMap(copy);
    }

    public static SchemaVocabulary empty() {
        return EMPTY;
    }

    /**
     * Collect the vocabulary from the metadata of table chunks.
     */
    public static SchemaVocabulary fromChunks(List<KnowledgeChunk> chunks) {
        Map<String, List<String>> columns = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (KnowledgeChunk chunk : chunks) {
            if (!KnowledgeChunk.KIND_TABLE.equals(chunk.kind()) || chunk.tableName() == null) {
                continue;
            }
            List<String> names = new ArrayList<>();
            String joined = chunk.metadata().getOrDefault(KnowledgeChunk.META_COLUMNS, "");
            for (String name : joined.split(",")) {
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
            columns.put(chunk.tableName(), names);
        }
        return new SchemaVocabulary(columns);
    }

    public Set<String> tables() {
        return columnsByTable.keySet();
    }

    public boolean hasTable(String table) {
        return columnsByTable.containsKey(table);
    }

    /**
     * The table name as stored in the knowledge base, or the argument if unknown.
     */
    public String canonicalTable(String table) {
        for (String known : columnsByTable.keySet()) {
            if (known.equalsIgnoreCase(table)) {
                return known;
            }
        }
        return table;
    }

    public List<String> columns(String table) {
        return columnsByTable.getOrDefault(table, List.of());
    }

    public boolean hasColumn(String table, String column) {
        return columns(table).stream().anyMatch(name -> name.equalsIgnoreCase(column));
    }

    /**
     * Tables that own a column of the given name, in name order.
     */
    public List<String> tablesWithColumn(String column) {
        String lower = column.toLowerCase(Locale.ROOT);
        return columnsByTable.entrySet().stream()
                .filter(entry -> entry.getValue().stream().anyMatch(name -> name.toLowerCase(Locale.ROOT).equals(lower)))
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean isEmpty() {
        return columnsByTable.isEmpty();
    }
}
