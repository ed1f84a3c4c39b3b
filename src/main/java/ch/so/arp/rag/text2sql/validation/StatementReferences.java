package ch.so.arp.rag.text2sql.validation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import net.sf.jsqlparser.expression.Alias;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.util.TablesNamesFinder;

/**
 * Walks a parsed query once and collects the physical tables, table aliases,
 * column references, select item aliases and called functions. Names are
 * unquoted, lower case and stripped of their schema prefix.
 */
final class StatementReferences extends TablesNamesFinder {

    private final Set<String> tables = new LinkedHashSet<>();
    private final Map<String, String> tableAliases = new HashMap<>();
    private final List<Column> columns = new ArrayList<>();
    private final Set<String> selectAliases = new HashSet<>();
    private final Set<String> functions = new LinkedHashSet<>();
    private boolean derivedSources;

    static StatementReferences of(Select select) {
        StatementReferences references = new StatementReferences();
        for (String table : references.getTables((Statement) select)) {
            references.tables.add(name(table));
        }
        if (select.getWithItemsList() != null && !select.getWithItemsList().isEmpty()) {
            references.derivedSources = true;
        }
        return references;
    }

    @Override
    public void visit(Table table) {
        if (table.getName() != null && table.getAlias() != null) {
            tableAliases.put(name(table.getAlias().getName()), name(table.getName()));
        }
        super.visit(table);
    }

    @Override
    public void visit(Column column) {
        columns.add(column);
        super.visit(column);
    }

    @Override
    public void visit(Function function) {
        if (function.getName() != null) {
            functions.add(name(function.getName()));
        }
        super.visit(function);
    }

    @Override
    public void visit(PlainSelect plainSelect) {
        if (plainSelect.getSelectItems() != null) {
            for (SelectItem<?> item : plainSelect.getSelectItems()) {
                Alias alias = item.getAlias();
                if (alias != null && alias.getName() != null) {
                    selectAliases.add(name(alias.getName()));
                }
            }
        }
        super.visit(plainSelect);
    }

    @Override
    public void visit(ParenthesedSelect parenthesedSelect) {
        if (parenthesedSelect.getAlias() != null) {
            derivedSources = true;
        }
        super.visit(parenthesedSelect);
    }

    @Override
    public void visit(TableFunction tableFunction) {
        derivedSources = true;
        super.visit(tableFunction);
    }

    Set<String> tables() {
        return tables;
    }

    /**
     * The physical table behind a table name or alias, {@code null} for
     * derived tables and unknown qualifiers.
     */
    String resolveQualifier(String qualifier) {
        String normalized = name(qualifier);
        String aliased = tableAliases.get(normalized);
        if (aliased != null) {
            return aliased;
        }
        return tables.contains(normalized) ? normalized : null;
    }

    List<Column> columns() {
        return columns;
    }

    boolean isSelectAlias(String name) {
        return selectAliases.contains(name(name));
    }

    Set<String> functions() {
        return functions;
    }

    /**
     * Whether rows also come from subqueries, common table expressions or
     * table functions whose columns are not in the schema.
     */
    boolean hasDerivedSources() {
        return derivedSources;
    }

    static String name(String identifier) {
        String trimmed = identifier.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot >= 0) {
            trimmed = trimmed.substring(dot + 1);
        }
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
                trimmed = trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
