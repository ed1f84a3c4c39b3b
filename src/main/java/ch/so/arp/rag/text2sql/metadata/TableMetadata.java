package ch.so.arp.rag.text2sql.metadata;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one table as seen by a single extraction run. The
 * next extraction supersedes it; snapshots are never merged.
 */
public record TableMetadata(
        String name,
        String comment,
        List<ColumnMetadata> columns,
        Set<String> primaryKey,
        List<ForeignKeyRef> foreignKeys) {

    public TableMetadata {
        Objects.requireNonNull(name, "name");
        comment = comment == null ? "" : comment.trim();
        columns = columns == null ? List.of() : List.copyOf(columns);
        primaryKey = primaryKey == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(primaryKey));
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
    }

    public boolean hasComment() {
        return !comment.isEmpty();
    }

    public Optional<ColumnMetadata> column(String columnName) {
        return columns.stream().filter(column -> column.name().equalsIgnoreCase(columnName)).findFirst();
    }

    public boolean isPrimaryKey(String columnName) {
        return primaryKey.stream().anyMatch(pk -> pk.equalsIgnoreCase(columnName));
    }

    public Optional<ForeignKeyRef> foreignKey(String columnName) {
        return foreignKeys.stream().filter(fk -> fk.column().equalsIgnoreCase(columnName)).findFirst();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnMetadata::name).toList();
    }
}
