package ch.so.arp.rag.text2sql.metadata;

import java.util.Objects;

/**
 * A single-column foreign key pointing from a column of the owning table to a
 * column of the referenced table.
 */
public record ForeignKeyRef(String column, String referencedTable, String referencedColumn) {

    public ForeignKeyRef {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(referencedTable, "referencedTable");
        Objects.requireNonNull(referencedColumn, "referencedColumn");
    }

    /**
     * Renders the relationship as {@code owner.column -> referenced.column}.
     */
    public String describe(String owningTable) {
        return owningTable + "." + column + " -> " + referencedTable + "." + referencedColumn;
    }
}
