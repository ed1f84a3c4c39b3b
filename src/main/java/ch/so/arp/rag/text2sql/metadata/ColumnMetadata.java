package ch.so.arp.rag.text2sql.metadata;

import java.util.Objects;

/**
 * Structural description of a single column.
 */
public record ColumnMetadata(String name, String type, boolean nullable, String comment) {

    public ColumnMetadata {
        Objects.requireNonNull(name, "name");
        type = type == null || type.isBlank() ? "UNKNOWN" : type;
        comment = comment == null ? "" : comment.trim();
    }

    public boolean hasComment() {
        return !comment.isEmpty();
    }
}
