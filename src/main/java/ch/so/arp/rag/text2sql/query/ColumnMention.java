package ch.so.arp.rag.text2sql.query;

/**
 * A column named in a question, resolved to the table that owns it.
 */
public record ColumnMention(String table, String column) {

    public String qualified() {
        return table + "." + column;
    }
}
