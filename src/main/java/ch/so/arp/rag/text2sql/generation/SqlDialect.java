package ch.so.arp.rag.text2sql.generation;

/**
 * Target SQL dialect of generated statements.
 */
public enum SqlDialect {

    MYSQL("MySQL"),
    POSTGRESQL("PostgreSQL"),
    H2("H2"),
    ANSI("ANSI SQL");

    private final String displayName;

    SqlDialect(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
