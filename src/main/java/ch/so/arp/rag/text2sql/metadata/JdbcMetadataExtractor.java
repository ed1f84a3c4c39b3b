package ch.so.arp.rag.text2sql.metadata;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads table structure from a live connection through
 * {@link DatabaseMetaData}. Views and system tables are ignored.
 */
public class JdbcMetadataExtractor implements MetadataExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcMetadataExtractor.class);

    private static final Set<String> TABLE_TYPES = Set.of("TABLE", "BASE TABLE");

    private final DataSource dataSource;
    private final String schema;

    public JdbcMetadataExtractor(DataSource dataSource, String schema) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.schema = schema == null || schema.isBlank() ? null : schema;
    }

    @Override
    public List<TableMetadata> extract() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String catalog = connection.getCatalog();
            String schemaPattern = schema != null ? schema : connection.getSchema();
            Map<String, String> tables = readTables(metaData, catalog, schemaPattern);
            List<TableMetadata> result = new ArrayList<>(tables.size());
            for (Map.Entry<String, String> table : tables.entrySet()) {
                result.add(readTable(metaData, catalog, schemaPattern, table.getKey(), table.getValue()));
            }
            LOGGER.info("Extracted metadata for {} tables (catalog={}, schema={})", result.size(), catalog,
                    schemaPattern);
            return result;
        } catch (SQLException ex) {
            throw new ExtractionException("Unable to read database metadata: " + ex.getMessage(), ex);
        }
    }

    private Map<String, String> readTables(DatabaseMetaData metaData, String catalog, String schemaPattern)
            throws SQLException {
        Map<String, String> tables = new TreeMap<>();
        try (ResultSet rs = metaData.getTables(catalog, schemaPattern, "%", null)) {
            while (rs.next()) {
                String type = rs.getString("TABLE_TYPE");
                if (type != null && TABLE_TYPES.contains(type.toUpperCase(Locale.ROOT))) {
                    tables.put(rs.getString("TABLE_NAME"), rs.getString("REMARKS"));
                }
            }
        }
        return tables;
    }

    private TableMetadata readTable(DatabaseMetaData metaData, String catalog, String schemaPattern, String table,
            String remarks) throws SQLException {
        List<ColumnMetadata> columns = new ArrayList<>();
        try (ResultSet rs = metaData.getColumns(catalog, schemaPattern, table, "%")) {
            List<ColumnRow> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(new ColumnRow(
                        rs.getInt("ORDINAL_POSITION"),
                        rs.getString("COLUMN_NAME"),
                        typeName(rs.getString("TYPE_NAME"), rs.getInt("DATA_TYPE"), rs.getInt("COLUMN_SIZE"),
                                rs.getInt("DECIMAL_DIGITS")),
                        rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls,
                        rs.getString("REMARKS")));
            }
            rows.sort(Comparator.comparingInt(ColumnRow::position));
            rows.forEach(row -> columns.add(new ColumnMetadata(row.name(), row.type(), row.nullable(), row.remarks())));
        }

        Map<Integer, String> primaryKey = new TreeMap<>();
        try (ResultSet rs = metaData.getPrimaryKeys(catalog, schemaPattern, table)) {
            while (rs.next()) {
                primaryKey.put(rs.getInt("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }

        Map<String, ForeignKeyRef> foreignKeys = new LinkedHashMap<>();
        try (ResultSet rs = metaData.getImportedKeys(catalog, schemaPattern, table)) {
            while (rs.next()) {
                String column = rs.getString("FKCOLUMN_NAME");
                foreignKeys.putIfAbsent(column,
                        new ForeignKeyRef(column, rs.getString("PKTABLE_NAME"), rs.getString("PKCOLUMN_NAME")));
            }
        }

        LOGGER.debug("Table {}: {} columns, pk={}, {} foreign keys", table, columns.size(), primaryKey.values(),
                foreignKeys.size());
        return new TableMetadata(table, remarks, columns, new LinkedHashSet<>(primaryKey.values()),
                new ArrayList<>(foreignKeys.values()));
    }

    private String typeName(String typeName, int dataType, int size, int scale) {
        String base = typeName == null ? "UNKNOWN" : typeName.toUpperCase(Locale.ROOT);
        return switch (dataType) {
            case Types.CHAR, Types.VARCHAR, Types.NCHAR, Types.NVARCHAR -> size > 0 ? base + "(" + size + ")" : base;
            case Types.DECIMAL, Types.NUMERIC -> size > 0 ? base + "(" + size + "," + scale + ")" : base;
            default -> base;
        };
    }

    private record ColumnRow(int position, String name, String type, boolean nullable, String remarks) {
    }
}
