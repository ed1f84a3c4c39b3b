package ch.so.arp.rag.text2sql.metadata;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads table structure from a JSON schema description instead of a live
 * connection. Useful when the target database is not reachable from the build
 * host.
 *
 * <pre>
 * {"tables": [{"name": "orders", "comment": "...",
 *              "columns": [{"name": "id", "type": "BIGINT", "nullable": false, "comment": ""}],
 *              "primaryKey": ["id"],
 *              "foreignKeys": [{"column": "user_id", "referencedTable": "users", "referencedColumn": "id"}]}]}
 * </pre>
 */
public class SchemaFileMetadataExtractor implements MetadataExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaFileMetadataExtractor.class);

    private final Resource schemaFile;
    private final ObjectMapper objectMapper;

    public SchemaFileMetadataExtractor(Resource schemaFile, ObjectMapper objectMapper) {
        this.schemaFile = Objects.requireNonNull(schemaFile, "schemaFile");
        this.objectMapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<TableMetadata> extract() {
        if (!schemaFile.exists()) {
            throw new ExtractionException("Schema description " + schemaFile.getDescription() + " does not exist");
        }
        try (InputStream in = schemaFile.getInputStream()) {
            SchemaFile file = objectMapper.readValue(in, SchemaFile.class);
            if (file.tables() == null) {
                throw new ExtractionException("Schema description " + schemaFile.getDescription()
                        + " has no 'tables' section");
            }
            List<TableMetadata> tables = file.tables().stream()
                    .map(TableEntry::toMetadata)
                    .sorted(Comparator.comparing(TableMetadata::name))
                    .toList();
            LOGGER.info("Loaded metadata for {} tables from {}", tables.size(), schemaFile.getDescription());
            return tables;
        } catch (IOException ex) {
            throw new ExtractionException("Unable to read schema description " + schemaFile.getDescription()
                    + ": " + ex.getMessage(), ex);
        }
    }

    private record SchemaFile(List<TableEntry> tables) {
    }

    private record TableEntry(String name, String comment, List<ColumnEntry> columns, List<String> primaryKey,
            List<ForeignKeyRef> foreignKeys) {

        TableMetadata toMetadata() {
            if (name == null || name.isBlank()) {
                throw new ExtractionException("Schema description contains a table without a name");
            }
            List<ColumnMetadata> columnMetadata = columns == null ? List.of()
                    : columns.stream().map(ColumnEntry::toMetadata).toList();
            return new TableMetadata(name, comment, columnMetadata,
                    primaryKey == null ? null : new LinkedHashSet<>(primaryKey), foreignKeys);
        }
    }

    private record ColumnEntry(String name, String type, Boolean nullable, String comment) {

        ColumnMetadata toMetadata() {
            return new ColumnMetadata(name, type, nullable == null || nullable, comment);
        }
    }
}
