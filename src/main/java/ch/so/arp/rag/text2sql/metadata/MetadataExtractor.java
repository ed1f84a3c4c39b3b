package ch.so.arp.rag.text2sql.metadata;

import java.util.List;

/**
 * Source of structural facts about the target database.
 */
public interface MetadataExtractor {

    /**
     * Read the current structure of every user table.
     *
     * @return table snapshots ordered by table name
     * @throws ExtractionException if the source is unreachable or unreadable
     */
    List<TableMetadata> extract();
}
