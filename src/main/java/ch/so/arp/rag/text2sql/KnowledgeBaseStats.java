package ch.so.arp.rag.text2sql;

import java.util.List;

import ch.so.arp.rag.text2sql.generation.SqlDialect;

/**
 * Current state of the engine as reported by the stats endpoint.
 */
public record KnowledgeBaseStats(
        int chunks,
        List<String> tables,
        int businessRules,
        String embeddingModel,
        SqlDialect dialect,
        int maxAttempts,
        boolean executionEnabled) {

    public KnowledgeBaseStats {
        tables = List.copyOf(tables);
    }
}
