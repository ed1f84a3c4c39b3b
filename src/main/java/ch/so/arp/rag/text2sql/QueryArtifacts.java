package ch.so.arp.rag.text2sql;

import java.util.List;

import ch.so.arp.rag.text2sql.query.Prompt;
import ch.so.arp.rag.text2sql.query.QueryIntent;
import ch.so.arp.rag.text2sql.query.RetrievedChunk;
import ch.so.arp.rag.text2sql.validation.RepairAttempt;

/**
 * Intermediate results of a query, returned only on request.
 */
public record QueryArtifacts(QueryIntent intent, List<RetrievedChunk> retrievedChunks, List<Prompt> prompts,
        List<RepairAttempt> candidates) {

    public QueryArtifacts {
        retrievedChunks = List.copyOf(retrievedChunks);
        prompts = List.copyOf(prompts);
        candidates = List.copyOf(candidates);
    }
}
