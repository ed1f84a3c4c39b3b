package ch.so.arp.rag.text2sql;

import com.fasterxml.jackson.annotation.JsonInclude;

import ch.so.arp.rag.text2sql.validation.ExecutionResult;
import ch.so.arp.rag.text2sql.validation.ValidationOutcome;

/**
 * Answer to one question.
 *
 * @param question the original question
 * @param finalSql the accepted statement, {@code null} unless the outcome is success
 * @param outcome success or the kind of the last failure
 * @param attempts number of generator calls used
 * @param lastCandidate the last generated statement, also when it failed
 * @param lastOutcome diagnostics of the last candidate
 * @param result rows of the accepted statement if it was executed
 * @param intermediate intent, chunks, prompts and candidates if requested
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(
        String question,
        String finalSql,
        QueryOutcome outcome,
        int attempts,
        String lastCandidate,
        ValidationOutcome lastOutcome,
        ExecutionResult result,
        QueryArtifacts intermediate) {

    public boolean succeeded() {
        return outcome == QueryOutcome.SUCCESS;
    }
}
