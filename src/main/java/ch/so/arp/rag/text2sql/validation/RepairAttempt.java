package ch.so.arp.rag.text2sql.validation;

import java.util.Objects;

import ch.so.arp.rag.text2sql.generation.SqlCandidate;

/**
 * A generated candidate together with the outcome of checking it.
 */
public record RepairAttempt(SqlCandidate candidate, ValidationOutcome outcome) {

    public RepairAttempt {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(outcome, "outcome");
    }

    public int attempt() {
        return candidate.attempt();
    }
}
