package ch.so.arp.rag.text2sql.validation;

import java.util.List;
import java.util.Optional;

import ch.so.arp.rag.text2sql.generation.SqlCandidate;
import ch.so.arp.rag.text2sql.query.Prompt;

/**
 * Terminal state of one repair loop run with the candidate history.
 *
 * @param state terminal state
 * @param attempts number of generator calls made
 * @param history every candidate with its outcome, oldest first
 * @param prompts every prompt sent, oldest first
 */
public record RepairLoopResult(LoopState state, int attempts, List<RepairAttempt> history, List<Prompt> prompts) {

    public RepairLoopResult {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Loop result needs a terminal state but was " + state);
        }
        history = List.copyOf(history);
        prompts = List.copyOf(prompts);
    }

    public Optional<RepairAttempt> last() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    public Optional<SqlCandidate> lastCandidate() {
        return last().map(RepairAttempt::candidate);
    }

    public Optional<ValidationOutcome> lastOutcome() {
        return last().map(RepairAttempt::outcome);
    }

    public boolean isSuccess() {
        return state == LoopState.SUCCESS;
    }
}
