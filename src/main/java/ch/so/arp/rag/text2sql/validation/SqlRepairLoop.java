package ch.so.arp.rag.text2sql.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.text2sql.generation.GenerationParseException;
import ch.so.arp.rag.text2sql.generation.LlmTimeoutException;
import ch.so.arp.rag.text2sql.generation.SqlCandidate;
import ch.so.arp.rag.text2sql.generation.SqlGenerator;
import ch.so.arp.rag.text2sql.query.Prompt;
import ch.so.arp.rag.text2sql.query.PromptBuilder;
import ch.so.arp.rag.text2sql.query.QueryIntent;
import ch.so.arp.rag.text2sql.query.RetrievedContext;
import ch.so.arp.rag.text2sql.query.SchemaVocabulary;
import ch.so.arp.rag.text2sql.rules.BusinessRule;

/**
 * Bounded generate, check and execute cycle.
 *
 * <pre>
 * GENERATE     -&gt; SYNTAX_CHECK  (a response without SQL counts as a syntax error)
 * SYNTAX_CHECK -&gt; EXECUTE | SUCCESS (dry run) | REJECTED | GENERATE | EXHAUSTED
 * EXECUTE      -&gt; SUCCESS | GENERATE | EXHAUSTED
 * </pre>
 *
 * The first generation is attempt 1 and the generator is never called more
 * than {@code maxAttempts} times. Each repair prompt carries only the latest
 * failed candidate. Statements that are not a single read-only query end the
 * loop in {@link LoopState#REJECTED} and are never executed. References to
 * tables or columns missing from the known schema count as execution errors,
 * also when nothing is executed. Cancellation is checked before every
 * generation and execution.
 */
public class SqlRepairLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlRepairLoop.class);

    private final SqlGenerator generator;
    private final SqlStatementValidator validator;
    private final SqlExecutor executor;
    private final PromptBuilder promptBuilder;
    private final int maxAttempts;
    private final boolean execute;

    public SqlRepairLoop(SqlGenerator generator, SqlStatementValidator validator, SqlExecutor executor,
            PromptBuilder promptBuilder, int maxAttempts, boolean execute) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.execute = execute;
    }

    public RepairLoopResult run(QueryIntent intent, RetrievedContext context, List<BusinessRule> generalRules,
            CancellationToken cancellation) {
        return run(intent, context, generalRules, SchemaVocabulary.empty(), cancellation);
    }

    public RepairLoopResult run(QueryIntent intent, RetrievedContext context, List<BusinessRule> generalRules,
            SchemaVocabulary schema, CancellationToken cancellation) {
        List<RepairAttempt> history = new ArrayList<>();
        List<Prompt> prompts = new ArrayList<>();
        LoopState state = LoopState.GENERATE;
        int attempts = 0;
        SqlCandidate candidate = null;

        while (!state.isTerminal()) {
            switch (state) {
                case GENERATE -> {
                    if (cancellation != null && cancellation.isCancelled()) {
                        state = LoopState.CANCELLED;
                        break;
                    }
                    attempts++;
                    Prompt prompt = promptBuilder.build(intent, context, generalRules, latest(history), maxAttempts);
                    prompts.add(prompt);
                    try {
                        candidate = generator.generate(prompt.text(), attempts);
                        state = LoopState.SYNTAX_CHECK;
                    } catch (GenerationParseException ex) {
                        candidate = SqlCandidate.unparsable(ex.getRawOutput(), generator.dialect(), attempts);
                        state = recordFailure(history, candidate, ValidationOutcome.syntaxError(
                                "No SQL statement could be extracted: " + ex.getMessage(), null, null, -1),
                                attempts);
                    } catch (LlmTimeoutException ex) {
                        candidate = SqlCandidate.unparsable("", generator.dialect(), attempts);
                        state = recordFailure(history, candidate, ValidationOutcome.syntaxError(
                                "The model did not answer in time", null, null, -1), attempts);
                    }
                }
                case SYNTAX_CHECK -> {
                    ValidationOutcome outcome = validator.check(candidate.sql(), schema);
                    if (outcome.isSuccess()) {
                        if (execute) {
                            state = LoopState.EXECUTE;
                        } else {
                            history.add(new RepairAttempt(candidate, outcome));
                            state = LoopState.SUCCESS;
                        }
                    } else if (outcome.kind() == ValidationOutcome.Kind.POLICY_VIOLATION) {
                        history.add(new RepairAttempt(candidate, outcome));
                        LOGGER.warn("Attempt {} rejected: {}", attempts, outcome.message());
                        state = LoopState.REJECTED;
                    } else {
                        state = recordFailure(history, candidate, outcome, attempts);
                    }
                }
                case EXECUTE -> {
                    if (cancellation != null && cancellation.isCancelled()) {
                        state = LoopState.CANCELLED;
                        break;
                    }
                    ValidationOutcome outcome = executor.execute(candidate.sql());
                    if (outcome.isSuccess()) {
                        history.add(new RepairAttempt(candidate, outcome));
                        state = LoopState.SUCCESS;
                    } else {
                        state = recordFailure(history, candidate, outcome, attempts);
                    }
                }
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
        }
        LOGGER.debug("Repair loop ended in {} after {} attempts", state, attempts);
        return new RepairLoopResult(state, attempts, history, prompts);
    }

    private LoopState recordFailure(List<RepairAttempt> history, SqlCandidate candidate, ValidationOutcome outcome,
            int attempts) {
        history.add(new RepairAttempt(candidate, outcome));
        if (attempts < maxAttempts) {
            LOGGER.warn("Attempt {} of {} failed with {}: {}", attempts, maxAttempts, outcome.kind().label(),
                    outcome.message());
            return LoopState.GENERATE;
        }
        LOGGER.warn("Attempt budget of {} exhausted, last error {}: {}", maxAttempts, outcome.kind().label(),
                outcome.message());
        return LoopState.EXHAUSTED;
    }

    private static List<RepairAttempt> latest(List<RepairAttempt> history) {
        return history.isEmpty() ? List.of() : List.of(history.get(history.size() - 1));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean executes() {
        return execute;
    }
}
