package ch.so.arp.rag.text2sql.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.SocketTimeoutException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.rag.text2sql.generation.GenerationOptions;
import ch.so.arp.rag.text2sql.generation.LlmClient;
import ch.so.arp.rag.text2sql.generation.LlmServiceException;
import ch.so.arp.rag.text2sql.generation.LlmTimeoutException;
import ch.so.arp.rag.text2sql.generation.SqlDialect;
import ch.so.arp.rag.text2sql.generation.SqlExtractor;
import ch.so.arp.rag.text2sql.generation.SqlGenerator;
import ch.so.arp.rag.text2sql.query.AggregationHint;
import ch.so.arp.rag.text2sql.query.IntentCategory;
import ch.so.arp.rag.text2sql.query.PromptBuilder;
import ch.so.arp.rag.text2sql.query.PromptMode;
import ch.so.arp.rag.text2sql.query.QueryIntent;
import ch.so.arp.rag.text2sql.query.RetrievedContext;
import ch.so.arp.rag.text2sql.query.SchemaVocabulary;
import ch.so.arp.rag.text2sql.query.TokenCounter;

class SqlRepairLoopTest {

    private static final QueryIntent INTENT = new QueryIntent("统计每个用户的订单数量", List.of(), List.of(),
            IntentCategory.AGGREGATION, AggregationHint.COUNT, List.of("数量"), List.of("用户"), null, List.of(),
            "统计每个用户的订单数量 数量 用户");

    private static final String GOOD = "```sql\nSELECT user_id, COUNT(*) AS order_count FROM orders GROUP BY user_id\n```";
    private static final String BROKEN = "```sql\nSELECT user_id, FROM orders\n```";

    private static final ExecutionResult ROWS = new ExecutionResult(List.of("user_id", "order_count"),
            List.of(List.of(1L, 2L)), false);

    private ScriptedLlmClient llm;
    private SqlExecutor executor;
    private final CancellationToken token = new CancellationToken();

    @BeforeEach
    void setUp() {
        llm = new ScriptedLlmClient();
        executor = mock(SqlExecutor.class);
        when(executor.execute(anyString())).thenReturn(ValidationOutcome.success(ROWS));
    }

    @Test
    void succeedsOnFirstAttempt() {
        llm.answer(GOOD);

        RepairLoopResult result = loop(3, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.state()).isEqualTo(LoopState.SUCCESS);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.prompts()).extracting(p -> p.mode()).containsExactly(PromptMode.INITIAL);
        assertThat(result.lastOutcome()).get().extracting(ValidationOutcome::result).isEqualTo(ROWS);
        assertThat(result.lastCandidate()).get().extracting(c -> c.attempt()).isEqualTo(1);
    }

    @Test
    void repairsSyntaxErrorWithLatestCandidateInPrompt() {
        llm.answer(BROKEN).answer(GOOD);

        RepairLoopResult result = loop(3, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.history()).extracting(a -> a.outcome().kind())
                .containsExactly(ValidationOutcome.Kind.SYNTAX_ERROR, ValidationOutcome.Kind.SUCCESS);
        assertThat(result.prompts().get(1).mode()).isEqualTo(PromptMode.REPAIR);
        assertThat(llm.prompts.get(1)).contains("SELECT user_id, FROM orders");
        verify(executor, times(1)).execute(anyString());
    }

    @Test
    void repairsExecutionError() {
        when(executor.execute(anyString()))
                .thenReturn(ValidationOutcome.executionError("Column \"amount\" not found"))
                .thenReturn(ValidationOutcome.success(ROWS));
        llm.answer("```sql\nSELECT amount FROM orders\n```").answer(GOOD);

        RepairLoopResult result = loop(3, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.state()).isEqualTo(LoopState.SUCCESS);
        assertThat(result.history().get(0).outcome().kind()).isEqualTo(ValidationOutcome.Kind.EXECUTION_ERROR);
        assertThat(llm.prompts.get(1)).contains("SELECT amount FROM orders").contains("Column \"amount\" not found");
    }

    @Test
    void stopsAfterAttemptBudget() {
        llm.answer(BROKEN).answer(BROKEN).answer(BROKEN).answer(GOOD);

        RepairLoopResult result = loop(3, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.state()).isEqualTo(LoopState.EXHAUSTED);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(llm.prompts).hasSize(3);
        assertThat(result.history()).hasSize(3);
        verify(executor, never()).execute(anyString());
    }

    @Test
    void singleAttemptBudgetNeverRepairs() {
        llm.answer(BROKEN).answer(GOOD);

        RepairLoopResult result = loop(1, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.state()).isEqualTo(LoopState.EXHAUSTED);
        assertThat(llm.prompts).hasSize(1);
    }

    @Test
    void rejectsWritingStatementWithoutExecuting() {
        llm.answer("```sql\nDELETE FROM orders\n```").answer(GOOD);

        RepairLoopResult result = loop(3, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.state()).isEqualTo(LoopState.REJECTED);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.lastOutcome()).get().extracting(ValidationOutcome::kind)
                .isEqualTo(ValidationOutcome.Kind.POLICY_VIOLATION);
        verify(executor, never()).execute(anyString());
    }

    @Test
    void responseWithoutSqlConsumesAnAttempt() {
        llm.answer("I am not able to answer this.").answer(GOOD);

        RepairLoopResult result = loop(3, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        RepairAttempt first = result.history().get(0);
        assertThat(first.candidate().hasSql()).isFalse();
        assertThat(first.candidate().rawOutput()).isEqualTo("I am not able to answer this.");
        assertThat(first.outcome().kind()).isEqualTo(ValidationOutcome.Kind.SYNTAX_ERROR);
    }

    @Test
    void timeoutConsumesAnAttempt() {
        llm.timeout().answer(GOOD);

        RepairLoopResult result = loop(2, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.history().get(0).outcome().message()).contains("did not answer in time");
    }

    @Test
    void serviceFailurePropagates() {
        LlmClient failing = (prompt, options) -> {
            throw new LlmServiceException("endpoint down");
        };
        SqlRepairLoop loop = new SqlRepairLoop(generator(failing), new SqlStatementValidator(SqlDialect.MYSQL),
                executor, promptBuilder(), 3, true);

        assertThatThrownBy(() -> loop.run(INTENT, RetrievedContext.empty(), List.of(), token))
                .isInstanceOf(LlmServiceException.class);
    }

    @Test
    void dryRunSkipsExecution() {
        llm.answer(GOOD);

        RepairLoopResult result = loop(3, false).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.state()).isEqualTo(LoopState.SUCCESS);
        assertThat(result.lastOutcome()).get().extracting(ValidationOutcome::result).isNull();
        verify(executor, never()).execute(anyString());
    }

    @Test
    void dryRunRepairsReferencesMissingFromSchema() {
        SchemaVocabulary schema = new SchemaVocabulary(Map.of("orders", List.of("id", "user_id", "payment_amount")));
        llm.answer("```sql\nSELECT ghost_col FROM ghost_table\n```").answer(GOOD);

        RepairLoopResult result = loop(3, false).run(INTENT, RetrievedContext.empty(), List.of(), schema, token);

        assertThat(result.state()).isEqualTo(LoopState.SUCCESS);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.history().get(0).outcome().kind()).isEqualTo(ValidationOutcome.Kind.EXECUTION_ERROR);
        assertThat(llm.prompts.get(1)).contains("ghost_table");
        verify(executor, never()).execute(anyString());
    }

    @Test
    void dryRunWithUnknownTablesExhaustsBudget() {
        SchemaVocabulary schema = new SchemaVocabulary(Map.of("orders", List.of("id")));
        llm.answer("```sql\nSELECT ghost_col FROM ghost_table\n```");

        RepairLoopResult result = loop(1, false).run(INTENT, RetrievedContext.empty(), List.of(), schema, token);

        assertThat(result.state()).isEqualTo(LoopState.EXHAUSTED);
    }

    @Test
    void dryRunStillRejectsWritingStatements() {
        llm.answer("```sql\nUPDATE orders SET order_status = 3\n```");

        assertThat(loop(3, false).run(INTENT, RetrievedContext.empty(), List.of(), token).state())
                .isEqualTo(LoopState.REJECTED);
    }

    @Test
    void cancelledBeforeFirstGeneration() {
        token.cancel();

        RepairLoopResult result = loop(3, true).run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.state()).isEqualTo(LoopState.CANCELLED);
        assertThat(result.attempts()).isZero();
        assertThat(result.history()).isEmpty();
        assertThat(llm.prompts).isEmpty();
    }

    @Test
    void cancelledBetweenGenerationAndExecution() {
        LlmClient cancelling = (prompt, options) -> {
            token.cancel();
            return GOOD;
        };
        SqlRepairLoop loop = new SqlRepairLoop(generator(cancelling), new SqlStatementValidator(SqlDialect.MYSQL),
                executor, promptBuilder(), 3, true);

        RepairLoopResult result = loop.run(INTENT, RetrievedContext.empty(), List.of(), token);

        assertThat(result.state()).isEqualTo(LoopState.CANCELLED);
        assertThat(result.attempts()).isEqualTo(1);
        verify(executor, never()).execute(anyString());
    }

    @Test
    void rejectsEmptyBudget() {
        assertThatThrownBy(() -> loop(0, true)).isInstanceOf(IllegalArgumentException.class);
    }

    private SqlRepairLoop loop(int maxAttempts, boolean execute) {
        return new SqlRepairLoop(generator(llm), new SqlStatementValidator(SqlDialect.MYSQL), executor,
                promptBuilder(), maxAttempts, execute);
    }

    private static SqlGenerator generator(LlmClient client) {
        return new SqlGenerator(client, new SqlExtractor(), GenerationOptions.defaults(), SqlDialect.MYSQL);
    }

    private static PromptBuilder promptBuilder() {
        return new PromptBuilder(SqlDialect.MYSQL, 3000, false, new TokenCounter());
    }

    private static final class ScriptedLlmClient implements LlmClient {

        private final Deque<Object> answers = new ArrayDeque<>();
        private final List<String> prompts = new ArrayList<>();

        ScriptedLlmClient answer(String text) {
            answers.add(text);
            return this;
        }

        ScriptedLlmClient timeout() {
            answers.add(new LlmTimeoutException("Model did not answer in time", new SocketTimeoutException()));
            return this;
        }

        @Override
        public String complete(String prompt, GenerationOptions options) {
            prompts.add(prompt);
            Object next = answers.poll();
            if (next instanceof RuntimeException ex) {
                throw ex;
            }
            if (next == null) {
                throw new IllegalStateException("No scripted answer left");
            }
            return (String) next;
        }
    }
}
