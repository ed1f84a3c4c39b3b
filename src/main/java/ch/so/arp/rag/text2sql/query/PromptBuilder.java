package ch.so.arp.rag.text2sql.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.text2sql.generation.SqlCandidate;
import ch.so.arp.rag.text2sql.generation.SqlDialect;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeChunk;
import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.validation.RepairAttempt;
import ch.so.arp.rag.text2sql.validation.ValidationOutcome;

/**
 * Assembles generation and repair prompts. The schema section holds the
 * retrieved chunks in ranking order; if they exceed the token budget the
 * lowest ranked unpinned chunks are left out first. Pinned chunks are always
 * kept.
 */
public class PromptBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PromptBuilder.class);

    private static final int MAX_EXAMPLES = 2;

    private static final String ROLE = """
            You are an expert database engineer. Write one SQL query that answers the question below, \
            using only the tables and columns described in the schema context.

            Rules:
            1. Use only tables and columns that appear in the schema context; never invent names.
            2. Join tables only along the listed relationships.
            3. Prefer a CTE (WITH clause) for multi-step calculations.
            4. Use the business rules for the meaning of terms and metrics.
            5. Choose aggregate functions that match the question.""";

    private static final String OUTPUT_CONTRACT = """
            ## Output
            Return exactly one read-only query (SELECT or WITH ... SELECT) inside a single ```sql fenced block. \
            Do not write INSERT, UPDATE, DELETE, DDL or more than one statement.""";

    private final SqlDialect dialect;
    private final int tokenBudget;
    private final boolean fewShotExamples;
    private final TokenCounter tokenCounter;
    private final List<FewShotExample> examples;

    public PromptBuilder(SqlDialect dialect, int tokenBudget, boolean fewShotExamples, TokenCounter tokenCounter) {
        this(dialect, tokenBudget, fewShotExamples, tokenCounter, FewShotExample.DEFAULTS);
    }

    PromptBuilder(SqlDialect dialect, int tokenBudget, boolean fewShotExamples, TokenCounter tokenCounter,
            List<FewShotExample> examples) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        if (tokenBudget <= 0) {
            throw new IllegalArgumentException("tokenBudget must be positive");
        }
        this.tokenBudget = tokenBudget;
        this.fewShotExamples = fewShotExamples;
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
        this.examples = List.copyOf(examples);
    }

    /**
     * Build the prompt for the next generation. With an empty history the
     * initial prompt is produced; otherwise a repair prompt that carries only
     * the latest failed attempt.
     *
     * @param maxAttempts attempt budget, shown to the model in repair prompts
     */
    public Prompt build(QueryIntent intent, RetrievedContext context, List<BusinessRule> generalRules,
            List<RepairAttempt> history, int maxAttempts) {
        if (history == null || history.isEmpty()) {
            return initial(intent, context, generalRules);
        }
        return repair(intent, context, generalRules, history.get(history.size() - 1), maxAttempts);
    }

    public Prompt initial(QueryIntent intent, RetrievedContext context, List<BusinessRule> generalRules) {
        return render(PromptMode.INITIAL, intent, context, generalRules, null, 0);
    }

    public Prompt repair(QueryIntent intent, RetrievedContext context, List<BusinessRule> generalRules,
            RepairAttempt failed, int maxAttempts) {
        Objects.requireNonNull(failed, "failed");
        return render(PromptMode.REPAIR, intent, context, generalRules, failed, maxAttempts);
    }

    private Prompt render(PromptMode mode, QueryIntent intent, RetrievedContext context,
            List<BusinessRule> generalRules, RepairAttempt failed, int maxAttempts) {
        List<RetrievedChunk> included = fitToBudget(context.chunks());
        List<String> dropped = context.chunks().stream()
                .filter(chunk -> !included.contains(chunk))
                .map(RetrievedChunk::id)
                .toList();

        List<String> sections = new ArrayList<>();
        sections.add(ROLE);
        sections.add("## Dialect\nWrite the query for " + dialect.displayName() + ".");
        sections.add(schemaSection(included));
        if (!generalRules.isEmpty()) {
            sections.add(rulesSection(generalRules));
        }
        String relationships = relationshipSection(included);
        if (!relationships.isEmpty()) {
            sections.add(relationships);
        }
        if (fewShotExamples && mode == PromptMode.INITIAL) {
            List<FewShotExample> selected = selectExamples(intent, included);
            if (!selected.isEmpty()) {
                sections.add(examplesSection(selected));
            }
        }
        String hints = hintSection(intent, included);
        if (!hints.isEmpty()) {
            sections.add(hints);
        }
        if (failed != null) {
            sections.add(repairSection(failed, maxAttempts));
        }
        sections.add(OUTPUT_CONTRACT);
        sections.add("## Question\n" + intent.question());

        String text = String.join("\n\n", sections);
        int tokens = tokenCounter.count(text);
        LOGGER.debug("Built {} prompt with {} tokens, {} chunks, {} dropped", mode, tokens, included.size(),
                dropped.size());
        return new Prompt(mode, text, tokens, included.stream().map(RetrievedChunk::id).toList(), dropped);
    }

    List<RetrievedChunk> fitToBudget(List<RetrievedChunk> ranked) {
        List<RetrievedChunk> kept = new ArrayList<>(ranked);
        int total = kept.stream().mapToInt(chunk -> tokenCounter.count(chunk.chunk().text())).sum();
        for (int i = kept.size() - 1; i >= 0 && total > tokenBudget; i--) {
            RetrievedChunk candidate = kept.get(i);
            if (!candidate.pinned()) {
                total -= tokenCounter.count(candidate.chunk().text());
                kept.remove(i);
            }
        }
        if (total > tokenBudget) {
            LOGGER.warn("Pinned schema context needs {} tokens, above the budget of {}", total, tokenBudget);
        }
        return kept;
    }

    private String schemaSection(List<RetrievedChunk> chunks) {
        StringBuilder section = new StringBuilder("## Schema context\n");
        if (chunks.isEmpty()) {
            section.append("No matching tables were found in the knowledge base.");
            return section.toString();
        }
        for (RetrievedChunk chunk : chunks) {
            section.append("\n<!-- ").append(chunk.id()).append(String.format(Locale.ROOT, ", relevance %.3f",
                    chunk.score()));
            if (chunk.pinned()) {
                section.append(", named in question");
            }
            section.append(" -->\n").append(chunk.chunk().text().strip()).append('\n');
        }
        return section.toString().stripTrailing();
    }

    private String rulesSection(List<BusinessRule> rules) {
        StringBuilder section = new StringBuilder("## Business rules");
        for (BusinessRule rule : rules) {
            section.append("\n- **").append(rule.key()).append("** (").append(rule.kind().label()).append("): ")
                    .append(rule.value());
        }
        return section.toString();
    }

    private String relationshipSection(List<RetrievedChunk> chunks) {
        Set<String> tables = new LinkedHashSet<>();
        chunks.forEach(chunk -> {
            if (chunk.tableName() != null) {
                tables.add(chunk.tableName().toLowerCase(Locale.ROOT));
            }
        });
        Set<String> lines = new LinkedHashSet<>();
        for (RetrievedChunk chunk : chunks) {
            String foreignKeys = chunk.chunk().metadata().getOrDefault(KnowledgeChunk.META_FOREIGN_KEYS, "");
            for (String relation : foreignKeys.split(",")) {
                String[] sides = relation.split("->");
                if (sides.length == 2 && tables.contains(tableOf(sides[0])) && tables.contains(tableOf(sides[1]))) {
                    lines.add("- " + relation.trim());
                }
            }
        }
        return lines.isEmpty() ? "" : "## Relationships\n" + String.join("\n", lines);
    }

    private static String tableOf(String qualifiedColumn) {
        String trimmed = qualifiedColumn.trim();
        int dot = trimmed.lastIndexOf('.');
        return (dot > 0 ? trimmed.substring(0, dot) : trimmed).toLowerCase(Locale.ROOT);
    }

    List<FewShotExample> selectExamples(QueryIntent intent, List<RetrievedChunk> included) {
        boolean aggregation = intent.category() == IntentCategory.AGGREGATION
                || intent.category() == IntentCategory.AVERAGE || intent.aggregation() != null;
        boolean grouping = !intent.dimensions().isEmpty();
        boolean join = included.stream().filter(chunk -> chunk.tableName() != null).count() > 1;
        boolean time = intent.timeRange() != null;
        boolean ranking = intent.isRanking();

        List<FewShotExample> selected = new ArrayList<>();
        for (FewShotExample example : examples) {
            boolean relevant = (aggregation && (example.uses("SUM(") || example.uses("COUNT(")))
                    || (grouping && example.uses("GROUP BY"))
                    || (join && example.uses("JOIN"))
                    || (time && example.uses("WHERE"))
                    || (ranking && example.uses("ORDER BY") && example.uses("LIMIT"));
            if (relevant) {
                selected.add(example);
            }
            if (selected.size() == MAX_EXAMPLES) {
                break;
            }
        }
        return selected;
    }

    private String examplesSection(List<FewShotExample> selected) {
        StringBuilder section = new StringBuilder("## Examples");
        int number = 1;
        for (FewShotExample example : selected) {
            section.append("\n\nExample ").append(number++).append(":\nQuestion: ").append(example.question())
                    .append("\n```sql\n").append(example.sql()).append("\n```");
            if (example.note() != null && !example.note().isBlank()) {
                section.append("\nNote: ").append(example.note());
            }
        }
        return section.toString();
    }

    private String hintSection(QueryIntent intent, List<RetrievedChunk> included) {
        StringJoiner hints = new StringJoiner("\n- ", "## Query hints\n- ", "");
        hints.setEmptyValue("");
        intent.time().ifPresent(range -> hints.add("The question refers to " + range.describe()
                + "; filter the relevant date column to " + range.start() + " .. " + range.end()
                + " using " + dialect.displayName() + " date functions."));
        intent.aggregationHint().ifPresent(aggregation -> hints.add("Aggregate with "
                + aggregation.sqlFunction() + "(...)"
                + (intent.dimensions().isEmpty() ? "." : " and GROUP BY the dimension(s) "
                        + String.join(", ", intent.dimensions()) + ".")));
        if (intent.aggregation() == null && !intent.dimensions().isEmpty()) {
            hints.add("Group the result by " + String.join(", ", intent.dimensions()) + ".");
        }
        if (intent.isRanking()) {
            hints.add("This is a ranking question; use ORDER BY with LIMIT.");
        }
        if (included.stream().filter(chunk -> chunk.tableName() != null).count() > 1) {
            hints.add("Several tables are involved; JOIN them on the listed relationships where needed.");
        }
        if (!intent.columns().isEmpty()) {
            hints.add("Columns named in the question: " + String.join(", ",
                    intent.columns().stream().map(ColumnMention::qualified).toList()) + ".");
        }
        if (!intent.filters().isEmpty()) {
            hints.add("Conditions stated in the question: " + String.join("; ",
                    intent.filters().stream().map(ComparisonFilter::describe).toList())
                    + ". Map each to the matching column.");
        }
        return hints.toString();
    }

    private String repairSection(RepairAttempt failed, int maxAttempts) {
        SqlCandidate candidate = failed.candidate();
        ValidationOutcome outcome = failed.outcome();
        StringBuilder section = new StringBuilder("## Previous attempt failed\n");
        section.append("Attempt ").append(candidate.attempt());
        if (maxAttempts > 0) {
            section.append(" of ").append(maxAttempts);
        }
        section.append(" produced ");
        if (candidate.hasSql()) {
            section.append("this statement:\n```sql\n").append(candidate.sql()).append("\n```\n");
        } else {
            section.append("no extractable SQL statement.\n");
        }
        section.append("Error kind: ").append(outcome.kind().label()).append('\n');
        section.append("Error message: ").append(outcome.message()).append('\n');
        String position = outcome.position();
        if (!position.isEmpty()) {
            section.append("Error position: ").append(position).append('\n');
        }
        section.append("Fix only this issue and keep the rest of the statement unchanged. This is repair attempt ")
                .append(candidate.attempt() + 1).append('.');
        return section.toString();
    }
}
