package ch.so.arp.rag.text2sql.query;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structured reading of a question.
 *
 * @param question the original question
 * @param tables tables named verbatim in the question
 * @param columns columns named in the question that resolve to exactly one table
 * @param category coarse intent of the question
 * @param aggregation suggested aggregate function, {@code null} if none
 * @param metrics metric words found in the question
 * @param dimensions group-by dimensions found in the question
 * @param timeRange referenced date range, {@code null} if none
 * @param explicitDates dates written out in the question
 * @param enhancedQuery search text enriched with entity, metric and dimension words
 * @param filters comparisons spelled out in the question
 */
public record QueryIntent(
        String question,
        List<String> tables,
        List<ColumnMention> columns,
        IntentCategory category,
        AggregationHint aggregation,
        List<String> metrics,
        List<String> dimensions,
        TimeRange timeRange,
        List<LocalDate> explicitDates,
        String enhancedQuery,
        List<ComparisonFilter> filters) {

    public QueryIntent {
        tables = List.copyOf(tables);
        filters = filters == null ? List.of() : List.copyOf(filters);
        columns = List.copyOf(columns);
        metrics = List.copyOf(metrics);
        dimensions = List.copyOf(dimensions);
        explicitDates = List.copyOf(explicitDates);
        enhancedQuery = enhancedQuery == null ? question : enhancedQuery;
    }

    public QueryIntent(String question, List<String> tables, List<ColumnMention> columns, IntentCategory category,
            AggregationHint aggregation, List<String> metrics, List<String> dimensions, TimeRange timeRange,
            List<LocalDate> explicitDates, String enhancedQuery) {
        this(question, tables, columns, category, aggregation, metrics, dimensions, timeRange, explicitDates,
                enhancedQuery, List.of());
    }

    /**
     * Tables whose chunks must be part of the retrieved context: every table
     * named directly plus the owners of named columns.
     */
    public Set<String> pinnedTables() {
        Set<String> pinned = new LinkedHashSet<>(tables);
        columns.forEach(column -> pinned.add(column.table()));
        return pinned;
    }

    public Optional<TimeRange> time() {
        return Optional.ofNullable(timeRange);
    }

    public Optional<AggregationHint> aggregationHint() {
        return Optional.ofNullable(aggregation);
    }

    public boolean isRanking() {
        return category == IntentCategory.RANKING || category == IntentCategory.EXTREME;
    }
}
