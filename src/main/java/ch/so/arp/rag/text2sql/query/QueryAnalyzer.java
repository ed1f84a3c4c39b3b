package ch.so.arp.rag.text2sql.query;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.text2sql.metadata.Identifiers;

/**
 * Extracts entities, intent, aggregation, metrics, dimensions and time ranges
 * from a question with keyword and pattern rules. Chinese and English wording
 * are both recognised. Relative dates are resolved against the injected
 * {@link Clock}.
 */
public class QueryAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryAnalyzer.class);

    private static final Pattern QUALIFIED_COLUMN = Pattern.compile(
            "(?<![A-Za-z0-9_])([A-Za-z_][A-Za-z0-9_]*)\\.([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern IDENTIFIER = Pattern.compile("(?<![A-Za-z0-9_])[A-Za-z_][A-Za-z0-9_]*");

    private static final List<Pattern> METRIC_PATTERNS = List.of(
            Pattern.compile("总额|总金额|总计|合计"),
            Pattern.compile("平均值|均值|平均"),
            Pattern.compile("最大值|最高|最大"),
            Pattern.compile("最小值|最低|最小"),
            Pattern.compile("数量|个数|总数"),
            Pattern.compile("客单价|人均消费"),
            Pattern.compile("销售额|营收|收入"),
            Pattern.compile("利润|盈利"),
            Pattern.compile("成本|花费"),
            Pattern.compile("\\b(?:revenue|sales|profit|cost|total|amount|count)\\b", Pattern.CASE_INSENSITIVE));

    private static final String DIMENSION_BODY = "([\\p{IsHan}A-Za-z0-9_]+?)";
    private static final String DIMENSION_END = "(?=的|统计|计算|汇总|分组|排名|数量|总数|[，,。.？?！!\\s]|$)";
    private static final List<Pattern> DIMENSION_PATTERNS = List.of(
            Pattern.compile("按" + DIMENSION_BODY + DIMENSION_END),
            Pattern.compile("每个" + DIMENSION_BODY + DIMENSION_END),
            Pattern.compile("各个" + DIMENSION_BODY + DIMENSION_END),
            Pattern.compile("\\b(?:per|by|for each)\\s+([A-Za-z_][A-Za-z0-9_]*)", Pattern.CASE_INSENSITIVE));

    private static final String FILTER_FIELD = "([A-Za-z_][A-Za-z0-9_.]*|\\p{IsHan}+?)\\s*";
    private static final String FILTER_NUMBER = "\\s*(-?\\d+(?:\\.\\d+)?)";
    private static final String FILTER_VALUE = "\\s*([A-Za-z0-9_.,\\-]+|\\p{IsHan}+?)(?=的|[，,。.？?！!\\s]|$)";

    // Negated and compound operators come first so that their spans win.
    private static final Map<ComparisonFilter.Operator, Pattern> FILTER_PATTERNS = new LinkedHashMap<>();

    private static final Pattern LEADING_VERBS = Pattern.compile("^(?:查询|显示|获取|计算|统计|找出|列出|查找|所有)+");
    private static final Set<String> QUESTION_WORDS = Set.of("多少", "什么", "哪些", "哪个", "几", "谁", "怎样");

    static {
        FILTER_PATTERNS.put(ComparisonFilter.Operator.NE,
                Pattern.compile(FILTER_FIELD + "(?:不等于|!=|<>|不是)" + FILTER_VALUE));
        FILTER_PATTERNS.put(ComparisonFilter.Operator.NOT_IN,
                Pattern.compile(FILTER_FIELD + "(?:不在|不包含|不属于)" + FILTER_VALUE));
        FILTER_PATTERNS.put(ComparisonFilter.Operator.GTE,
                Pattern.compile(FILTER_FIELD + "(?:大于等于|不少于|不低于|>=)" + FILTER_NUMBER));
        FILTER_PATTERNS.put(ComparisonFilter.Operator.LTE,
                Pattern.compile(FILTER_FIELD + "(?:小于等于|不超过|不高于|<=)" + FILTER_NUMBER));
        FILTER_PATTERNS.put(ComparisonFilter.Operator.GT,
                Pattern.compile(FILTER_FIELD + "(?:大于|超过|高于|>)" + FILTER_NUMBER));
        FILTER_PATTERNS.put(ComparisonFilter.Operator.LT,
                Pattern.compile(FILTER_FIELD + "(?:小于|低于|少于|<)" + FILTER_NUMBER));
        FILTER_PATTERNS.put(ComparisonFilter.Operator.EQ,
                Pattern.compile(FILTER_FIELD + "(?:等于|=|是)" + FILTER_VALUE));
        FILTER_PATTERNS.put(ComparisonFilter.Operator.IN,
                Pattern.compile(FILTER_FIELD + "(?:包含|属于)" + FILTER_VALUE));
    }

    private static final Map<IntentCategory, List<String>> INTENT_KEYWORDS = new LinkedHashMap<>();
    private static final Map<AggregationHint, List<String>> AGGREGATION_KEYWORDS = new LinkedHashMap<>();

    static {
        INTENT_KEYWORDS.put(IntentCategory.AGGREGATION, List.of("统计", "计算", "多少", "几个", "how many",
                "how much", "total", "count", "sum"));
        INTENT_KEYWORDS.put(IntentCategory.EXTREME, List.of("最高", "最大", "最低", "最小", "highest", "largest",
                "lowest", "smallest", "maximum", "minimum"));
        INTENT_KEYWORDS.put(IntentCategory.AVERAGE, List.of("平均", "均值", "average", "mean"));
        INTENT_KEYWORDS.put(IntentCategory.RANKING, List.of("排名", "排行", "top", "rank"));
        INTENT_KEYWORDS.put(IntentCategory.TREND, List.of("趋势", "变化", "增长", "trend", "growth", "over time"));
        INTENT_KEYWORDS.put(IntentCategory.PROPORTION, List.of("占比", "比例", "百分比", "proportion",
                "percentage", "ratio", "share"));

        AGGREGATION_KEYWORDS.put(AggregationHint.SUM, List.of("总额", "总金额", "总计", "合计", "销售额", "营收",
                "收入", "gmv", "total", "sum", "revenue"));
        AGGREGATION_KEYWORDS.put(AggregationHint.AVG, List.of("平均值", "均值", "平均", "客单价", "人均消费",
                "average", "avg", "mean"));
        AGGREGATION_KEYWORDS.put(AggregationHint.MAX, List.of("最大值", "最高", "最大", "maximum", "highest", "max"));
        AGGREGATION_KEYWORDS.put(AggregationHint.MIN, List.of("最小值", "最低", "最小", "minimum", "lowest", "min"));
        AGGREGATION_KEYWORDS.put(AggregationHint.COUNT, List.of("数量", "个数", "总数", "how many", "number of",
                "count"));
    }

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})"),
            Pattern.compile("(\\d{4})/(\\d{1,2})/(\\d{1,2})"),
            Pattern.compile("(\\d{4})年(\\d{1,2})月(\\d{1,2})日"));

    private final Clock clock;
    private final Map<String, Function<LocalDate, LocalDate[]>> relativeRanges;

    public QueryAnalyzer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.relativeRanges = relativeRanges();
    }

    public QueryIntent analyze(String question, SchemaVocabulary vocabulary) {
        Objects.requireNonNull(question, "question");
        SchemaVocabulary known = vocabulary == null ? SchemaVocabulary.empty() : vocabulary;
        String lower = question.toLowerCase(Locale.ROOT);

        List<String> tables = mentionedTables(question, known);
        List<ColumnMention> columns = mentionedColumns(question, known);
        IntentCategory category = classify(lower);
        AggregationHint aggregation = detectAggregation(lower);
        List<String> metrics = findAll(question, METRIC_PATTERNS, 0);
        List<String> dimensions = findAll(question, DIMENSION_PATTERNS, 1);
        List<LocalDate> dates = explicitDates(question);
        TimeRange timeRange = timeRange(question, lower, dates);
        List<ComparisonFilter> filters = filters(question);

        Set<String> enhancement = new LinkedHashSet<>();
        enhancement.addAll(tables);
        columns.forEach(column -> enhancement.add(column.column()));
        enhancement.addAll(metrics);
        enhancement.addAll(dimensions);
        filters.forEach(filter -> enhancement.add(filter.field()));
        String enhanced = enhancement.isEmpty() ? question : question + " " + String.join(" ", enhancement);

        QueryIntent intent = new QueryIntent(question, tables, columns, category, aggregation, metrics, dimensions,
                timeRange, dates, enhanced, filters);
        LOGGER.debug("Analyzed question: category={}, tables={}, columns={}, aggregation={}, time={}, filters={}",
                category.label(), tables, columns, aggregation, timeRange, filters);
        return intent;
    }

    private List<String> mentionedTables(String question, SchemaVocabulary vocabulary) {
        List<String> tables = new ArrayList<>();
        for (String table : vocabulary.tables()) {
            if (Identifiers.mentions(question, table)) {
                tables.add(table);
            }
        }
        return tables;
    }

    private List<ColumnMention> mentionedColumns(String question, SchemaVocabulary vocabulary) {
        Set<ColumnMention> mentions = new LinkedHashSet<>();
        Matcher qualified = QUALIFIED_COLUMN.matcher(question);
        while (qualified.find()) {
            String table = qualified.group(1);
            String column = qualified.group(2);
            if (vocabulary.hasTable(table) && vocabulary.hasColumn(vocabulary.canonicalTable(table), column)) {
                mentions.add(new ColumnMention(vocabulary.canonicalTable(table), column));
            }
        }
        Matcher identifiers = IDENTIFIER.matcher(question);
        while (identifiers.find()) {
            String word = identifiers.group();
            if (word.length() < 3 || word.equalsIgnoreCase("id") || vocabulary.hasTable(word)) {
                continue;
            }
            List<String> owners = vocabulary.tablesWithColumn(word);
            if (owners.size() == 1) {
                mentions.add(new ColumnMention(owners.get(0), word));
            }
        }
        return new ArrayList<>(mentions);
    }

    private IntentCategory classify(String lower) {
        for (Map.Entry<IntentCategory, List<String>> entry : INTENT_KEYWORDS.entrySet()) {
            if (containsAny(lower, entry.getValue())) {
                return entry.getKey();
            }
        }
        return IntentCategory.SIMPLE;
    }

    private AggregationHint detectAggregation(String lower) {
        for (Map.Entry<AggregationHint, List<String>> entry : AGGREGATION_KEYWORDS.entrySet()) {
            if (containsAny(lower, entry.getValue())) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static boolean containsAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (isAscii(keyword) ? Identifiers.mentions(lower, keyword) : lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAscii(String keyword) {
        return keyword.chars().allMatch(c -> c < 128);
    }

    private static List<String> findAll(String question, List<Pattern> patterns, int group) {
        Set<String> found = new LinkedHashSet<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(question);
            while (matcher.find()) {
                found.add(matcher.group(group));
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Comparisons such as {@code 金额大于100} or {@code status = paid}. A span of
     * the question is used by at most one filter.
     */
    static List<ComparisonFilter> filters(String question) {
        List<ComparisonFilter> filters = new ArrayList<>();
        List<int[]> used = new ArrayList<>();
        for (Map.Entry<ComparisonFilter.Operator, Pattern> entry : FILTER_PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(question);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                if (used.stream().anyMatch(span -> start < span[1] && span[0] < end)) {
                    continue;
                }
                String field = LEADING_VERBS.matcher(matcher.group(1)).replaceFirst("");
                String value = matcher.group(2);
                if (field.isEmpty() || QUESTION_WORDS.contains(value)) {
                    continue;
                }
                used.add(new int[] { start, end });
                filters.add(new ComparisonFilter(field, entry.getKey(), value));
            }
        }
        return filters;
    }

    private List<LocalDate> explicitDates(String question) {
        List<LocalDate> dates = new ArrayList<>();
        for (Pattern pattern : DATE_PATTERNS) {
            Matcher matcher = pattern.matcher(question);
            while (matcher.find()) {
                try {
                    dates.add(LocalDate.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                            Integer.parseInt(matcher.group(3))));
                } catch (DateTimeException ex) {
                    LOGGER.debug("Ignoring invalid date '{}' in question: {}", matcher.group(), ex.getMessage());
                }
            }
        }
        dates.sort(null);
        return dates;
    }

    private TimeRange timeRange(String question, String lower, List<LocalDate> dates) {
        LocalDate today = LocalDate.now(clock);
        int bestPosition = Integer.MAX_VALUE;
        TimeRange best = null;
        for (Map.Entry<String, Function<LocalDate, LocalDate[]>> entry : relativeRanges.entrySet()) {
            int position = lower.indexOf(entry.getKey());
            if (position >= 0 && position < bestPosition) {
                LocalDate[] range = entry.getValue().apply(today);
                bestPosition = position;
                best = new TimeRange(question.substring(position, position + entry.getKey().length()), range[0],
                        range[1]);
            }
        }
        if (best != null) {
            return best;
        }
        if (!dates.isEmpty()) {
            LocalDate first = dates.get(0);
            LocalDate last = dates.get(dates.size() - 1);
            String expression = first.equals(last) ? first.toString() : first + " - " + last;
            return new TimeRange(expression, first, last);
        }
        return null;
    }

    private static Map<String, Function<LocalDate, LocalDate[]>> relativeRanges() {
        Map<String, Function<LocalDate, LocalDate[]>> ranges = new LinkedHashMap<>();
        Function<LocalDate, LocalDate[]> today = day -> new LocalDate[] { day, day };
        Function<LocalDate, LocalDate[]> yesterday = day -> new LocalDate[] { day.minusDays(1), day.minusDays(1) };
        Function<LocalDate, LocalDate[]> thisWeek = day -> {
            LocalDate monday = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            return new LocalDate[] { monday, monday.plusDays(6) };
        };
        Function<LocalDate, LocalDate[]> lastWeek = day -> {
            LocalDate monday = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
            return new LocalDate[] { monday, monday.plusDays(6) };
        };
        Function<LocalDate, LocalDate[]> thisMonth = day -> new LocalDate[] { day.withDayOfMonth(1), day };
        Function<LocalDate, LocalDate[]> lastMonth = day -> {
            LocalDate first = day.withDayOfMonth(1).minusMonths(1);
            return new LocalDate[] { first, first.with(TemporalAdjusters.lastDayOfMonth()) };
        };
        Function<LocalDate, LocalDate[]> thisYear = day -> new LocalDate[] { day.withDayOfYear(1), day };
        Function<LocalDate, LocalDate[]> lastYear = day -> {
            LocalDate first = day.withDayOfYear(1).minusYears(1);
            return new LocalDate[] { first, first.with(TemporalAdjusters.lastDayOfYear()) };
        };
        ranges.put("今天", today);
        ranges.put("昨天", yesterday);
        ranges.put("本周", thisWeek);
        ranges.put("上周", lastWeek);
        ranges.put("本月", thisMonth);
        ranges.put("上月", lastMonth);
        ranges.put("今年", thisYear);
        ranges.put("去年", lastYear);
        ranges.put("today", today);
        ranges.put("yesterday", yesterday);
        ranges.put("this week", thisWeek);
        ranges.put("last week", lastWeek);
        ranges.put("this month", thisMonth);
        ranges.put("last month", lastMonth);
        ranges.put("this year", thisYear);
        ranges.put("last year", lastYear);
        return ranges;
    }
}
