package ch.so.arp.rag.text2sql.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.text2sql.generation.SqlDialect;
import ch.so.arp.rag.text2sql.query.SchemaVocabulary;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.util.validation.Validation;
import net.sf.jsqlparser.util.validation.ValidationCapability;
import net.sf.jsqlparser.util.validation.ValidationContext;
import net.sf.jsqlparser.util.validation.ValidationException;
import net.sf.jsqlparser.util.validation.feature.DatabaseType;

/**
 * Static checks of a candidate statement with JSqlParser: the text must parse,
 * use only features of the target dialect and be exactly one read-only query
 * that calls no function with side effects. Given a schema, every referenced
 * table and column must also exist in it.
 */
public class SqlStatementValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlStatementValidator.class);

    private static final Pattern POSITION = Pattern.compile("line (\\d+), column (\\d+)");

    // Functions that change state outside the result set.
    private static final Set<String> SIDE_EFFECT_FUNCTIONS = Set.of(
            "setval", "nextval", "set_config", "lo_import", "lo_export", "lo_unlink", "lo_from_bytea",
            "pg_read_file", "pg_read_binary_file", "pg_ls_dir", "pg_sleep", "pg_terminate_backend",
            "pg_cancel_backend", "pg_reload_conf", "pg_advisory_lock", "pg_advisory_xact_lock", "dblink",
            "dblink_exec", "sleep", "benchmark", "get_lock", "release_lock", "load_file", "csvwrite", "csvread",
            "file_write", "file_read", "link_schema");

    private static final Set<String> LITERAL_WORDS = Set.of("true", "false", "null", "unknown");

    private final SqlDialect dialect;

    public SqlStatementValidator(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    /**
     * @return {@code success} without result, {@code syntax_error} or {@code policy_violation}
     */
    public ValidationOutcome check(String sql) {
        return check(sql, SchemaVocabulary.empty());
    }

    /**
     * Like {@link #check(String)} and additionally resolves tables and columns
     * against {@code schema}. An empty schema skips that step.
     *
     * @return also {@code execution_error} naming unknown tables or columns
     */
    public ValidationOutcome check(String sql, SchemaVocabulary schema) {
        if (sql == null || sql.isBlank()) {
            return ValidationOutcome.syntaxError("Empty statement", null, null, -1);
        }
        List<Statement> statements;
        try {
            statements = CCJSqlParserUtil.parseStatements(sql).getStatements();
        } catch (JSQLParserException ex) {
            return syntaxError(sql, ex);
        }
        if (statements == null || statements.isEmpty()) {
            return ValidationOutcome.syntaxError("No statement found", null, null, -1);
        }
        if (statements.size() > 1) {
            return ValidationOutcome.policyViolation(
                    "Only a single statement is allowed but found " + statements.size());
        }
        Statement statement = statements.get(0);
        if (!(statement instanceof Select select)) {
            return ValidationOutcome.policyViolation("Only read-only SELECT queries are allowed, found "
                    + statement.getClass().getSimpleName().toUpperCase(Locale.ROOT));
        }
        if (containsInto(select)) {
            return ValidationOutcome.policyViolation("SELECT ... INTO writes data and is not allowed");
        }
        StatementReferences references;
        try {
            references = StatementReferences.of(select);
        } catch (UnsupportedOperationException ex) {
            LOGGER.debug("Could not collect references of the statement: {}", ex.getMessage());
            references = null;
        }
        if (references != null) {
            List<String> forbidden = references.functions().stream()
                    .filter(SIDE_EFFECT_FUNCTIONS::contains)
                    .toList();
            if (!forbidden.isEmpty()) {
                return ValidationOutcome.policyViolation("Functions with side effects are not allowed: "
                        + String.join(", ", forbidden));
            }
        }
        String featureErrors = featureErrors(statement);
        if (!featureErrors.isEmpty()) {
            return ValidationOutcome.syntaxError(featureErrors, null, null, -1);
        }
        if (references != null && schema != null && !schema.isEmpty()) {
            String unknown = unknownReferences(references, schema);
            if (!unknown.isEmpty()) {
                LOGGER.debug("Statement references unknown schema objects: {}", unknown);
                return ValidationOutcome.executionError(unknown);
            }
        }
        return ValidationOutcome.success(null);
    }

    private static String unknownReferences(StatementReferences references, SchemaVocabulary schema) {
        List<String> unknownTables = references.tables().stream()
                .filter(table -> !schema.hasTable(table))
                .toList();
        if (!unknownTables.isEmpty()) {
            return "Unknown table(s): " + String.join(", ", unknownTables) + ". Known tables: "
                    + String.join(", ", schema.tables());
        }
        List<String> unknownColumns = new ArrayList<>();
        for (Column column : references.columns()) {
            String name = StatementReferences.name(column.getColumnName());
            if (LITERAL_WORDS.contains(name)) {
                continue;
            }
            if (column.getTable() != null && column.getTable().getName() != null) {
                String table = references.resolveQualifier(column.getTable().getName());
                if (table != null && !schema.hasColumn(table, name)) {
                    unknownColumns.add(table + "." + name);
                }
            } else if (!references.tables().isEmpty() && !references.hasDerivedSources()
                    && !references.isSelectAlias(name)
                    && references.tables().stream().noneMatch(table -> schema.hasColumn(table, name))) {
                unknownColumns.add(name);
            }
        }
        if (unknownColumns.isEmpty()) {
            return "";
        }
        return "Unknown column(s): " + unknownColumns.stream().distinct().collect(Collectors.joining(", "))
                + " in " + String.join(", ", references.tables());
    }

    private boolean containsInto(Select select) {
        if (select instanceof PlainSelect plain) {
            return plain.getIntoTables() != null && !plain.getIntoTables().isEmpty();
        }
        if (select instanceof SetOperationList operations) {
            return operations.getSelects().stream().anyMatch(this::containsInto);
        }
        if (select instanceof ParenthesedSelect parenthesed) {
            return parenthesed.getSelect() != null && containsInto(parenthesed.getSelect());
        }
        return false;
    }

    private String featureErrors(Statement statement) {
        DatabaseType databaseType = databaseType(dialect);
        if (databaseType == null) {
            return "";
        }
        ValidationContext context = new ValidationContext();
        context.setCapabilities(Collections.singletonList(databaseType));
        Map<ValidationCapability, Set<ValidationException>> errors = Validation.validate(statement, context);
        if (errors == null || errors.isEmpty()) {
            return "";
        }
        String message = errors.values().stream()
                .flatMap(Set::stream)
                .map(ValidationException::getMessage)
                .distinct()
                .sorted()
                .collect(Collectors.joining("; "));
        LOGGER.debug("Statement uses features not supported by {}: {}", dialect, message);
        return "Not supported by " + dialect.displayName() + ": " + message;
    }

    static DatabaseType databaseType(SqlDialect dialect) {
        switch (dialect) {
            case MYSQL:
                return DatabaseType.MYSQL;
            case POSTGRESQL:
                return DatabaseType.POSTGRESQL;
            case H2:
                return DatabaseType.H2;
            default:
                return null;
        }
    }

    private ValidationOutcome syntaxError(String sql, JSQLParserException ex) {
        String message = firstLine(ex.getMessage());
        for (Throwable current = ex; current != null; current = current.getCause()) {
            Matcher matcher = POSITION.matcher(String.valueOf(current.getMessage()));
            if (matcher.find()) {
                int line = Integer.parseInt(matcher.group(1));
                int column = Integer.parseInt(matcher.group(2));
                return ValidationOutcome.syntaxError(message, line, column, offset(sql, line, column));
            }
        }
        return ValidationOutcome.syntaxError(message, null, null, -1);
    }

    private static String firstLine(String message) {
        if (message == null || message.isBlank()) {
            return "Statement could not be parsed";
        }
        String trimmed = message.strip();
        int newline = trimmed.indexOf('\n');
        return newline > 0 ? trimmed.substring(0, newline).strip() : trimmed;
    }

    /**
     * 0-based character offset of a 1-based line and column, clamped to the text.
     */
    static int offset(String sql, int line, int column) {
        int offset = 0;
        int currentLine = 1;
        while (currentLine < line && offset < sql.length()) {
            int newline = sql.indexOf('\n', offset);
            if (newline < 0) {
                break;
            }
            offset = newline + 1;
            currentLine++;
        }
        return Math.min(offset + Math.max(column - 1, 0), sql.length());
    }
}
