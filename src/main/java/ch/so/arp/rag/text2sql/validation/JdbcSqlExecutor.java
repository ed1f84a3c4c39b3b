package ch.so.arp.rag.text2sql.validation;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Executes queries through a {@link JdbcTemplate} with a query timeout and a
 * row cap. Each query runs in its own read-only transaction that is always
 * rolled back, so a statement with side effects cannot change data. Database
 * errors and timeouts become {@code execution_error} outcomes.
 */
public class JdbcSqlExecutor implements SqlExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcSqlExecutor.class);

    private final JdbcTemplate jdbcTemplate;
    private final int maxRows;
    private final int timeoutSeconds;

    public JdbcSqlExecutor(DataSource dataSource, int maxRows, Duration timeout) {
        Objects.requireNonNull(dataSource, "dataSource");
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive");
        }
        this.maxRows = maxRows;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.timeoutSeconds = timeout != null && !timeout.isZero() && !timeout.isNegative()
                ? (int) Math.max(1, timeout.toSeconds()) : 0;
    }

    @Override
    public ValidationOutcome execute(String sql) {
        try {
            ExecutionResult result = jdbcTemplate.execute((ConnectionCallback<ExecutionResult>) connection ->
                    readOnly(connection, sql));
            LOGGER.debug("Query returned {} rows (truncated={})", result.rowCount(), result.truncated());
            return ValidationOutcome.success(result);
        } catch (DataAccessException ex) {
            String message = ex.getMostSpecificCause().getMessage();
            LOGGER.debug("Query failed: {}", message);
            return ValidationOutcome.executionError(message == null ? ex.getMessage() : message);
        }
    }

    private ExecutionResult readOnly(Connection connection, String sql) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        boolean readOnly = connection.isReadOnly();
        connection.setReadOnly(true);
        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.setMaxRows(maxRows + 1);
            if (timeoutSeconds > 0) {
                statement.setQueryTimeout(timeoutSeconds);
            }
            try (ResultSet rs = statement.executeQuery(sql)) {
                return extract(rs);
            }
        } finally {
            connection.rollback();
            connection.setAutoCommit(autoCommit);
            connection.setReadOnly(readOnly);
        }
    }

    private ExecutionResult extract(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (rows.size() == maxRows) {
                truncated = true;
                break;
            }
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }
        return new ExecutionResult(columns, rows, truncated);
    }
}
