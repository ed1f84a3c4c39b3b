package ch.so.arp.rag.text2sql.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

class JdbcSqlExecutorTest {

    private DataSource dataSource;

    @BeforeEach
    void createDatabase() {
        DriverManagerDataSource source = new DriverManagerDataSource();
        source.setDriverClassName("org.h2.Driver");
        source.setUrl("jdbc:h2:mem:executor-" + System.nanoTime() + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        source.setUsername("sa");
        source.setPassword("");
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource("db/shop.sql"));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(source);
        dataSource = source;
    }

    @Test
    void returnsColumnsAndRows() {
        JdbcSqlExecutor executor = new JdbcSqlExecutor(dataSource, 100, Duration.ofSeconds(5));

        ValidationOutcome outcome = executor.execute(
                "SELECT user_id, COUNT(*) AS order_count FROM orders GROUP BY user_id ORDER BY user_id");

        assertThat(outcome.isSuccess()).isTrue();
        ExecutionResult result = outcome.result();
        assertThat(result.columns()).containsExactly("user_id", "order_count");
        assertThat(result.rowCount()).isEqualTo(3);
        assertThat(result.truncated()).isFalse();
        assertThat(((Number) result.rows().get(0).get(1)).longValue()).isEqualTo(2L);
    }

    @Test
    void capsRowsAndFlagsTruncation() {
        JdbcSqlExecutor executor = new JdbcSqlExecutor(dataSource, 2, null);

        ValidationOutcome outcome = executor.execute("SELECT id FROM orders ORDER BY id");

        assertThat(outcome.result().rowCount()).isEqualTo(2);
        assertThat(outcome.result().truncated()).isTrue();
    }

    @Test
    void exactRowCountIsNotTruncated() {
        JdbcSqlExecutor executor = new JdbcSqlExecutor(dataSource, 3, null);

        assertThat(executor.execute("SELECT id FROM users").result().truncated()).isFalse();
    }

    @Test
    void unknownColumnBecomesExecutionError() {
        JdbcSqlExecutor executor = new JdbcSqlExecutor(dataSource, 10, null);

        ValidationOutcome outcome = executor.execute("SELECT amount FROM orders");

        assertThat(outcome.kind()).isEqualTo(ValidationOutcome.Kind.EXECUTION_ERROR);
        assertThat(outcome.message()).containsIgnoringCase("amount");
        assertThat(outcome.result()).isNull();
    }

    @Test
    void runsInReadOnlyTransactionThatIsRolledBack() throws SQLException {
        DataSource mocked = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        ResultSet rows = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(mocked.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.isReadOnly()).thenReturn(false);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery("SELECT 1 AS one")).thenReturn(rows);
        when(rows.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(1);
        when(meta.getColumnLabel(1)).thenReturn("one");
        when(rows.next()).thenReturn(true, false);
        when(rows.getObject(1)).thenReturn(1);

        ValidationOutcome outcome = new JdbcSqlExecutor(mocked, 10, Duration.ofSeconds(3)).execute("SELECT 1 AS one");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.result().rows()).containsExactly(List.of(1));
        InOrder order = inOrder(connection, statement);
        order.verify(connection).setReadOnly(true);
        order.verify(connection).setAutoCommit(false);
        order.verify(statement).setMaxRows(11);
        order.verify(statement).setQueryTimeout(3);
        order.verify(statement).executeQuery("SELECT 1 AS one");
        order.verify(connection).rollback();
        order.verify(connection).setAutoCommit(true);
        order.verify(connection).setReadOnly(false);
    }

    @Test
    void dataChangingQueryLeavesTablesUnchanged() {
        JdbcSqlExecutor executor = new JdbcSqlExecutor(dataSource, 10, null);

        executor.execute("SELECT id FROM FINAL TABLE (INSERT INTO users (id, user_name) VALUES (99, 'mallory'))");

        Integer users = new JdbcTemplate(dataSource).queryForObject("SELECT COUNT(*) FROM users", Integer.class);
        assertThat(users).isEqualTo(3);
    }

    @Test
    void rejectsNonPositiveRowCap() {
        assertThatThrownBy(() -> new JdbcSqlExecutor(dataSource, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
