package gr.imsi.athenarc.pipeline.datasource.executor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.pipeline.datasource.DatasourceException;
import gr.imsi.athenarc.pipeline.datasource.DatasourceTimeoutException;
import gr.imsi.athenarc.pipeline.datasource.connection.JDBCConnection;
import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;

/**
 * Runs SQL statements over a {@link JDBCConnection} and materializes the result
 * set as a {@link TabularResult}, normalizing driver values to the Java type of
 * their column tag. Timestamps without zone are read as UTC.
 */
public class SQLQueryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(SQLQueryExecutor.class);

    // PostgreSQL reports statement timeouts as query_canceled instead of SQLTimeoutException
    private static final String QUERY_CANCELED_STATE = "57014";

    private final JDBCConnection databaseConnection;

    public SQLQueryExecutor(JDBCConnection databaseConnection) {
        this.databaseConnection = databaseConnection;
    }

    public TabularResult executeDbQuery(String query, Duration timeout) {
        LOG.debug("Executing Query: \n{}", query);
        try (Connection connection = databaseConnection.getConnection();
             Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(toSeconds(timeout));
            try (ResultSet resultSet = statement.executeQuery(query)) {
                return toTabularResult(resultSet);
            }
        } catch (SQLTimeoutException e) {
            throw new DatasourceTimeoutException("Query exceeded timeout of " + timeout, e);
        } catch (SQLException e) {
            if (QUERY_CANCELED_STATE.equals(e.getSQLState())) {
                throw new DatasourceTimeoutException("Query exceeded timeout of " + timeout, e);
            }
            throw new DatasourceException("Error executing query: " + e.getMessage(), e);
        }
    }

    public JDBCConnection getConnection() {
        return databaseConnection;
    }

    static int toSeconds(Duration timeout) {
        // JDBC counts whole seconds and treats 0 as unlimited
        long seconds = (timeout.toMillis() + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }

    private static TabularResult toTabularResult(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        TabularResult.Builder builder = TabularResult.builder();
        List<ColumnType> types = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            ColumnType type = ColumnType.fromSqlType(metaData.getColumnType(i));
            types.add(type);
            builder.column(metaData.getColumnLabel(i), type);
        }
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(normalize(resultSet.getObject(i), types.get(i - 1)));
            }
            builder.row(row);
        }
        return builder.build();
    }

    static Object normalize(Object value, ColumnType type) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return value instanceof Number ? ((Number) value).longValue() : Long.valueOf(value.toString());
            case FLOAT:
                return value instanceof Number ? ((Number) value).doubleValue() : Double.valueOf(value.toString());
            case DECIMAL:
                if (value instanceof BigDecimal) {
                    return value;
                }
                if (value instanceof BigInteger) {
                    return new BigDecimal((BigInteger) value);
                }
                return new BigDecimal(value.toString());
            case BOOLEAN:
                return value instanceof Boolean ? value : Boolean.valueOf(value.toString());
            case TIMESTAMP:
                return toInstant(value);
            default:
                return value.toString();
        }
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        throw new DatasourceException("Unsupported temporal value of type " + value.getClass().getName());
    }
}
