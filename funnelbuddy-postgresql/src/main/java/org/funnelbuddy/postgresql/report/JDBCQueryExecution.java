package org.funnelbuddy.postgresql.report;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;
import org.funnelbuddy.collection.FieldType;
import org.funnelbuddy.collection.SchemaField;
import org.funnelbuddy.report.CompiledQuery;
import org.funnelbuddy.report.QueryError;
import org.funnelbuddy.report.QueryExecution;
import org.funnelbuddy.report.QueryResult;
import org.funnelbuddy.report.QueryStats;

import javax.sql.DataSource;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.funnelbuddy.collection.FieldType.STRING;
import static org.funnelbuddy.report.QueryResult.EXECUTION_TIME;
import static org.funnelbuddy.report.QueryResult.QUERY;
import static org.funnelbuddy.report.QueryStats.State.FAILED;
import static org.funnelbuddy.report.QueryStats.State.FINISHED;
import static org.funnelbuddy.report.QueryStats.State.RUNNING;

/**
 * Runs a compiled query on a pooled connection. Failures are reported through an error
 * {@link QueryResult} and logged by the caller, the returned future never completes exceptionally.
 */
public class JDBCQueryExecution
        implements QueryExecution {
    private final static Logger LOGGER = Logger.get(JDBCQueryExecution.class);

    private final CompletableFuture<QueryResult> result;
    private final String query;
    private volatile PreparedStatement statement;

    public JDBCQueryExecution(DataSource dataSource, CompiledQuery compiledQuery, Executor executor) {
        this.query = compiledQuery.getSql();

        this.result = CompletableFuture.supplyAsync(() -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement preparedStatement = connection.prepareStatement(query)) {
                statement = preparedStatement;
                List<Object> parameters = compiledQuery.getParameters();
                for (int i = 0; i < parameters.size(); i++) {
                    preparedStatement.setObject(i + 1, parameters.get(i));
                }

                long beforeExecuted = System.currentTimeMillis();
                try (ResultSet resultSet = preparedStatement.executeQuery()) {
                    return resultSetToQueryResult(resultSet, System.currentTimeMillis() - beforeExecuted);
                }
            } catch (SQLException e) {
                return QueryResult.errorResult(new QueryError(e.getMessage(), e.getSQLState(), e.getErrorCode()), query);
            } catch (RuntimeException e) {
                return QueryResult.errorResult(QueryError.create(e.getMessage()), query);
            } finally {
                statement = null;
            }
        }, executor);
    }

    @Override
    public QueryStats currentStats() {
        if (!result.isDone()) {
            return new QueryStats(null, RUNNING);
        }
        return new QueryStats(100, result.join().isFailed() ? FAILED : FINISHED);
    }

    @Override
    public boolean isFinished() {
        return result.isDone();
    }

    @Override
    public CompletableFuture<QueryResult> getResult() {
        return result;
    }

    @Override
    public void kill() {
        PreparedStatement running = statement;
        if (running != null) {
            try {
                running.cancel();
            } catch (SQLException e) {
                LOGGER.warn(e, "Unable to cancel query");
            }
        }
    }

    private QueryResult resultSetToQueryResult(ResultSet resultSet, long executionTimeInMillis)
            throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<SchemaField> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new SchemaField(metaData.getColumnName(i), fromSql(metaData.getColumnType(i))));
        }

        ImmutableList.Builder<List<Object>> builder = ImmutableList.builder();
        while (resultSet.next()) {
            List<Object> row = Arrays.asList(new Object[columnCount]);
            for (int i = 0; i < columnCount; i++) {
                int columnIndex = i + 1;
                Object object;
                switch (columns.get(i).getType()) {
                    case STRING:
                        object = resultSet.getString(columnIndex);
                        break;
                    case LONG:
                        object = resultSet.getLong(columnIndex);
                        break;
                    case INTEGER:
                        object = resultSet.getInt(columnIndex);
                        break;
                    case DECIMAL:
                        BigDecimal bigDecimal = resultSet.getBigDecimal(columnIndex);
                        object = bigDecimal != null ? bigDecimal.doubleValue() : null;
                        break;
                    case DOUBLE:
                        object = resultSet.getDouble(columnIndex);
                        break;
                    case BOOLEAN:
                        object = resultSet.getBoolean(columnIndex);
                        break;
                    case TIMESTAMP:
                        object = readTimestamp(resultSet, columnIndex, metaData.getColumnTypeName(columnIndex));
                        break;
                    case DATE:
                        object = resultSet.getObject(columnIndex, LocalDate.class);
                        break;
                    default:
                        object = resultSet.getString(columnIndex);
                }

                if (resultSet.wasNull()) {
                    object = null;
                }
                row.set(i, object);
            }
            builder.add(row);
        }

        return new QueryResult(columns, builder.build(), ImmutableMap.of(EXECUTION_TIME, executionTimeInMillis, QUERY, query));
    }

    private static Object readTimestamp(ResultSet resultSet, int columnIndex, String typeName)
            throws SQLException {
        if ("timestamptz".equalsIgnoreCase(typeName)) {
            OffsetDateTime value = resultSet.getObject(columnIndex, OffsetDateTime.class);
            return value == null ? null : value.toInstant();
        }

        LocalDateTime value = resultSet.getObject(columnIndex, LocalDateTime.class);
        return value == null ? null : value.toInstant(ZoneOffset.UTC);
    }

    static FieldType fromSql(int sqlType) {
        switch (sqlType) {
            case Types.BIGINT:
                return FieldType.LONG;
            case Types.INTEGER:
            case Types.SMALLINT:
            case Types.TINYINT:
                return FieldType.INTEGER;
            case Types.NUMERIC:
            case Types.DECIMAL:
                return FieldType.DECIMAL;
            case Types.DOUBLE:
            case Types.FLOAT:
            case Types.REAL:
                return FieldType.DOUBLE;
            case Types.BOOLEAN:
            case Types.BIT:
                return FieldType.BOOLEAN;
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return FieldType.TIMESTAMP;
            case Types.DATE:
                return FieldType.DATE;
            default:
                return STRING;
        }
    }
}
