package org.funnelbuddy.analysis;

import com.google.common.collect.ImmutableList;
import org.funnelbuddy.report.CompiledQuery;
import org.funnelbuddy.report.EventQueryExecutor;
import org.funnelbuddy.report.QueryError;
import org.funnelbuddy.report.QueryExecution;
import org.funnelbuddy.report.QueryResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Returns the rows it was given for every query and remembers what it was asked to run.
 */
public class InMemoryEventQueryExecutor
        implements EventQueryExecutor {
    private final List<List<Object>> rows = new ArrayList<>();
    private final List<CompiledQuery> executedQueries = new ArrayList<>();
    private QueryError error;

    public InMemoryEventQueryExecutor addRow(Object... values) {
        rows.add(Arrays.asList(values));
        return this;
    }

    public void failWith(QueryError error) {
        this.error = error;
    }

    public List<CompiledQuery> getExecutedQueries() {
        return executedQueries;
    }

    @Override
    public QueryExecution executeQuery(CompiledQuery query) {
        executedQueries.add(query);
        if (error != null) {
            return QueryExecution.completedQueryExecution(QueryResult.errorResult(error, query.getSql()));
        }
        return QueryExecution.completedQueryExecution(new QueryResult(ImmutableList.of(), ImmutableList.copyOf(rows)));
    }
}
