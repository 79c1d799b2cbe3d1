package org.funnelbuddy.report;

public interface EventQueryExecutor {
    QueryExecution executeQuery(CompiledQuery query);
}
