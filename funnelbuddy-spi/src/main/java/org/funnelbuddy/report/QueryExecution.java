package org.funnelbuddy.report;


import java.util.concurrent.CompletableFuture;


public interface QueryExecution {
    static QueryExecution completedQueryExecution(QueryResult result) {
        return new QueryExecution() {
            @Override
            public QueryStats currentStats() {
                return new QueryStats(100, result.isFailed() ? QueryStats.State.FAILED : QueryStats.State.FINISHED);
            }

            @Override
            public boolean isFinished() {
                return true;
            }

            @Override
            public CompletableFuture<QueryResult> getResult() {
                return CompletableFuture.completedFuture(result);
            }

            @Override
            public void kill() {
            }
        };
    }

    QueryStats currentStats();

    boolean isFinished();

    CompletableFuture<QueryResult> getResult();

    void kill();
}
