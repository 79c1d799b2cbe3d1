package org.funnelbuddy.postgresql.report;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.name.Named;
import io.airlift.log.Logger;
import org.funnelbuddy.analysis.JDBCPoolDataSource;
import org.funnelbuddy.report.CompiledQuery;
import org.funnelbuddy.report.EventQueryExecutor;
import org.funnelbuddy.report.QueryExecution;

import javax.inject.Inject;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.funnelbuddy.postgresql.PostgresqlModule.EVENT_STORE;

public class PostgresqlEventQueryExecutor
        implements EventQueryExecutor {
    private final static Logger LOGGER = Logger.get(PostgresqlEventQueryExecutor.class);
    protected static final ExecutorService QUERY_EXECUTOR = new ThreadPoolExecutor(0, 1000,
            60L, TimeUnit.SECONDS,
            new SynchronousQueue<>(), new ThreadFactoryBuilder()
            .setNameFormat("jdbc-query-executor").build());

    private final JDBCPoolDataSource connectionPool;

    @Inject
    public PostgresqlEventQueryExecutor(@Named(EVENT_STORE) JDBCPoolDataSource connectionPool) {
        this.connectionPool = connectionPool;
    }

    @Override
    public QueryExecution executeQuery(CompiledQuery query) {
        LOGGER.debug("Running query on %s", connectionPool.getConfig().getUrl());
        return new JDBCQueryExecution(connectionPool, query, QUERY_EXECUTOR);
    }
}
