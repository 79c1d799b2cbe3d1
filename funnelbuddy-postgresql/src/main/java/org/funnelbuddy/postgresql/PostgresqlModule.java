package org.funnelbuddy.postgresql;

import com.google.inject.Binder;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.name.Names;
import org.funnelbuddy.analysis.FunnelAnalyzerModule;
import org.funnelbuddy.analysis.FunnelDefinitionStore;
import org.funnelbuddy.analysis.FunnelQueryCompiler;
import org.funnelbuddy.analysis.JDBCPoolDataSource;
import org.funnelbuddy.config.JDBCConfig;
import org.funnelbuddy.plugin.ConditionalModule;
import org.funnelbuddy.plugin.FunnelBuddyModule;
import org.funnelbuddy.postgresql.analysis.JDBCFunnelDefinitionStore;
import org.funnelbuddy.postgresql.analysis.PostgresqlFunnelQueryCompiler;
import org.funnelbuddy.postgresql.report.PostgresqlEventQueryExecutor;
import org.funnelbuddy.report.EventQueryExecutor;

import javax.inject.Inject;

@ConditionalModule(config = "store.adapter", value = "postgresql")
public class PostgresqlModule
        extends FunnelBuddyModule {
    public static final String EVENT_STORE = "store.adapter.postgresql";
    public static final String METADATA_STORE = "funnel.metadata.store.jdbc";

    public static final String INIT_QUERY = "set time zone 'UTC'";

    @Override
    protected void setup(Binder binder) {
        install(new FunnelAnalyzerModule());

        bindConfig(JDBCConfig.class, EVENT_STORE);
        binder.bind(JDBCPoolDataSource.class)
                .annotatedWith(Names.named(EVENT_STORE))
                .toProvider(new JDBCPoolDataSourceProvider(EVENT_STORE))
                .in(Scopes.SINGLETON);

        // funnel definitions share the event database unless a separate store is configured
        if (getConfig(METADATA_STORE + ".url") == null) {
            binder.bind(JDBCPoolDataSource.class)
                    .annotatedWith(Names.named(METADATA_STORE))
                    .to(Key.get(JDBCPoolDataSource.class, Names.named(EVENT_STORE)));
        } else {
            bindConfig(JDBCConfig.class, METADATA_STORE);
            binder.bind(JDBCPoolDataSource.class)
                    .annotatedWith(Names.named(METADATA_STORE))
                    .toProvider(new JDBCPoolDataSourceProvider(METADATA_STORE))
                    .in(Scopes.SINGLETON);
        }

        binder.bind(FunnelQueryCompiler.class).to(PostgresqlFunnelQueryCompiler.class).in(Scopes.SINGLETON);
        binder.bind(EventQueryExecutor.class).to(PostgresqlEventQueryExecutor.class).in(Scopes.SINGLETON);
        binder.bind(FunnelDefinitionStore.class).to(JDBCFunnelDefinitionStore.class).in(Scopes.SINGLETON);
    }

    @Override
    public String name() {
        return "Postgresql Module";
    }

    @Override
    public String description() {
        return "Runs funnel queries on a PostgreSQL event table and reads funnel definitions over JDBC";
    }

    private static class JDBCPoolDataSourceProvider
            implements Provider<JDBCPoolDataSource> {
        private final String name;
        private Injector injector;

        public JDBCPoolDataSourceProvider(String name) {
            this.name = name;
        }

        @Inject
        public void setInjector(Injector injector) {
            this.injector = injector;
        }

        @Override
        public JDBCPoolDataSource get() {
            JDBCConfig config = injector.getInstance(Key.get(JDBCConfig.class, Names.named(name)));
            return JDBCPoolDataSource.getOrCreateDataSource(config, INIT_QUERY);
        }
    }
}
