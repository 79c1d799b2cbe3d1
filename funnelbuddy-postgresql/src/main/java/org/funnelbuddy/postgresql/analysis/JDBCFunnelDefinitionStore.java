package org.funnelbuddy.postgresql.analysis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import com.google.inject.name.Named;
import org.funnelbuddy.analysis.FunnelDefinitionStore;
import org.funnelbuddy.analysis.JDBCPoolDataSource;
import org.funnelbuddy.analysis.funnel.FunnelDefinition;
import org.funnelbuddy.analysis.funnel.FunnelFilter;
import org.funnelbuddy.analysis.funnel.FunnelGoal;
import org.funnelbuddy.analysis.funnel.FunnelStep;
import org.funnelbuddy.util.FunnelBuddyException;
import org.funnelbuddy.util.JsonHelper;
import org.skife.jdbi.v2.DBI;
import org.skife.jdbi.v2.Handle;
import org.skife.jdbi.v2.tweak.ResultSetMapper;

import javax.inject.Inject;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static java.lang.String.format;
import static org.funnelbuddy.postgresql.PostgresqlModule.METADATA_STORE;

/**
 * Reads funnel definitions and goals that the dashboard keeps in PostgreSQL. Steps and filters
 * are stored as jsonb arrays.
 */
public class JDBCFunnelDefinitionStore
        implements FunnelDefinitionStore {
    static final TypeReference<List<FunnelStep>> STEPS = new TypeReference<List<FunnelStep>>() {};
    static final TypeReference<List<FunnelFilter>> FILTERS = new TypeReference<List<FunnelFilter>>() {};

    private static final String FUNNEL_COLUMNS = "id, \"websiteId\", name, description, steps, filters, " +
            "\"isActive\", \"createdAt\", \"updatedAt\", \"deletedAt\"";

    private final DBI dbi;

    private final ResultSetMapper<FunnelDefinition> funnelMapper = (index, r, ctx) ->
            new FunnelDefinition(
                    r.getString("id"),
                    r.getString("websiteId"),
                    r.getString("name"),
                    r.getString("description"),
                    readJson(r.getString("id"), r.getString("steps"), STEPS),
                    readJson(r.getString("id"), r.getString("filters"), FILTERS),
                    r.getBoolean("isActive"),
                    instant(r, "createdAt"),
                    instant(r, "updatedAt"),
                    instant(r, "deletedAt"));

    private final ResultSetMapper<FunnelGoal> goalMapper = (index, r, ctx) ->
            new FunnelGoal(
                    r.getString("id"),
                    r.getString("funnelId"),
                    FunnelGoal.GoalType.get(r.getString("goalType")),
                    r.getString("targetValue"),
                    r.getString("description"),
                    r.getBoolean("isActive"));

    @Inject
    public JDBCFunnelDefinitionStore(@Named(METADATA_STORE) JDBCPoolDataSource dataSource) {
        this(new DBI(dataSource));
    }

    public JDBCFunnelDefinitionStore(DBI dbi) {
        this.dbi = dbi;
    }

    @Override
    public Optional<FunnelDefinition> getFunnel(String funnelId, String websiteId) {
        try (Handle handle = dbi.open()) {
            return Optional.ofNullable(handle.createQuery("SELECT " + FUNNEL_COLUMNS + " FROM funnel_definitions " +
                    "WHERE id = :id AND \"websiteId\" = :websiteId AND \"deletedAt\" IS NULL LIMIT 1")
                    .bind("id", funnelId)
                    .bind("websiteId", websiteId)
                    .map(funnelMapper).first());
        }
    }

    @Override
    public List<FunnelGoal> getGoals(String funnelId) {
        try (Handle handle = dbi.open()) {
            return ImmutableList.copyOf(handle.createQuery("SELECT id, \"funnelId\", \"goalType\", \"targetValue\", description, \"isActive\" " +
                    "FROM funnel_goals WHERE \"funnelId\" = :funnelId AND \"isActive\" = true ORDER BY \"createdAt\"")
                    .bind("funnelId", funnelId)
                    .map(goalMapper).list());
        }
    }

    @Override
    public List<FunnelDefinition> listFunnels(String websiteId) {
        try (Handle handle = dbi.open()) {
            return ImmutableList.copyOf(handle.createQuery("SELECT " + FUNNEL_COLUMNS + " FROM funnel_definitions " +
                    "WHERE \"websiteId\" = :websiteId AND \"deletedAt\" IS NULL AND jsonb_array_length(steps) > 1 " +
                    "ORDER BY \"createdAt\" DESC")
                    .bind("websiteId", websiteId)
                    .map(funnelMapper).list());
        }
    }

    static <T> List<T> readJson(String funnelId, String json, TypeReference<List<T>> type) {
        if (json == null) {
            return ImmutableList.of();
        }

        List<T> value;
        try {
            value = JsonHelper.read(json, type);
        } catch (FunnelBuddyException e) {
            throw new FunnelBuddyException(format("Funnel %s has a corrupt stored definition", funnelId),
                    INTERNAL_SERVER_ERROR, e);
        }
        return value == null ? ImmutableList.of() : value;
    }

    private static Instant instant(ResultSet r, String column)
            throws SQLException {
        Timestamp timestamp = r.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }
}
