/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.funnelbuddy.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.airlift.log.Logger;
import org.funnelbuddy.analysis.funnel.FunnelDefinition;
import org.funnelbuddy.analysis.funnel.FunnelFilter;
import org.funnelbuddy.analysis.funnel.FunnelFilter.FilterOperator;
import org.funnelbuddy.analysis.funnel.FunnelStep;
import org.funnelbuddy.config.EventStoreConfig;
import org.funnelbuddy.report.CompiledQuery;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static org.funnelbuddy.util.ValidationUtil.checkArgument;
import static org.funnelbuddy.util.ValidationUtil.checkTable;
import static org.funnelbuddy.util.ValidationUtil.checkTableColumn;
import static org.funnelbuddy.util.ValidationUtil.checkWebsiteId;
import static org.funnelbuddy.util.ValidationUtil.isAllowedColumn;

public abstract class AbstractFunnelQueryCompiler
        implements FunnelQueryCompiler {
    private final static Logger LOGGER = Logger.get(AbstractFunnelQueryCompiler.class);

    static final String MATCH_NOTHING = "1 = 0";

    public static final List<String> INTERNAL_EVENTS = ImmutableList.of("screen_view", "page_exit", "error", "web_vitals", "link_out");
    public static final String UNKNOWN_VALUE = "Unknown";
    private static final Set<String> UNKNOWN_EXCLUDED = ImmutableSet.of("browsers", "operatingSystems");
    public static final Map<String, String> AUTOCOMPLETE_COLUMNS = ImmutableMap.<String, String>builder()
            .put("browsers", "browser_name")
            .put("operatingSystems", "os_name")
            .put("countries", "country")
            .put("deviceTypes", "device_type")
            .put("utmSources", "utm_source")
            .put("utmMediums", "utm_medium")
            .put("utmCampaigns", "utm_campaign")
            .build();

    protected final EventStoreConfig config;

    public AbstractFunnelQueryCompiler(EventStoreConfig config) {
        this.config = config;
    }

    /**
     * Predicate that is true when the column contains the next bound parameter as a plain
     * substring, without wildcard interpretation.
     */
    protected abstract String containsPredicate(String column);

    /**
     * Aggregate returning the value of {@code column} on the row with the smallest {@code orderColumn}.
     */
    protected abstract String firstValueAggregate(String column, String orderColumn);

    protected char escapeIdentifier() {
        return '"';
    }

    protected String column(String name) {
        return checkTableColumn(name, escapeIdentifier());
    }

    protected String table() {
        return checkTable(config.getTable(), escapeIdentifier());
    }

    @Override
    public CompiledQuery compileFunnelQuery(String websiteId, FunnelDefinition funnel, LocalDate startDate, LocalDate endDate, boolean withReferrer) {
        checkWebsiteId(websiteId);
        checkArgument(!funnel.steps.isEmpty(), "Funnel has no steps");

        List<Object> parameters = new ArrayList<>();
        StringJoiner stepQueries = new StringJoiner(" UNION ALL ");

        for (int i = 0; i < funnel.steps.size(); i++) {
            stepQueries.add(convertStep(websiteId, i + 1, funnel.steps.get(i), funnel.filters,
                    startDate, endDate, withReferrer, parameters));
        }

        String columns = STEP_NUMBER + ", " + SESSION_ID + ", " + FIRST_OCCURRENCE + (withReferrer ? ", " + REFERRER : "");
        String sql = format("SELECT %s FROM (%s) funnel_steps ORDER BY %s, %s, %s",
                columns, stepQueries, SESSION_ID, FIRST_OCCURRENCE, STEP_NUMBER);
        return new CompiledQuery(sql, parameters);
    }

    protected String convertStep(String websiteId, int stepNumber, FunnelStep step, List<FunnelFilter> filters,
                                 LocalDate startDate, LocalDate endDate, boolean withReferrer, List<Object> parameters) {
        String session = column(config.getSessionColumn());
        String time = column(config.getTimeColumn());

        StringBuilder where = new StringBuilder(scopePredicate(websiteId, startDate, endDate, parameters));
        where.append(" AND ").append(session).append(" IS NOT NULL");
        where.append(" AND (").append(stepPredicate(stepNumber, step, parameters)).append(')');
        for (FunnelFilter filter : filters) {
            filterPredicate(filter, parameters).ifPresent(predicate -> where.append(" AND ").append(predicate));
        }

        String referrer = withReferrer
                ? ", " + firstValueAggregate(column(config.getReferrerColumn()), time) + " AS " + REFERRER
                : "";

        return format("SELECT %d AS %s, %s AS %s, min(%s) AS %s%s FROM %s WHERE %s GROUP BY %s",
                stepNumber, STEP_NUMBER, session, SESSION_ID, time, FIRST_OCCURRENCE, referrer,
                table(), where, session);
    }

    protected String scopePredicate(String websiteId, LocalDate startDate, LocalDate endDate, List<Object> parameters) {
        String time = column(config.getTimeColumn());
        parameters.add(websiteId);
        parameters.add(startDate.atStartOfDay());
        parameters.add(endDate.plusDays(1).atStartOfDay());
        return format("%s = ? AND %s >= ? AND %s < ?", column(config.getWebsiteColumn()), time, time);
    }

    protected String stepPredicate(int stepNumber, FunnelStep step, List<Object> parameters) {
        String eventName = column(config.getEventNameColumn());
        switch (step.getType()) {
            case PAGE_VIEW:
                String path = column(config.getPathColumn());
                parameters.add(config.getPageViewEventName());
                parameters.add(step.getTarget());
                parameters.add(step.getTarget());
                return format("%s = ? AND (%s = ? OR %s)", eventName, path, containsPredicate(path));
            case EVENT:
                parameters.add(step.getTarget());
                return eventName + " = ?";
            case CUSTOM:
                return customStepPredicate(stepNumber, step, parameters);
            default:
                throw new IllegalStateException("Unknown step type: " + step.getType());
        }
    }

    private String customStepPredicate(int stepNumber, FunnelStep step, List<Object> parameters) {
        List<String> predicates = new ArrayList<>();
        List<Object> stepParameters = new ArrayList<>();

        if (!step.getTarget().trim().isEmpty()) {
            predicates.add(column(config.getEventNameColumn()) + " = ?");
            stepParameters.add(step.getTarget());
        }

        for (Map.Entry<String, Object> condition : step.getConditions().entrySet()) {
            if (!isAllowedColumn(condition.getKey(), config.getFilterableColumns())) {
                LOGGER.warn("Ignoring condition on column '%s' of step %d: column is not filterable",
                        condition.getKey(), stepNumber);
                continue;
            }

            String column = column(condition.getKey());
            Object value = condition.getValue();
            if (value == null) {
                predicates.add(column + " IS NULL");
            } else if (value instanceof Collection) {
                List<String> values = ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.toList());
                predicates.add(inPredicate(column, values, false, stepParameters));
            } else {
                predicates.add(column + " = ?");
                stepParameters.add(String.valueOf(value));
            }
        }

        if (predicates.isEmpty()) {
            LOGGER.warn("Custom step %d has neither an event name nor usable conditions, it will match no events", stepNumber);
            return MATCH_NOTHING;
        }

        parameters.addAll(stepParameters);
        return String.join(" AND ", predicates);
    }

    protected Optional<String> filterPredicate(FunnelFilter filter, List<Object> parameters) {
        Optional<FilterOperator> operator = filter.getFilterOperator();
        if (!operator.isPresent()) {
            LOGGER.warn("Ignoring filter %s: unsupported operator", filter);
            return Optional.empty();
        }
        if (!isAllowedColumn(filter.getField(), config.getFilterableColumns())) {
            LOGGER.warn("Ignoring filter %s: column is not filterable", filter);
            return Optional.empty();
        }

        String column = column(filter.getField());
        switch (operator.get()) {
            case IN:
                return Optional.of(inPredicate(column, filter.getValues(), false, parameters));
            case NOT_IN:
                if (filter.getValues().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(inPredicate(column, filter.getValues(), true, parameters));
            default:
                break;
        }

        Optional<String> value = filter.getFirstValue();
        if (!value.isPresent()) {
            LOGGER.warn("Ignoring filter %s: value is missing", filter);
            return Optional.empty();
        }

        parameters.add(value.get());
        switch (operator.get()) {
            case EQUALS:
                return Optional.of(column + " = ?");
            case NOT_EQUALS:
                return Optional.of(column + " <> ?");
            case CONTAINS:
                return Optional.of(containsPredicate(column));
            default:
                throw new IllegalStateException("Unhandled operator: " + operator.get());
        }
    }

    private static String inPredicate(String column, List<String> values, boolean negate, List<Object> parameters) {
        if (values.isEmpty()) {
            return MATCH_NOTHING;
        }
        parameters.addAll(values);
        String placeholders = values.stream().map(v -> "?").collect(Collectors.joining(", "));
        return format("%s %s (%s)", column, negate ? "NOT IN" : "IN", placeholders);
    }

    @Override
    public CompiledQuery compileAutocompleteQuery(String websiteId, LocalDate startDate, LocalDate endDate) {
        checkWebsiteId(websiteId);

        List<Object> parameters = new ArrayList<>();
        StringJoiner queries = new StringJoiner(" UNION ALL ");
        String eventName = column(config.getEventNameColumn());
        String path = column(config.getPathColumn());

        String scope = scopePredicate(websiteId, startDate, endDate, parameters);
        String exclusions = INTERNAL_EVENTS.stream().map(e -> "?").collect(Collectors.joining(", "));
        parameters.addAll(INTERNAL_EVENTS);
        queries.add(format("SELECT DISTINCT 'customEvents' AS %s, %s AS %s FROM %s WHERE %s AND %s NOT IN (%s) AND %s <> ''",
                CATEGORY, eventName, VALUE, table(), scope, eventName, exclusions, eventName));

        scope = scopePredicate(websiteId, startDate, endDate, parameters);
        parameters.add(config.getPageViewEventName());
        queries.add(format("SELECT DISTINCT 'pagePaths' AS %s, %s AS %s FROM %s WHERE %s AND %s = ? AND %s <> ''",
                CATEGORY, path, VALUE, table(), scope, eventName, path));

        for (Map.Entry<String, String> entry : AUTOCOMPLETE_COLUMNS.entrySet()) {
            if (!isAllowedColumn(entry.getValue(), config.getFilterableColumns())) {
                continue;
            }

            String column = column(entry.getValue());
            scope = scopePredicate(websiteId, startDate, endDate, parameters);
            String unknown = "";
            if (UNKNOWN_EXCLUDED.contains(entry.getKey())) {
                parameters.add(UNKNOWN_VALUE);
                unknown = " AND " + column + " <> ?";
            }
            queries.add(format("SELECT DISTINCT '%s' AS %s, %s AS %s FROM %s WHERE %s AND %s IS NOT NULL AND %s <> ''%s",
                    entry.getKey(), CATEGORY, column, VALUE, table(), scope, column, column, unknown));
        }

        return new CompiledQuery(format("%s ORDER BY %s, %s", queries, CATEGORY, VALUE), parameters);
    }
}
