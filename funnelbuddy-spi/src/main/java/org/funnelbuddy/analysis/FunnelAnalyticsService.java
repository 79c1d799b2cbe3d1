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
import io.airlift.log.Logger;
import org.funnelbuddy.analysis.funnel.FunnelAnalyticsResult;
import org.funnelbuddy.analysis.funnel.FunnelAutocompleteData;
import org.funnelbuddy.analysis.funnel.FunnelDefinition;
import org.funnelbuddy.analysis.funnel.FunnelDetails;
import org.funnelbuddy.analysis.funnel.FunnelStep;
import org.funnelbuddy.analysis.funnel.FunnelStepEvent;
import org.funnelbuddy.analysis.funnel.ReferrerFunnelAnalytics;
import org.funnelbuddy.analysis.funnel.SessionStepTrace;
import org.funnelbuddy.config.FunnelConfig;
import org.funnelbuddy.report.CompiledQuery;
import org.funnelbuddy.report.EventQueryExecutor;
import org.funnelbuddy.report.QueryError;
import org.funnelbuddy.report.QueryResult;
import org.funnelbuddy.util.LogUtil;
import org.funnelbuddy.util.NotExistsException;
import org.funnelbuddy.util.QueryFailedException;

import javax.inject.Inject;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static org.funnelbuddy.analysis.funnel.ReferrerFunnelAnalytics.DIRECT;
import static org.funnelbuddy.util.TimeUtil.toInstant;
import static org.funnelbuddy.util.ValidationUtil.checkArgument;
import static org.funnelbuddy.util.ValidationUtil.checkWebsiteId;

/**
 * Entry point of funnel analysis. A computation resolves the funnel definition, runs the compiled
 * step query against the event store and, once the complete result set is available, rebuilds the
 * session traces, matches them against the funnel and aggregates the step metrics.
 */
public class FunnelAnalyticsService {
    private final static Logger LOGGER = Logger.get(FunnelAnalyticsService.class);

    static final String ANALYTICS_FAILED = "Failed to compute funnel analytics";
    static final String REFERRER_ANALYTICS_FAILED = "Failed to compute funnel analytics by referrer";
    static final String AUTOCOMPLETE_FAILED = "Failed to fetch autocomplete data";

    private final FunnelDefinitionStore store;
    private final FunnelQueryCompiler compiler;
    private final EventQueryExecutor executor;
    private final FunnelConfig config;
    private final Clock clock;
    private final SessionReconstructor reconstructor = new SessionReconstructor();
    private final FunnelMetricsAggregator aggregator = new FunnelMetricsAggregator();

    @Inject
    public FunnelAnalyticsService(FunnelDefinitionStore store, FunnelQueryCompiler compiler, EventQueryExecutor executor,
                                  FunnelConfig config, Clock clock) {
        this.store = store;
        this.compiler = compiler;
        this.executor = executor;
        this.config = config;
        this.clock = clock;
    }

    public CompletableFuture<FunnelAnalyticsResult> computeFunnelAnalytics(String funnelId, String websiteId,
                                                                           Optional<LocalDate> startDate,
                                                                           Optional<LocalDate> endDate) {
        DateRange range = resolveRange(startDate, endDate, config.getDefaultRangeDays());
        FunnelDefinition funnel = resolveFunnel(funnelId, websiteId);

        CompiledQuery query = compiler.compileFunnelQuery(websiteId, funnel, range.start, range.end, false);
        return execute(query, ANALYTICS_FAILED).thenApply(result -> {
            List<SessionStepTrace> traces = reconstructor.reconstruct(toStepEvents(funnel.steps, result, false));
            return analyze(funnel.steps, traces);
        });
    }

    /**
     * Splits the sessions by the referrer they arrived with on the first step and computes the
     * funnel separately for every referrer. Groups are ordered by the number of sessions that
     * entered the funnel.
     */
    public CompletableFuture<List<ReferrerFunnelAnalytics>> computeFunnelAnalyticsByReferrer(String funnelId, String websiteId,
                                                                                             Optional<LocalDate> startDate,
                                                                                             Optional<LocalDate> endDate) {
        DateRange range = resolveRange(startDate, endDate, config.getDefaultRangeDays());
        FunnelDefinition funnel = resolveFunnel(funnelId, websiteId);

        CompiledQuery query = compiler.compileFunnelQuery(websiteId, funnel, range.start, range.end, true);
        return execute(query, REFERRER_ANALYTICS_FAILED).thenApply(result -> {
            List<SessionStepTrace> traces = reconstructor.reconstruct(toStepEvents(funnel.steps, result, true));

            Map<String, List<SessionStepTrace>> groups = new TreeMap<>();
            for (SessionStepTrace trace : traces) {
                trace.getStep(1).ifPresent(entry ->
                        groups.computeIfAbsent(referrerOf(entry), k -> new ArrayList<>()).add(trace));
            }

            return groups.entrySet().stream()
                    .map(group -> new ReferrerFunnelAnalytics(group.getKey(), referrerDomain(group.getKey()),
                            analyze(funnel.steps, group.getValue())))
                    .sorted(Comparator.comparingLong((ReferrerFunnelAnalytics r) -> r.analytics.totalUsersEntered)
                            .reversed()
                            .thenComparing(r -> r.referrer))
                    .collect(toImmutableList());
        });
    }

    public FunnelDetails getFunnel(String funnelId, String websiteId) {
        FunnelDefinition funnel = resolveFunnel(funnelId, websiteId);
        return new FunnelDetails(funnel, store.getGoals(funnel.id));
    }

    public List<FunnelDefinition> listFunnels(String websiteId) {
        checkWebsiteId(websiteId);
        return store.listFunnels(websiteId);
    }

    public CompletableFuture<FunnelAutocompleteData> getAutocompleteData(String websiteId,
                                                                         Optional<LocalDate> startDate,
                                                                         Optional<LocalDate> endDate) {
        checkWebsiteId(websiteId);
        DateRange range = resolveRange(startDate, endDate, config.getAutocompleteRangeDays());

        CompiledQuery query = compiler.compileAutocompleteQuery(websiteId, range.start, range.end);
        return execute(query, AUTOCOMPLETE_FAILED).thenApply(FunnelAnalyticsService::toAutocompleteData);
    }

    private FunnelAnalyticsResult analyze(List<FunnelStep> steps, List<SessionStepTrace> traces) {
        SequentialFunnelMatcher matcher = new SequentialFunnelMatcher(steps.size());
        return aggregator.aggregate(steps, matcher.matchAll(traces));
    }

    private FunnelDefinition resolveFunnel(String funnelId, String websiteId) {
        checkWebsiteId(websiteId);
        checkArgument(funnelId != null && !funnelId.trim().isEmpty(), "funnelId is required");

        FunnelDefinition funnel = store.getFunnel(funnelId, websiteId)
                .filter(f -> !f.isDeleted() && f.websiteId.equals(websiteId))
                .orElseThrow(() -> new NotExistsException("Funnel"));
        checkArgument(!funnel.steps.isEmpty(), "Funnel has no steps");
        return funnel;
    }

    private DateRange resolveRange(Optional<LocalDate> startDate, Optional<LocalDate> endDate, int defaultDays) {
        LocalDate end = endDate.orElseGet(() -> LocalDate.now(clock));
        LocalDate start = startDate.orElseGet(() -> end.minusDays(defaultDays));
        checkArgument(!start.isAfter(end), "startDate must not be after endDate");
        return new DateRange(start, end);
    }

    private CompletableFuture<QueryResult> execute(CompiledQuery query, String failureMessage) {
        LOGGER.debug("Executing event store query: %s with %d parameters", query.getSql(), query.getParameters().size());

        return executor.executeQuery(query).getResult().handle((result, ex) -> {
            if (ex != null) {
                LogUtil.logQueryError(query.getSql(), ex, FunnelAnalyticsService.class);
                throw new QueryFailedException(failureMessage, QueryError.create(ex.getMessage()));
            }
            if (result.isFailed()) {
                LogUtil.logQueryError(query.getSql(), result.getError(), FunnelAnalyticsService.class);
                throw new QueryFailedException(failureMessage, result.getError());
            }
            return result;
        });
    }

    private static List<FunnelStepEvent> toStepEvents(List<FunnelStep> steps, QueryResult result, boolean withReferrer) {
        ImmutableList.Builder<FunnelStepEvent> events = ImmutableList.builder();
        for (List<Object> row : result.getResult()) {
            Object step = row.get(0);
            Object session = row.get(1);
            Object time = row.get(2);
            if (step == null || session == null || time == null) {
                continue;
            }

            int stepNumber = ((Number) step).intValue();
            if (stepNumber < 1 || stepNumber > steps.size()) {
                LOGGER.warn("Ignoring row for unknown step %d", stepNumber);
                continue;
            }

            Object referrer = withReferrer && row.size() > 3 ? row.get(3) : null;
            events.add(new FunnelStepEvent(stepNumber, steps.get(stepNumber - 1).getName(), session.toString(),
                    toInstant(time), referrer == null ? null : referrer.toString()));
        }
        return events.build();
    }

    private static String referrerOf(FunnelStepEvent entry) {
        return entry.getReferrer()
                .map(String::trim)
                .filter(referrer -> !referrer.isEmpty())
                .orElse(DIRECT);
    }

    static String referrerDomain(String referrer) {
        if (DIRECT.equals(referrer)) {
            return DIRECT;
        }

        String uri = referrer.contains("://") ? referrer : "http://" + referrer;
        String host;
        try {
            host = new URI(uri).getHost();
        } catch (URISyntaxException e) {
            return referrer;
        }

        if (host == null) {
            return referrer;
        }
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    static String normalizePagePath(String path) {
        if (path.startsWith("http")) {
            int pathStart = path.indexOf('/', 8);
            return pathStart < 0 ? "" : path.substring(pathStart);
        }
        return path;
    }

    private static FunnelAutocompleteData toAutocompleteData(QueryResult result) {
        Map<String, Set<String>> categories = new LinkedHashMap<>();
        for (List<Object> row : result.getResult()) {
            if (row.get(0) == null || row.get(1) == null) {
                continue;
            }

            String category = row.get(0).toString();
            String value = row.get(1).toString();
            if (category.equals("pagePaths")) {
                value = normalizePagePath(value);
                if (value.isEmpty() || value.equals("/")) {
                    continue;
                }
            }
            categories.computeIfAbsent(category, k -> new LinkedHashSet<>()).add(value);
        }

        return new FunnelAutocompleteData(
                values(categories, "customEvents"),
                values(categories, "pagePaths"),
                values(categories, "browsers"),
                values(categories, "operatingSystems"),
                values(categories, "countries"),
                values(categories, "deviceTypes"),
                values(categories, "utmSources"),
                values(categories, "utmMediums"),
                values(categories, "utmCampaigns"));
    }

    private static List<String> values(Map<String, Set<String>> categories, String category) {
        return ImmutableList.copyOf(categories.getOrDefault(category, new LinkedHashSet<>()));
    }

    private static class DateRange {
        final LocalDate start;
        final LocalDate end;

        DateRange(LocalDate start, LocalDate end) {
            this.start = start;
            this.end = end;
        }
    }
}
