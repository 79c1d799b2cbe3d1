package org.funnelbuddy.postgresql.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.funnelbuddy.analysis.FunnelAnalyticsService;
import org.funnelbuddy.analysis.JDBCPoolDataSource;
import org.funnelbuddy.analysis.funnel.FunnelAnalyticsResult;
import org.funnelbuddy.analysis.funnel.FunnelAutocompleteData;
import org.funnelbuddy.analysis.funnel.FunnelDetails;
import org.funnelbuddy.analysis.funnel.FunnelFilter;
import org.funnelbuddy.analysis.funnel.FunnelStep;
import org.funnelbuddy.analysis.funnel.ReferrerFunnelAnalytics;
import org.funnelbuddy.config.EventStoreConfig;
import org.funnelbuddy.config.FunnelConfig;
import org.funnelbuddy.postgresql.TestingEnvironment;
import org.funnelbuddy.postgresql.report.PostgresqlEventQueryExecutor;
import org.funnelbuddy.util.FunnelBuddyException;
import org.funnelbuddy.util.NotExistsException;
import org.funnelbuddy.util.QueryFailedException;
import org.skife.jdbi.v2.DBI;
import org.skife.jdbi.v2.Handle;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static java.time.ZoneOffset.UTC;
import static org.funnelbuddy.analysis.funnel.FunnelFilter.FilterOperator.EQUALS;
import static org.funnelbuddy.analysis.funnel.FunnelStep.StepType.EVENT;
import static org.funnelbuddy.analysis.funnel.FunnelStep.StepType.PAGE_VIEW;
import static org.funnelbuddy.postgresql.PostgresqlModule.INIT_QUERY;
import static org.funnelbuddy.util.JsonHelper.encode;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class TestPostgresqlFunnelAnalyticsService {
    private static final String WEBSITE = "website-1";
    private static final Instant NOW = Instant.parse("2024-03-05T12:00:00Z");
    private static final Optional<LocalDate> START = Optional.of(LocalDate.parse("2024-02-01"));
    private static final Optional<LocalDate> END = Optional.of(LocalDate.parse("2024-02-29"));

    private static final List<FunnelStep> PRICING_STEPS = ImmutableList.of(
            new FunnelStep(PAGE_VIEW, "/pricing", "Pricing"),
            new FunnelStep(EVENT, "signup_clicked", "Signup clicked"),
            new FunnelStep(EVENT, "signup_completed", "Signup completed"));

    private JDBCPoolDataSource dataSource;
    private FunnelAnalyticsService service;

    @BeforeClass
    public void setup() {
        TestingEnvironment testingEnvironment = new TestingEnvironment();
        dataSource = JDBCPoolDataSource.getOrCreateDataSource(testingEnvironment.getPostgresqlConfig(), INIT_QUERY);

        try (Handle handle = new DBI(dataSource).open()) {
            createTables(handle);

            event(handle, WEBSITE, "A", "screen_view", "/pricing", "https://www.google.com/search", "Chrome", "2024-02-20 08:00:00");
            event(handle, WEBSITE, "A", "signup_clicked", "/pricing", null, "Chrome", "2024-02-20 08:00:10");
            event(handle, WEBSITE, "A", "signup_completed", "/welcome", null, "Chrome", "2024-02-20 08:00:20");
            event(handle, WEBSITE, "A", "screen_view", "/pricing", "https://twitter.com", "Chrome", "2024-02-20 08:00:30");
            event(handle, WEBSITE, "B", "screen_view", "https://example.com/pricing?plan=pro", "", "Firefox", "2024-02-21 09:00:00");
            event(handle, WEBSITE, "B", "signup_completed", "/welcome", null, "Firefox", "2024-02-21 09:01:00");
            // C enters 100ms before the range ends
            event(handle, WEBSITE, "C", "screen_view", "/pricing", null, "Chrome", "2024-02-29 23:59:59.9");
            event(handle, WEBSITE, "C", "signup_clicked", "/pricing", null, "Chrome", "2024-03-01 00:00:00");
            event(handle, WEBSITE, "D", "screen_view", "/pricing", null, "Chrome", "2024-03-01 00:00:00");
            event(handle, WEBSITE, "P1", "screen_view", "/landing/50%_off", null, null, "2024-02-10 10:00:00");
            event(handle, WEBSITE, "P2", "screen_view", "/landing/50xxoff", null, null, "2024-02-10 10:00:00");
            event(handle, WEBSITE, "U", "newsletter_signup", "/", null, "Unknown", "2024-02-11 10:00:00");
            event(handle, "website-2", "E", "screen_view", "/pricing", null, "Safari", "2024-02-20 08:00:00");

            funnel(handle, "pricing", WEBSITE, PRICING_STEPS, ImmutableList.of(), "2024-01-01 00:00:00", null);
            funnel(handle, "pricing_chrome", WEBSITE, PRICING_STEPS,
                    ImmutableList.of(new FunnelFilter("browser_name", EQUALS, "Chrome")), "2024-01-02 00:00:00", null);
            funnel(handle, "promo", WEBSITE, ImmutableList.of(
                    new FunnelStep(PAGE_VIEW, "/50%_off", "Promo"),
                    new FunnelStep(EVENT, "signup_clicked", "Signup clicked")), ImmutableList.of(), "2024-01-03 00:00:00", null);
            funnel(handle, "single", WEBSITE, PRICING_STEPS.subList(0, 1), ImmutableList.of(), "2024-01-04 00:00:00", null);
            funnel(handle, "old", WEBSITE, PRICING_STEPS, ImmutableList.of(), "2024-01-05 00:00:00", "2024-02-01 00:00:00");
            handle.execute("INSERT INTO funnel_definitions (id, \"websiteId\", name, steps, filters, \"isActive\", \"createdAt\") " +
                    "VALUES ('broken', 'website-broken', 'Broken', CAST('[{\"type\": \"TELEPORT\"}]' AS jsonb), CAST('[]' AS jsonb), true, now())");

            goal(handle, "g1", "pricing", "completion", "25", true, "2024-01-01 00:00:00");
            goal(handle, "g2", "pricing", "step_conversion", "50", false, "2024-01-02 00:00:00");
        }

        service = service(new EventStoreConfig());
    }

    private FunnelAnalyticsService service(EventStoreConfig eventStoreConfig) {
        return new FunnelAnalyticsService(
                new JDBCFunnelDefinitionStore(dataSource),
                new PostgresqlFunnelQueryCompiler(eventStoreConfig),
                new PostgresqlEventQueryExecutor(dataSource),
                new FunnelConfig(),
                Clock.fixed(NOW, UTC));
    }

    private static void createTables(Handle handle) {
        handle.execute("DROP SCHEMA IF EXISTS analytics CASCADE");
        handle.execute("DROP TABLE IF EXISTS funnel_definitions, funnel_goals");
        handle.execute("CREATE SCHEMA analytics");
        handle.execute("CREATE TABLE analytics.events (client_id text, session_id text, time timestamptz, event_name text, " +
                "path text, referrer text, browser_name text, os_name text, country text, region text, city text, " +
                "device_type text, language text, utm_source text, utm_medium text, utm_campaign text, " +
                "utm_term text, utm_content text)");
        handle.execute("CREATE TABLE funnel_definitions (id text PRIMARY KEY, \"websiteId\" text NOT NULL, name text NOT NULL, " +
                "description text, steps jsonb NOT NULL, filters jsonb, \"isActive\" boolean NOT NULL, " +
                "\"createdAt\" timestamptz NOT NULL, \"updatedAt\" timestamptz, \"deletedAt\" timestamptz)");
        handle.execute("CREATE TABLE funnel_goals (id text PRIMARY KEY, \"funnelId\" text NOT NULL, \"goalType\" text NOT NULL, " +
                "\"targetValue\" text, description text, \"isActive\" boolean NOT NULL, \"createdAt\" timestamptz NOT NULL)");
    }

    private static void event(Handle handle, String website, String session, String eventName, String path,
                              String referrer, String browser, String time) {
        handle.execute("INSERT INTO analytics.events (client_id, session_id, event_name, path, referrer, browser_name, time) " +
                        "VALUES (?, ?, ?, ?, ?, ?, CAST(? AS timestamptz))",
                website, session, eventName, path, referrer, browser, time + "+00");
    }

    private static void funnel(Handle handle, String id, String website, List<FunnelStep> steps, List<FunnelFilter> filters,
                               String createdAt, String deletedAt) {
        handle.execute("INSERT INTO funnel_definitions (id, \"websiteId\", name, steps, filters, \"isActive\", \"createdAt\", \"deletedAt\") " +
                        "VALUES (?, ?, ?, CAST(? AS jsonb), CAST(? AS jsonb), true, CAST(? AS timestamptz), CAST(? AS timestamptz))",
                id, website, "Funnel " + id, encode(steps), encode(filters), createdAt + "+00",
                deletedAt == null ? null : deletedAt + "+00");
    }

    private static void goal(Handle handle, String id, String funnelId, String type, String target, boolean active, String createdAt) {
        handle.execute("INSERT INTO funnel_goals (id, \"funnelId\", \"goalType\", \"targetValue\", \"isActive\", \"createdAt\") " +
                        "VALUES (?, ?, ?, ?, ?, CAST(? AS timestamptz))",
                id, funnelId, type, target, active, createdAt + "+00");
    }

    @Test
    public void testFunnelMetrics() {
        FunnelAnalyticsResult result = service.computeFunnelAnalytics("pricing", WEBSITE, START, END).join();

        assertEquals(result.totalUsersEntered, 3);
        assertEquals(result.stepsAnalytics.get(0).users, 3);
        assertEquals(result.stepsAnalytics.get(1).users, 1);
        assertEquals(result.stepsAnalytics.get(1).conversionRate, 33.33);
        assertEquals(result.stepsAnalytics.get(1).dropoffs, 2);
        assertEquals(result.stepsAnalytics.get(1).avgTimeToComplete, 10.0);
        assertEquals(result.stepsAnalytics.get(2).users, 1);
        assertEquals(result.stepsAnalytics.get(2).conversionRate, 100.0);
        assertEquals(result.totalUsersCompleted, 1);
        assertEquals(result.overallConversionRate, 100.0);
        assertEquals(result.biggestDropoffStep, 2);
        assertEquals(result.avgCompletionTime, 20.0);
        assertEquals(result.avgCompletionTimeFormatted, "20s");
    }

    @Test
    public void testStoredFilterIsApplied() {
        FunnelAnalyticsResult result = service.computeFunnelAnalytics("pricing_chrome", WEBSITE, START, END).join();

        assertEquals(result.totalUsersEntered, 2);
        assertEquals(result.stepsAnalytics.get(1).users, 1);
    }

    @Test
    public void testPageTargetIsMatchedLiterally() {
        FunnelAnalyticsResult result = service.computeFunnelAnalytics("promo", WEBSITE, START, END).join();

        assertEquals(result.totalUsersEntered, 1);
    }

    @Test
    public void testReferrerOfFirstPageView() {
        List<ReferrerFunnelAnalytics> result = service.computeFunnelAnalyticsByReferrer("pricing", WEBSITE, START, END).join();

        assertEquals(result.size(), 2);
        assertEquals(result.get(0).referrer, "direct");
        assertEquals(result.get(0).analytics.totalUsersEntered, 2);
        assertEquals(result.get(0).analytics.totalUsersCompleted, 0);
        assertEquals(result.get(1).referrer, "https://www.google.com/search");
        assertEquals(result.get(1).referrerDomain, "google.com");
        assertEquals(result.get(1).analytics.totalUsersEntered, 1);
        assertEquals(result.get(1).analytics.totalUsersCompleted, 1);
    }

    @Test
    public void testFunnelDetails() {
        FunnelDetails details = service.getFunnel("pricing_chrome", WEBSITE);

        assertEquals(details.funnel.steps, PRICING_STEPS);
        assertEquals(details.funnel.filters, ImmutableList.of(new FunnelFilter("browser_name", EQUALS, "Chrome")));
        assertTrue(details.goals.isEmpty());

        List<String> goals = service.getFunnel("pricing", WEBSITE).goals.stream()
                .map(goal -> goal.id)
                .collect(ImmutableList.toImmutableList());
        assertEquals(goals, ImmutableList.of("g1"));
    }

    @Test(expectedExceptions = NotExistsException.class)
    public void testDeletedFunnel() {
        service.getFunnel("old", WEBSITE);
    }

    @Test
    public void testCorruptStoredDefinition() {
        try {
            service.getFunnel("broken", "website-broken");
            fail("a stored definition that cannot be decoded should fail the lookup");
        } catch (FunnelBuddyException e) {
            assertEquals(e.getStatusCode(), INTERNAL_SERVER_ERROR);
        }
    }

    @Test
    public void testListFunnels() {
        List<String> funnels = service.listFunnels(WEBSITE).stream()
                .map(funnel -> funnel.id)
                .collect(ImmutableList.toImmutableList());

        assertEquals(funnels, ImmutableList.of("promo", "pricing_chrome", "pricing"));
    }

    @Test
    public void testAutocomplete() {
        FunnelAutocompleteData data = service.getAutocompleteData(WEBSITE, Optional.empty(), Optional.empty()).join();

        assertEquals(ImmutableSet.copyOf(data.customEvents), ImmutableSet.of("newsletter_signup", "signup_clicked", "signup_completed"));
        assertEquals(ImmutableSet.copyOf(data.pagePaths),
                ImmutableSet.of("/pricing", "/pricing?plan=pro", "/landing/50%_off", "/landing/50xxoff"));
        assertEquals(data.browsers, ImmutableList.of("Chrome", "Firefox"));
        assertTrue(data.countries.isEmpty());
    }

    @Test
    public void testMissingEventTable() {
        FunnelAnalyticsService missingTable = service(new EventStoreConfig().setTable("analytics.missing"));

        try {
            missingTable.computeFunnelAnalytics("pricing", WEBSITE, START, END).join();
            fail("a failing event store query should fail the computation");
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof QueryFailedException, "unexpected failure: " + e.getCause());
            QueryFailedException exception = (QueryFailedException) e.getCause();
            assertEquals(exception.getStatusCode(), INTERNAL_SERVER_ERROR);
            assertEquals(exception.getError().sqlState, "42P01");
        }
    }
}
