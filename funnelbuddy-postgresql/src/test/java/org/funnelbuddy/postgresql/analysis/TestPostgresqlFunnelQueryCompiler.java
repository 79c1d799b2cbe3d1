package org.funnelbuddy.postgresql.analysis;

import com.google.common.collect.ImmutableMap;
import org.funnelbuddy.analysis.funnel.FunnelDefinition;
import org.funnelbuddy.analysis.funnel.FunnelFilter;
import org.funnelbuddy.analysis.funnel.FunnelStep;
import org.funnelbuddy.config.EventStoreConfig;
import org.funnelbuddy.report.CompiledQuery;
import org.testng.annotations.Test;

import java.time.LocalDate;
import java.util.List;

import static com.google.common.collect.ImmutableList.of;
import static org.funnelbuddy.analysis.funnel.FunnelFilter.FilterOperator.CONTAINS;
import static org.funnelbuddy.analysis.funnel.FunnelFilter.FilterOperator.IN;
import static org.funnelbuddy.analysis.funnel.FunnelFilter.FilterOperator.NOT_IN;
import static org.funnelbuddy.analysis.funnel.FunnelStep.StepType.CUSTOM;
import static org.funnelbuddy.analysis.funnel.FunnelStep.StepType.EVENT;
import static org.funnelbuddy.analysis.funnel.FunnelStep.StepType.PAGE_VIEW;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestPostgresqlFunnelQueryCompiler {
    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 31);

    private final PostgresqlFunnelQueryCompiler compiler = new PostgresqlFunnelQueryCompiler(new EventStoreConfig());

    private CompiledQuery compile(List<FunnelStep> steps, List<FunnelFilter> filters) {
        return compiler.compileFunnelQuery("w1", new FunnelDefinition("f1", "w1", "Funnel", steps, filters), START, END, false);
    }

    private static void assertPlaceholders(CompiledQuery query) {
        long placeholders = query.getSql().chars().filter(c -> c == '?').count();
        assertEquals(placeholders, query.getParameters().size());
    }

    @Test
    public void testTwoStepFunnel() {
        CompiledQuery query = compile(of(
                new FunnelStep(PAGE_VIEW, "/pricing", "Pricing"),
                new FunnelStep(EVENT, "signup", "Signup")), of());

        String scope = "FROM \"analytics\".\"events\" WHERE \"client_id\" = ? AND \"time\" >= ? AND \"time\" < ? " +
                "AND \"session_id\" IS NOT NULL";
        assertEquals(query.getSql(), "SELECT step_number, session_id, first_occurrence FROM (" +
                "SELECT 1 AS step_number, \"session_id\" AS session_id, min(\"time\") AS first_occurrence " + scope +
                " AND (\"event_name\" = ? AND (\"path\" = ? OR strpos(\"path\", ?) > 0)) GROUP BY \"session_id\"" +
                " UNION ALL " +
                "SELECT 2 AS step_number, \"session_id\" AS session_id, min(\"time\") AS first_occurrence " + scope +
                " AND (\"event_name\" = ?) GROUP BY \"session_id\"" +
                ") funnel_steps ORDER BY session_id, first_occurrence, step_number");

        assertEquals(query.getParameters(), of(
                "w1", START.atStartOfDay(), END.plusDays(1).atStartOfDay(), "screen_view", "/pricing", "/pricing",
                "w1", START.atStartOfDay(), END.plusDays(1).atStartOfDay(), "signup"));
    }

    @Test
    public void testValuesAreNeverInlined() {
        String injection = "x'); DROP TABLE funnel_definitions; --";
        CompiledQuery query = compile(of(
                new FunnelStep(PAGE_VIEW, "/100%_off", "Promo"),
                new FunnelStep(EVENT, injection, "Signup")),
                of(new FunnelFilter("country", CONTAINS, injection)));

        assertFalse(query.getSql().contains("DROP"));
        assertFalse(query.getSql().contains("100%"));
        assertTrue(query.getParameters().contains(injection));
        assertTrue(query.getParameters().contains("/100%_off"));
        assertPlaceholders(query);
    }

    @Test
    public void testFilters() {
        CompiledQuery query = compile(of(
                new FunnelStep(EVENT, "signup", "Signup"),
                new FunnelStep(EVENT, "purchase", "Purchase")),
                of(new FunnelFilter("country", IN, "US", "DE"),
                        new FunnelFilter("browser_name", "not_equals", "Safari"),
                        new FunnelFilter("utm_source", CONTAINS, "news")));

        assertTrue(query.getSql().contains("\"country\" IN (?, ?)"));
        assertTrue(query.getSql().contains("\"browser_name\" <> ?"));
        assertTrue(query.getSql().contains("strpos(\"utm_source\", ?) > 0"));
        assertEquals(query.getParameters().subList(3, 8), of("signup", "US", "DE", "Safari", "news"));
        assertPlaceholders(query);
    }

    @Test
    public void testUnsupportedFiltersAreDropped() {
        CompiledQuery query = compile(of(
                new FunnelStep(EVENT, "signup", "Signup"),
                new FunnelStep(EVENT, "purchase", "Purchase")),
                of(new FunnelFilter("country", "regex", "U.*"),
                        new FunnelFilter("password", "equals", "secret")));

        assertFalse(query.getSql().contains("country"));
        assertFalse(query.getSql().contains("password"));
        assertFalse(query.getParameters().contains("secret"));
        assertPlaceholders(query);
    }

    @Test
    public void testEmptyInLists() {
        CompiledQuery emptyIn = compile(of(
                new FunnelStep(EVENT, "signup", "Signup"),
                new FunnelStep(EVENT, "purchase", "Purchase")),
                of(new FunnelFilter("country", IN.value(), of())));
        assertTrue(emptyIn.getSql().contains("AND 1 = 0"));

        CompiledQuery emptyNotIn = compile(of(
                new FunnelStep(EVENT, "signup", "Signup"),
                new FunnelStep(EVENT, "purchase", "Purchase")),
                of(new FunnelFilter("country", NOT_IN.value(), of())));
        assertFalse(emptyNotIn.getSql().contains("country"));
        assertPlaceholders(emptyNotIn);
    }

    @Test
    public void testCustomStep() {
        CompiledQuery query = compile(of(
                new FunnelStep(EVENT, "signup", "Signup"),
                new FunnelStep(CUSTOM, "purchase", "Newsletter purchase",
                        ImmutableMap.of("utm_source", "newsletter", "plan", "pro"))), of());

        assertTrue(query.getSql().contains("AND (\"event_name\" = ? AND \"utm_source\" = ?)"));
        assertFalse(query.getSql().contains("plan"));
        assertEquals(query.getParameters().get(query.getParameters().size() - 1), "newsletter");
        assertPlaceholders(query);
    }

    @Test
    public void testUnusableCustomStepMatchesNothing() {
        CompiledQuery query = compile(of(
                new FunnelStep(EVENT, "signup", "Signup"),
                new FunnelStep(CUSTOM, "", "Plan", ImmutableMap.of("plan", "pro"))), of());

        assertTrue(query.getSql().contains("AND (1 = 0)"));
        assertPlaceholders(query);
    }

    @Test
    public void testReferrerColumn() {
        CompiledQuery query = compiler.compileFunnelQuery("w1", new FunnelDefinition("f1", "w1", "Funnel", of(
                new FunnelStep(EVENT, "signup", "Signup"),
                new FunnelStep(EVENT, "purchase", "Purchase")), of()), START, END, true);

        assertTrue(query.getSql().startsWith("SELECT step_number, session_id, first_occurrence, referrer FROM"));
        assertTrue(query.getSql().contains("(array_agg(\"referrer\" ORDER BY \"time\"))[1] AS referrer"));
    }

    @Test
    public void testCustomEventTable() {
        EventStoreConfig config = new EventStoreConfig()
                .setTable("public.tracked_events")
                .setWebsiteColumn("site_id");
        CompiledQuery query = new PostgresqlFunnelQueryCompiler(config).compileFunnelQuery("w1",
                new FunnelDefinition("f1", "w1", "Funnel", of(
                        new FunnelStep(EVENT, "signup", "Signup"),
                        new FunnelStep(EVENT, "purchase", "Purchase")), of()), START, END, false);

        assertTrue(query.getSql().contains("FROM \"public\".\"tracked_events\" WHERE \"site_id\" = ?"));
    }

    @Test
    public void testAutocompleteQuery() {
        CompiledQuery query = compiler.compileAutocompleteQuery("w1", START, END);

        assertTrue(query.getSql().contains("'customEvents' AS category"));
        assertTrue(query.getSql().contains("\"event_name\" NOT IN (?, ?, ?, ?, ?)"));
        assertTrue(query.getSql().contains("'utmCampaigns' AS category, \"utm_campaign\" AS value"));
        assertTrue(query.getSql().endsWith("ORDER BY category, value"));
        assertTrue(query.getParameters().containsAll(of("screen_view", "page_exit", "error", "web_vitals", "link_out", "Unknown")));
        assertPlaceholders(query);
    }
}
