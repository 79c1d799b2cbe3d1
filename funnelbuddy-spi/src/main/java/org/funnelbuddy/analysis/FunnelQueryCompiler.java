package org.funnelbuddy.analysis;

import org.funnelbuddy.analysis.funnel.FunnelDefinition;
import org.funnelbuddy.report.CompiledQuery;

import java.time.LocalDate;

/**
 * Translates funnel definitions into statements for the event store. Every user supplied value in
 * the returned query is a positional parameter.
 */
public interface FunnelQueryCompiler {
    String STEP_NUMBER = "step_number";
    String SESSION_ID = "session_id";
    String FIRST_OCCURRENCE = "first_occurrence";
    String REFERRER = "referrer";

    String CATEGORY = "category";
    String VALUE = "value";

    /**
     * Builds a single statement returning one row per (step, session) pair with the earliest
     * matching timestamp. Rows are ordered by session and first occurrence.
     *
     * @param withReferrer also select the referrer of the earliest matching row
     */
    CompiledQuery compileFunnelQuery(String websiteId, FunnelDefinition funnel, LocalDate startDate, LocalDate endDate, boolean withReferrer);

    CompiledQuery compileAutocompleteQuery(String websiteId, LocalDate startDate, LocalDate endDate);
}
