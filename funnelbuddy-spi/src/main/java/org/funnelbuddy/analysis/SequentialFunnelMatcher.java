package org.funnelbuddy.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.funnelbuddy.analysis.funnel.FunnelProgress;
import org.funnelbuddy.analysis.funnel.FunnelStepEvent;
import org.funnelbuddy.analysis.funnel.SessionProgress;
import org.funnelbuddy.analysis.funnel.SessionStepTrace;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.funnelbuddy.util.ValidationUtil.checkArgument;

/**
 * Walks a session trace with a single cursor over the funnel steps. An event only counts when it
 * is the step the cursor expects; everything else in the trace is skipped and the cursor never
 * moves backwards.
 */
public class SequentialFunnelMatcher {
    private final int stepCount;

    public SequentialFunnelMatcher(int stepCount) {
        checkArgument(stepCount > 0, "Funnel must have at least one step");
        this.stepCount = stepCount;
    }

    public SessionProgress match(SessionStepTrace trace) {
        List<Instant> completions = new ArrayList<>();
        int expectedStep = 1;

        for (FunnelStepEvent event : trace.events) {
            if (expectedStep > stepCount) {
                break;
            }
            if (event.stepNumber == expectedStep) {
                completions.add(event.firstOccurrence);
                expectedStep++;
            }
        }

        return new SessionProgress(trace.sessionId, completions);
    }

    public FunnelProgress matchAll(List<SessionStepTrace> traces) {
        List<SessionProgress> sessions = traces.stream()
                .map(this::match)
                .collect(ImmutableList.toImmutableList());

        List<ImmutableSet.Builder<String>> builders = new ArrayList<>(stepCount);
        for (int i = 0; i < stepCount; i++) {
            builders.add(ImmutableSet.builder());
        }

        for (SessionProgress session : sessions) {
            for (int step = 1; step <= session.getCompletedSteps(); step++) {
                builders.get(step - 1).add(session.sessionId);
            }
        }

        return new FunnelProgress(builders.stream()
                .map(ImmutableSet.Builder::build)
                .collect(ImmutableList.toImmutableList()), sessions);
    }

    public int getStepCount() {
        return stepCount;
    }
}
