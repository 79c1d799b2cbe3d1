package org.funnelbuddy.analysis.funnel;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

public class SessionStepTrace {
    public final String sessionId;
    public final List<FunnelStepEvent> events;

    public SessionStepTrace(String sessionId, List<FunnelStepEvent> events) {
        this.sessionId = sessionId;
        this.events = ImmutableList.copyOf(events);
    }

    public Optional<FunnelStepEvent> getStep(int stepNumber) {
        return events.stream().filter(e -> e.stepNumber == stepNumber).findFirst();
    }

    @Override
    public String toString() {
        return "SessionStepTrace{" + sessionId + ", " + events + '}';
    }
}
