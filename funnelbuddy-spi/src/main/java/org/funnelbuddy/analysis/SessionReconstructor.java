package org.funnelbuddy.analysis;

import com.google.common.collect.ImmutableList;
import org.funnelbuddy.analysis.funnel.FunnelStepEvent;
import org.funnelbuddy.analysis.funnel.SessionStepTrace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups step rows by session and orders every session chronologically. When two steps share a
 * timestamp the lower step number comes first.
 */
public class SessionReconstructor {
    public static final Comparator<FunnelStepEvent> EVENT_ORDER = Comparator
            .comparing((FunnelStepEvent e) -> e.firstOccurrence)
            .thenComparingInt(e -> e.stepNumber);

    public List<SessionStepTrace> reconstruct(Collection<FunnelStepEvent> events) {
        Map<String, List<FunnelStepEvent>> sessions = new TreeMap<>();
        for (FunnelStepEvent event : events) {
            sessions.computeIfAbsent(event.sessionId, k -> new ArrayList<>()).add(event);
        }

        ImmutableList.Builder<SessionStepTrace> builder = ImmutableList.builder();
        for (Map.Entry<String, List<FunnelStepEvent>> entry : sessions.entrySet()) {
            List<FunnelStepEvent> trace = entry.getValue();
            trace.sort(EVENT_ORDER);
            builder.add(new SessionStepTrace(entry.getKey(), trace));
        }
        return builder.build();
    }
}
