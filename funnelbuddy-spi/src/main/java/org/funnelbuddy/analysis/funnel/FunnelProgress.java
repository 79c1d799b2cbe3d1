package org.funnelbuddy.analysis.funnel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Set;

public class FunnelProgress {
    private final List<Set<String>> completedSessions;
    private final List<SessionProgress> sessions;

    public FunnelProgress(List<Set<String>> completedSessions, List<SessionProgress> sessions) {
        this.completedSessions = completedSessions.stream()
                .map(ImmutableSet::copyOf)
                .collect(ImmutableList.toImmutableList());
        this.sessions = ImmutableList.copyOf(sessions);
    }

    public int getStepCount() {
        return completedSessions.size();
    }

    /**
     * Sessions that completed steps 1 to {@code stepNumber} in order.
     */
    public Set<String> getCompletedSessions(int stepNumber) {
        return completedSessions.get(stepNumber - 1);
    }

    public int getUsers(int stepNumber) {
        return getCompletedSessions(stepNumber).size();
    }

    public List<SessionProgress> getSessions() {
        return sessions;
    }
}
