package org.funnelbuddy.analysis.funnel;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;

/**
 * Completion instants of the steps a session reached in order. Element {@code i} is the
 * completion time of step {@code i + 1}.
 */
public class SessionProgress {
    public final String sessionId;
    public final List<Instant> completions;

    public SessionProgress(String sessionId, List<Instant> completions) {
        this.sessionId = sessionId;
        this.completions = ImmutableList.copyOf(completions);
    }

    public int getCompletedSteps() {
        return completions.size();
    }

    public boolean hasCompleted(int stepNumber) {
        return stepNumber >= 1 && stepNumber <= completions.size();
    }

    public Instant getCompletionTime(int stepNumber) {
        return completions.get(stepNumber - 1);
    }

    @Override
    public String toString() {
        return "SessionProgress{" + sessionId + ", steps=" + completions.size() + '}';
    }
}
