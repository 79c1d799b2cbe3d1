package org.funnelbuddy.analysis.funnel;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static org.funnelbuddy.util.ValidationUtil.checkNotNull;

/**
 * Earliest occurrence of a funnel step within one session.
 */
public class FunnelStepEvent {
    public final int stepNumber;
    public final String stepName;
    public final String sessionId;
    public final Instant firstOccurrence;
    private final String referrer;

    public FunnelStepEvent(int stepNumber, String stepName, String sessionId, Instant firstOccurrence, String referrer) {
        this.stepNumber = stepNumber;
        this.stepName = stepName;
        this.sessionId = checkNotNull(sessionId, "sessionId");
        this.firstOccurrence = checkNotNull(firstOccurrence, "firstOccurrence");
        this.referrer = referrer;
    }

    public FunnelStepEvent(int stepNumber, String stepName, String sessionId, Instant firstOccurrence) {
        this(stepNumber, stepName, sessionId, firstOccurrence, null);
    }

    public Optional<String> getReferrer() {
        return Optional.ofNullable(referrer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelStepEvent)) {
            return false;
        }
        FunnelStepEvent that = (FunnelStepEvent) o;
        return stepNumber == that.stepNumber && sessionId.equals(that.sessionId)
                && firstOccurrence.equals(that.firstOccurrence)
                && Objects.equals(stepName, that.stepName)
                && Objects.equals(referrer, that.referrer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepNumber, stepName, sessionId, firstOccurrence, referrer);
    }

    @Override
    public String toString() {
        return "FunnelStepEvent{step=" + stepNumber + ", session=" + sessionId + ", at=" + firstOccurrence + '}';
    }
}
