package org.funnelbuddy.analysis;

import org.funnelbuddy.analysis.funnel.FunnelDefinition;
import org.funnelbuddy.analysis.funnel.FunnelGoal;

import java.util.List;
import java.util.Optional;

public interface FunnelDefinitionStore {
    /**
     * Returns the funnel only when it belongs to the website and has not been soft-deleted.
     */
    Optional<FunnelDefinition> getFunnel(String funnelId, String websiteId);

    List<FunnelGoal> getGoals(String funnelId);

    /**
     * Non-deleted funnels of the website that have at least two steps, newest first.
     */
    List<FunnelDefinition> listFunnels(String websiteId);
}
