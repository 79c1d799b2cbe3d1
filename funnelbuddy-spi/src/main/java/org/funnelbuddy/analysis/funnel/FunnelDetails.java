package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

public class FunnelDetails {
    @JsonProperty
    public final FunnelDefinition funnel;
    @JsonProperty
    public final List<FunnelGoal> goals;

    public FunnelDetails(FunnelDefinition funnel, List<FunnelGoal> goals) {
        this.funnel = funnel;
        this.goals = ImmutableList.copyOf(goals);
    }
}
