package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public class FunnelGoal {
    public final String id;
    public final String funnelId;
    public final GoalType goalType;
    public final String targetValue;
    public final String description;
    public final boolean isActive;

    @JsonCreator
    public FunnelGoal(@JsonProperty("id") String id,
                      @JsonProperty("funnelId") String funnelId,
                      @JsonProperty("goalType") GoalType goalType,
                      @JsonProperty("targetValue") String targetValue,
                      @JsonProperty("description") String description,
                      @JsonProperty("isActive") boolean isActive) {
        this.id = id;
        this.funnelId = funnelId;
        this.goalType = goalType;
        this.targetValue = targetValue;
        this.description = description;
        this.isActive = isActive;
    }

    public enum GoalType {
        COMPLETION, STEP_CONVERSION, TIME_TO_CONVERT;

        @JsonCreator
        public static GoalType get(String name) {
            return valueOf(name.toUpperCase(Locale.ENGLISH));
        }
    }
}
