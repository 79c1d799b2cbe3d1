package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static org.funnelbuddy.util.ValidationUtil.checkNotNull;

public class FunnelStep {
    private final StepType type;
    private final String target;
    private final String name;
    private final Map<String, Object> conditions;

    @JsonCreator
    public FunnelStep(@JsonProperty("type") StepType type,
                      @JsonProperty("target") String target,
                      @JsonProperty("name") String name,
                      @JsonProperty("conditions") Map<String, Object> conditions) {
        this.type = checkNotNull(type, "step type");
        this.target = target == null ? "" : target;
        this.name = name == null ? "" : name;
        this.conditions = conditions == null ? ImmutableMap.of() : ImmutableMap.copyOf(conditions);
    }

    public FunnelStep(StepType type, String target, String name) {
        this(type, target, name, null);
    }

    @JsonProperty
    public StepType getType() {
        return type;
    }

    @JsonProperty
    public String getTarget() {
        return target;
    }

    @JsonProperty
    public String getName() {
        return name;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getConditions() {
        return conditions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelStep)) {
            return false;
        }
        FunnelStep that = (FunnelStep) o;
        return type == that.type && target.equals(that.target)
                && name.equals(that.name) && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, target, name, conditions);
    }

    @Override
    public String toString() {
        return type + "(" + target + ")";
    }

    public enum StepType {
        PAGE_VIEW, EVENT, CUSTOM;

        @JsonCreator
        public static StepType get(String name) {
            return valueOf(name.toUpperCase(Locale.ENGLISH));
        }
    }
}
