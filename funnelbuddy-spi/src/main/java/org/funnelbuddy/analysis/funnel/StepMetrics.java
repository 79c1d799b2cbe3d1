package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class StepMetrics {
    @JsonProperty("step_number")
    public final int stepNumber;
    @JsonProperty("step_name")
    public final String stepName;
    @JsonProperty("users")
    public final long users;
    @JsonProperty("total_users")
    public final long totalUsers;
    @JsonProperty("conversion_rate")
    public final double conversionRate;
    @JsonProperty("dropoffs")
    public final long dropoffs;
    @JsonProperty("dropoff_rate")
    public final double dropoffRate;
    @JsonProperty("avg_time_to_complete")
    public final double avgTimeToComplete;

    @JsonCreator
    public StepMetrics(@JsonProperty("step_number") int stepNumber,
                       @JsonProperty("step_name") String stepName,
                       @JsonProperty("users") long users,
                       @JsonProperty("total_users") long totalUsers,
                       @JsonProperty("conversion_rate") double conversionRate,
                       @JsonProperty("dropoffs") long dropoffs,
                       @JsonProperty("dropoff_rate") double dropoffRate,
                       @JsonProperty("avg_time_to_complete") double avgTimeToComplete) {
        this.stepNumber = stepNumber;
        this.stepName = stepName;
        this.users = users;
        this.totalUsers = totalUsers;
        this.conversionRate = conversionRate;
        this.dropoffs = dropoffs;
        this.dropoffRate = dropoffRate;
        this.avgTimeToComplete = avgTimeToComplete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StepMetrics)) {
            return false;
        }
        StepMetrics that = (StepMetrics) o;
        return stepNumber == that.stepNumber && users == that.users && totalUsers == that.totalUsers
                && Double.compare(that.conversionRate, conversionRate) == 0
                && dropoffs == that.dropoffs
                && Double.compare(that.dropoffRate, dropoffRate) == 0
                && Double.compare(that.avgTimeToComplete, avgTimeToComplete) == 0
                && Objects.equals(stepName, that.stepName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepNumber, stepName, users, totalUsers, conversionRate, dropoffs, dropoffRate, avgTimeToComplete);
    }

    @Override
    public String toString() {
        return "StepMetrics{" + stepNumber + ", users=" + users + ", conversion=" + conversionRate + '}';
    }
}
