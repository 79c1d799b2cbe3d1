package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public class FunnelAnalyticsResult {
    @JsonProperty("overall_conversion_rate")
    public final double overallConversionRate;
    @JsonProperty("total_users_entered")
    public final long totalUsersEntered;
    @JsonProperty("total_users_completed")
    public final long totalUsersCompleted;
    @JsonProperty("avg_completion_time")
    public final double avgCompletionTime;
    @JsonProperty("avg_completion_time_formatted")
    public final String avgCompletionTimeFormatted;
    @JsonProperty("biggest_dropoff_step")
    public final int biggestDropoffStep;
    @JsonProperty("biggest_dropoff_rate")
    public final double biggestDropoffRate;
    @JsonProperty("steps_analytics")
    public final List<StepMetrics> stepsAnalytics;

    @JsonCreator
    public FunnelAnalyticsResult(@JsonProperty("overall_conversion_rate") double overallConversionRate,
                                 @JsonProperty("total_users_entered") long totalUsersEntered,
                                 @JsonProperty("total_users_completed") long totalUsersCompleted,
                                 @JsonProperty("avg_completion_time") double avgCompletionTime,
                                 @JsonProperty("avg_completion_time_formatted") String avgCompletionTimeFormatted,
                                 @JsonProperty("biggest_dropoff_step") int biggestDropoffStep,
                                 @JsonProperty("biggest_dropoff_rate") double biggestDropoffRate,
                                 @JsonProperty("steps_analytics") List<StepMetrics> stepsAnalytics) {
        this.overallConversionRate = overallConversionRate;
        this.totalUsersEntered = totalUsersEntered;
        this.totalUsersCompleted = totalUsersCompleted;
        this.avgCompletionTime = avgCompletionTime;
        this.avgCompletionTimeFormatted = avgCompletionTimeFormatted;
        this.biggestDropoffStep = biggestDropoffStep;
        this.biggestDropoffRate = biggestDropoffRate;
        this.stepsAnalytics = ImmutableList.copyOf(stepsAnalytics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelAnalyticsResult)) {
            return false;
        }
        FunnelAnalyticsResult that = (FunnelAnalyticsResult) o;
        return Double.compare(that.overallConversionRate, overallConversionRate) == 0
                && totalUsersEntered == that.totalUsersEntered
                && totalUsersCompleted == that.totalUsersCompleted
                && Double.compare(that.avgCompletionTime, avgCompletionTime) == 0
                && biggestDropoffStep == that.biggestDropoffStep
                && Double.compare(that.biggestDropoffRate, biggestDropoffRate) == 0
                && Objects.equals(avgCompletionTimeFormatted, that.avgCompletionTimeFormatted)
                && stepsAnalytics.equals(that.stepsAnalytics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(overallConversionRate, totalUsersEntered, totalUsersCompleted, avgCompletionTime,
                avgCompletionTimeFormatted, biggestDropoffStep, biggestDropoffRate, stepsAnalytics);
    }
}
