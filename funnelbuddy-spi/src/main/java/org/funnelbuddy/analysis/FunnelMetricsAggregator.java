package org.funnelbuddy.analysis;

import com.google.common.collect.ImmutableList;
import org.funnelbuddy.analysis.funnel.FunnelAnalyticsResult;
import org.funnelbuddy.analysis.funnel.FunnelProgress;
import org.funnelbuddy.analysis.funnel.FunnelStep;
import org.funnelbuddy.analysis.funnel.SessionProgress;
import org.funnelbuddy.analysis.funnel.StepMetrics;

import java.util.List;

import static org.funnelbuddy.util.TimeUtil.formatDuration;
import static org.funnelbuddy.util.TimeUtil.round2;
import static org.funnelbuddy.util.TimeUtil.secondsBetween;
import static org.funnelbuddy.util.ValidationUtil.checkArgument;

public class FunnelMetricsAggregator {
    public FunnelAnalyticsResult aggregate(List<FunnelStep> steps, FunnelProgress progress) {
        int stepCount = steps.size();
        checkArgument(stepCount == progress.getStepCount(), "Step count does not match the matched progress");

        long entered = progress.getUsers(1);
        ImmutableList.Builder<StepMetrics> builder = ImmutableList.builder();

        int biggestDropoffStep = 1;
        double biggestDropoffRate = 0;
        boolean dropoffFound = false;

        for (int step = 1; step <= stepCount; step++) {
            long users = progress.getUsers(step);
            double conversionRate;
            long dropoffs;
            double dropoffRate;

            if (step == 1) {
                conversionRate = 100.0;
                dropoffs = 0;
                dropoffRate = 0;
            } else {
                long previous = progress.getUsers(step - 1);
                dropoffs = previous - users;
                conversionRate = previous > 0 ? round2((double) users / previous * 100) : 0;
                dropoffRate = previous > 0 ? round2((double) dropoffs / previous * 100) : 0;

                if (!dropoffFound || dropoffRate > biggestDropoffRate) {
                    biggestDropoffStep = step;
                    biggestDropoffRate = dropoffRate;
                    dropoffFound = true;
                }
            }

            builder.add(new StepMetrics(step, steps.get(step - 1).getName(), users, entered,
                    conversionRate, dropoffs, dropoffRate, averageStepTime(progress, step)));
        }

        List<StepMetrics> metrics = builder.build();
        double avgCompletionTime = averageCompletionTime(progress, stepCount);

        return new FunnelAnalyticsResult(
                metrics.get(stepCount - 1).conversionRate,
                entered,
                progress.getUsers(stepCount),
                avgCompletionTime,
                formatDuration(avgCompletionTime),
                biggestDropoffStep,
                biggestDropoffRate,
                metrics);
    }

    private static double averageStepTime(FunnelProgress progress, int step) {
        if (step == 1) {
            return 0;
        }

        double total = 0;
        int count = 0;
        for (SessionProgress session : progress.getSessions()) {
            if (session.hasCompleted(step)) {
                total += secondsBetween(session.getCompletionTime(step - 1), session.getCompletionTime(step));
                count++;
            }
        }
        return count == 0 ? 0 : round2(total / count);
    }

    private static double averageCompletionTime(FunnelProgress progress, int stepCount) {
        double total = 0;
        int count = 0;
        for (SessionProgress session : progress.getSessions()) {
            if (session.hasCompleted(stepCount)) {
                total += secondsBetween(session.getCompletionTime(1), session.getCompletionTime(stepCount));
                count++;
            }
        }
        return count == 0 ? 0 : round2(total / count);
    }
}
