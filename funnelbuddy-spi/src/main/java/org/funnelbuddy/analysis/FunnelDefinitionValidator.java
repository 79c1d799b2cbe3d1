package org.funnelbuddy.analysis;

import org.funnelbuddy.analysis.funnel.FunnelDefinition;
import org.funnelbuddy.analysis.funnel.FunnelFilter;
import org.funnelbuddy.analysis.funnel.FunnelStep;

import java.util.List;

import static java.lang.String.format;
import static org.funnelbuddy.util.ValidationUtil.checkArgument;
import static org.funnelbuddy.util.ValidationUtil.checkNotNull;

/**
 * Checks that a funnel definition can be stored. Definitions read back at compute time are not
 * validated again.
 */
public class FunnelDefinitionValidator {
    public static final int MIN_STEPS = 2;
    public static final int MAX_STEPS = 10;

    public void validate(FunnelDefinition funnel) {
        checkNotNull(funnel, "funnel");
        checkArgument(funnel.name != null && !funnel.name.trim().isEmpty(), "Funnel name is required");
        validateSteps(funnel.steps);
        validateFilters(funnel.filters);
    }

    public void validateSteps(List<FunnelStep> steps) {
        checkNotNull(steps, "steps");
        checkArgument(steps.size() >= MIN_STEPS && steps.size() <= MAX_STEPS,
                format("A funnel must have between %d and %d steps", MIN_STEPS, MAX_STEPS));

        for (int i = 0; i < steps.size(); i++) {
            FunnelStep step = steps.get(i);
            int stepNumber = i + 1;
            checkArgument(!step.getName().trim().isEmpty(), format("Step %d has no name", stepNumber));

            if (step.getType() == FunnelStep.StepType.CUSTOM) {
                checkArgument(!step.getTarget().trim().isEmpty() || !step.getConditions().isEmpty(),
                        format("Custom step %d needs an event name or conditions", stepNumber));
            } else {
                checkArgument(!step.getTarget().trim().isEmpty(), format("Step %d has no target", stepNumber));
            }
        }
    }

    public void validateFilters(List<FunnelFilter> filters) {
        if (filters == null) {
            return;
        }

        for (FunnelFilter filter : filters) {
            checkArgument(filter.getField() != null && !filter.getField().trim().isEmpty(), "Filter field is required");
            checkArgument(filter.getFilterOperator().isPresent(),
                    format("Unsupported filter operator '%s' on field %s", filter.getOperatorName(), filter.getField()));
        }
    }
}
