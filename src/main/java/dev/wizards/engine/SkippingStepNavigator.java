package dev.wizards.engine;

import java.util.List;

/**
 * Navigator that passes over steps whose {@link BaseStep#canSkip()} is true when moving one step
 * forward or back. The first and last steps are always reachable.
 */
public class SkippingStepNavigator<C extends WizardContext> extends StepNavigator<C> {

    public SkippingStepNavigator(C context, List<? extends BaseStep<C>> steps) {
        super(context, steps);
    }

    @Override
    public boolean nextStep(boolean skipValidation) {
        if (!canGoNext()) {
            return false;
        }
        if (!skipValidation) {
            if (!validateCurrentStep()) {
                return false;
            }
            getCurrentStep().onNext();
        }
        int target = getCurrentIndex() + 1;
        while (target < getStepCount() - 1 && getStep(target).canSkip()) {
            target++;
        }
        return navigateTo(target);
    }

    @Override
    public boolean previousStep() {
        if (!canGoPrevious()) {
            return false;
        }
        int target = getCurrentIndex() - 1;
        while (target > 0 && getStep(target).canSkip()) {
            target--;
        }
        return navigateTo(target);
    }
}
