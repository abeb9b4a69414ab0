package dev.wizards.engine;

import dev.wizards.model.EventEmitter;
import dev.wizards.model.NavigationEvent;
import dev.wizards.model.StepEvent;
import dev.wizards.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Moves between the ordered steps of a wizard. Forward moves are gated by the active step's
 * validation; backward moves never are.
 *
 * <p>States are the step indices {@code 0..N-1}. Out-of-range requests return {@code false} and
 * change nothing. Not thread-safe: every call is expected on the host's event thread.
 */
public class StepNavigator<C extends WizardContext> {

    private static final Logger logger = LoggerFactory.getLogger(StepNavigator.class);

    private final List<BaseStep<C>> steps;
    private final EventEmitter<NavigationEvent> events = new EventEmitter<>();
    private C context;
    private int currentIndex;

    public StepNavigator(C context, List<? extends BaseStep<C>> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("A wizard needs at least one step");
        }
        this.context = context;
        this.steps = List.copyOf(steps);
        this.currentIndex = 0;
        for (BaseStep<C> step : this.steps) {
            step.subscribe(event -> onStepEvent(step, event));
        }
    }

    public EventEmitter.Subscription subscribe(Consumer<? super NavigationEvent> listener) {
        return events.subscribe(listener);
    }

    public C context() { return context; }

    void bindContext(C context) {
        this.context = context;
    }

    public int getCurrentIndex() { return currentIndex; }

    public int getStepCount() { return steps.size(); }

    public List<BaseStep<C>> steps() { return steps; }

    public BaseStep<C> getCurrentStep() {
        return steps.get(currentIndex);
    }

    public BaseStep<C> getStep(int index) {
        return steps.get(index);
    }

    public boolean isLastStep() {
        return currentIndex == steps.size() - 1;
    }

    public boolean canGoNext() {
        return currentIndex < steps.size() - 1;
    }

    public boolean canGoPrevious() {
        return currentIndex > 0;
    }

    /**
     * Show the step at the current index and publish the initial navigation state. Used once when
     * the wizard opens, since {@code gotoStep(0)} from index 0 is a no-op.
     */
    public void start() {
        getCurrentStep().onShow();
        context.setCurrentStepIndex(currentIndex);
        publishMove(currentIndex, currentIndex);
    }

    public boolean nextStep() {
        return nextStep(false);
    }

    /**
     * Advance one step. Unless validation is skipped, the active step must validate; on success
     * it is marked completed and its {@code onNext()} runs before the move. Exceptions from
     * {@code onNext()} propagate with the index unchanged.
     */
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
        return navigateTo(currentIndex + 1);
    }

    /** Go back one step without validating. */
    public boolean previousStep() {
        if (!canGoPrevious()) {
            return false;
        }
        return navigateTo(currentIndex - 1);
    }

    public boolean gotoStep(int index) {
        return gotoStep(index, false);
    }

    /**
     * Jump to any step. Forward jumps validate the active step (and mark it completed) unless
     * skipped; backward jumps never validate.
     */
    public boolean gotoStep(int index, boolean skipValidation) {
        if (index < 0 || index >= steps.size()) {
            logger.warn("Rejected jump to step {} of {}", index, steps.size());
            return false;
        }
        if (index == currentIndex) {
            return true;
        }
        if (index > currentIndex && !skipValidation && !validateCurrentStep()) {
            return false;
        }
        return navigateTo(index);
    }

    public void reset() {
        navigateTo(0);
    }

    /**
     * Progress through the wizard, 0 on the first step and 100 on the last. A single-step wizard
     * reports 0.
     */
    public double getProgressPercentage() {
        if (steps.size() <= 1) {
            return 0.0;
        }
        return currentIndex * 100.0 / (steps.size() - 1);
    }

    public int getCompletedStepsCount() {
        return context.completedSteps().size();
    }

    /**
     * Validate the active step, marking it completed on success and publishing
     * {@link NavigationEvent.ValidationFailed} on failure.
     */
    protected boolean validateCurrentStep() {
        ValidationResult result = getCurrentStep().validate();
        if (!result.isValid()) {
            logger.info("Step {} ({}) failed validation: {}",
                currentIndex, getCurrentStep().getStepTitle(), result.errors());
            events.emit(new NavigationEvent.ValidationFailed(result));
            return false;
        }
        context.markStepCompleted(currentIndex);
        return true;
    }

    /**
     * Hide the active step, move the index in both navigator and context, show the new step, then
     * publish step-changed, can-go-next and can-go-previous in that order.
     */
    protected boolean navigateTo(int newIndex) {
        if (newIndex < 0 || newIndex >= steps.size()) {
            return false;
        }
        int oldIndex = currentIndex;

        getCurrentStep().onHide();

        currentIndex = newIndex;
        context.setCurrentStepIndex(newIndex);

        getCurrentStep().onShow();

        logger.debug("Step {} -> {} ({})", oldIndex, newIndex, getCurrentStep().getStepTitle());
        publishMove(oldIndex, newIndex);
        return true;
    }

    /** Validity changes of the active step refresh the Next control; hidden steps are ignored. */
    private void onStepEvent(BaseStep<C> step, StepEvent event) {
        if (event instanceof StepEvent.ValidationChanged changed && step == getCurrentStep()) {
            logger.debug("Step {} validity now {}", currentIndex, changed.valid());
            events.emit(new NavigationEvent.CanGoNextChanged(canGoNext()));
        }
    }

    private void publishMove(int oldIndex, int newIndex) {
        events.emit(new NavigationEvent.StepChanged(oldIndex, newIndex));
        events.emit(new NavigationEvent.CanGoNextChanged(canGoNext()));
        events.emit(new NavigationEvent.CanGoPreviousChanged(canGoPrevious()));
    }
}
