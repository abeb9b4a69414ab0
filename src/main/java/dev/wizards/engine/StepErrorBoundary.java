package dev.wizards.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs step operations that must not crash the wizard, e.g. loading reference data into a step.
 * Failures are logged with the step and operation name and counted; the caller gets an empty
 * result instead of an exception. {@link Error}s are never caught.
 */
public final class StepErrorBoundary {

    private static final Logger logger = LoggerFactory.getLogger(StepErrorBoundary.class);

    private final String stepName;
    private int errorCount;
    private Exception lastError;

    public StepErrorBoundary(String stepName) {
        this.stepName = stepName;
    }

    public <T> Optional<T> call(String operation, Supplier<T> action) {
        try {
            return Optional.ofNullable(action.get());
        } catch (RuntimeException e) {
            record(operation, e);
            return Optional.empty();
        }
    }

    public boolean run(String operation, Runnable action) {
        try {
            action.run();
            return true;
        } catch (RuntimeException e) {
            record(operation, e);
            return false;
        }
    }

    private void record(String operation, RuntimeException e) {
        errorCount++;
        lastError = e;
        logger.error("Error in {} during {}: {}", stepName, operation, e.getMessage(), e);
    }

    public int errorCount() { return errorCount; }

    public Optional<Exception> lastError() { return Optional.ofNullable(lastError); }

    public boolean shouldRetry(int maxRetries) {
        return errorCount < maxRetries;
    }

    public String summary() {
        if (errorCount == 0) {
            return "No errors";
        }
        return "Step: %s\nErrors: %d\nLast error: %s - %s".formatted(
            stepName, errorCount, lastError.getClass().getSimpleName(), lastError.getMessage());
    }
}
