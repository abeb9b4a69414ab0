package dev.wizards.engine;

/**
 * Thrown by a step's {@code onNext()} side effect when it fails and the wizard must not advance.
 */
public class StepActionException extends RuntimeException {

    public StepActionException(String message) {
        super(message);
    }

    public StepActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
