package dev.wizards.engine;

/**
 * Presentation host of a wizard. The wizard calls it on the event thread in response to
 * navigator events; every method defaults to doing nothing.
 */
public interface WizardView {

    WizardView NONE = new WizardView() {};

    /** The displayed step changed. */
    default void showStep(int index, BaseStep<?> step) {}

    /** @param current 1-based step number */
    default void updateProgress(int current, int total, int percentage) {}

    default void updateNavigation(boolean canGoPrevious, String nextLabel) {}

    default void showWarning(String message) {}

    default void showError(String message) {}

    default void showSuccess(String message) {}

    default void close() {}
}
