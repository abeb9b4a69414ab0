package dev.wizards.cli;

import dev.wizards.engine.BaseStep;
import dev.wizards.engine.WizardView;
import dev.wizards.survey.SurveyStep;

import java.io.PrintStream;

/**
 * Prints wizard refreshes to a console.
 */
public class ConsoleWizardView implements WizardView {

    private final PrintStream out;
    private boolean closed;

    public ConsoleWizardView(PrintStream out) {
        this.out = out;
    }

    @Override
    public void showStep(int index, BaseStep<?> step) {
        out.println();
        if (step instanceof SurveyStep surveyStep) {
            out.println(surveyStep.render());
        } else {
            out.println(step.getStepTitle());
        }
    }

    @Override
    public void updateProgress(int current, int total, int percentage) {
        out.printf("Step %d of %d (%d%%)%n", current, total, percentage);
    }

    @Override
    public void updateNavigation(boolean canGoPrevious, String nextLabel) {
        out.println(canGoPrevious ? "[back] [next: " + nextLabel + "]" : "[next: " + nextLabel + "]");
    }

    @Override
    public void showWarning(String message) {
        out.println("Warning:");
        out.println(message);
    }

    @Override
    public void showError(String message) {
        out.println("Error: " + message);
    }

    @Override
    public void showSuccess(String message) {
        out.println(message);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() { return closed; }
}
