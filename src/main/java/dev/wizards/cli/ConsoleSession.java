package dev.wizards.cli;

import dev.wizards.survey.OfficeSurveyWizard;
import dev.wizards.survey.SurveyContext;
import dev.wizards.survey.SurveyStep;
import dev.wizards.survey.model.Building;
import dev.wizards.survey.model.Household;
import dev.wizards.survey.model.Person;
import dev.wizards.survey.model.PropertyUnit;
import dev.wizards.survey.model.Relation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;

/**
 * Line-oriented driver for an opened office survey wizard. Each input line is one command;
 * data commands write to the survey context, navigation commands press the wizard's controls.
 */
public class ConsoleSession {

    static final String HELP = """
        Navigation: next, back, goto <n>, finish, save, cancel, show, quit
        Data:       building <code> <address...>
                    unit <id> <type> | new-unit <type>
                    household <head> <size>
                    person <id> <full name...>
                    relation <person-id> <type> [evidence-count]""";

    private final OfficeSurveyWizard wizard;
    private final PrintStream out;

    public ConsoleSession(OfficeSurveyWizard wizard, PrintStream out) {
        this.wizard = wizard;
        this.out = out;
    }

    /** Read commands until the wizard closes, {@code quit}, or end of input. */
    public void run(BufferedReader in) throws IOException {
        String line;
        while (wizard.isOpen() && (line = in.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!execute(trimmed.split("\\s+"))) {
                break;
            }
        }
    }

    /** @return false when the session should end */
    boolean execute(String[] args) {
        SurveyContext context = wizard.context();
        try {
            switch (args[0]) {
                case "next" -> wizard.handleNext();
                case "back" -> wizard.handlePrevious();
                case "goto" -> {
                    if (!wizard.navigator().gotoStep(Integer.parseInt(args[1]) - 1)) {
                        out.println("No such step: " + args[1]);
                    }
                }
                case "finish" -> {
                    if (!wizard.navigator().isLastStep()) {
                        out.println("Finish is only available on the last step");
                    } else {
                        wizard.handleSubmit();
                    }
                }
                case "save" -> wizard.handleSaveDraft();
                case "cancel" -> wizard.handleCancel();
                case "show" -> {
                    if (wizard.navigator().getCurrentStep() instanceof SurveyStep step) {
                        step.onShow();
                        out.println(step.render());
                    }
                }
                case "quit" -> {
                    return false;
                }
                case "building" -> {
                    context.setBuilding(new Building(args[1], UUID.randomUUID().toString(), rest(args, 2)));
                    revalidateCurrentStep();
                }
                case "unit" -> {
                    context.setUnit(new PropertyUnit(args[1], UUID.randomUUID().toString(), args[2], null));
                    revalidateCurrentStep();
                }
                case "new-unit" -> {
                    context.setNewUnit(Map.of("unit_type", args[1]));
                    revalidateCurrentStep();
                }
                case "household" -> {
                    context.addHousehold(new Household(args[1], Integer.parseInt(args[2]), "resident"));
                    revalidateCurrentStep();
                }
                case "person" -> {
                    context.addPerson(new Person(args[1], rest(args, 2), null));
                    revalidateCurrentStep();
                }
                case "relation" -> {
                    context.addRelation(new Relation(args[1], args[2], args.length > 3 ? Integer.parseInt(args[3]) : 0));
                    revalidateCurrentStep();
                }
                default -> out.println(HELP);
            }
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            out.println("Invalid arguments for '" + args[0] + "'");
            out.println(HELP);
        }
        return true;
    }

    private void revalidateCurrentStep() {
        if (wizard.navigator().getCurrentStep() instanceof SurveyStep step) {
            step.revalidate();
        }
    }

    private static String rest(String[] args, int from) {
        return String.join(" ", Arrays.copyOfRange(args, Math.min(from, args.length), args.length));
    }
}
