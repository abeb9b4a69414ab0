package dev.wizards.cli;

import ch.qos.logback.classic.Level;
import dev.wizards.engine.BaseStep;
import dev.wizards.model.WizardStatus;
import dev.wizards.survey.Confirmation;
import dev.wizards.survey.DraftRepository;
import dev.wizards.survey.InMemorySurveyGateway;
import dev.wizards.survey.OfficeSurveyWizard;
import dev.wizards.survey.SurveyContext;
import dev.wizards.survey.SurveyGateway;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Console host for the office survey wizard.
 */
@Command(
    name = "survey-wizard",
    mixinStandardHelpOptions = true,
    description = "Run the office survey wizard in a console, or inspect saved drafts."
)
public class SurveyWizardCli implements Callable<Integer> {

    @Option(names = "--draft-dir", defaultValue = "drafts", description = "Directory holding draft files (default: ${DEFAULT-VALUE})")
    private Path draftDir;

    @Option(names = "--list-drafts", description = "List saved drafts")
    private boolean listDrafts;

    @Option(names = "--show", paramLabel = "DRAFT_ID", description = "Print a saved draft")
    private String showDraft;

    @Option(names = "--resume", paramLabel = "DRAFT_ID", description = "Resume a saved draft")
    private String resumeDraft;

    @Option(names = "--steps", description = "Print the wizard steps without running it")
    private boolean steps;

    @Option(names = "--user", description = "Clerk id recorded on new surveys")
    private String user;

    @Option(names = "--verbose", description = "Log navigation transitions")
    private boolean verbose;

    private final BufferedReader in;
    private final PrintStream out;
    private final SurveyGateway gateway;

    public SurveyWizardCli() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out,
            new InMemorySurveyGateway());
    }

    SurveyWizardCli(BufferedReader in, PrintStream out, SurveyGateway gateway) {
        this.in = in;
        this.out = out;
        this.gateway = gateway;
    }

    @Override
    public Integer call() throws IOException {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.wizards")).setLevel(Level.DEBUG);
        }
        var drafts = new DraftRepository(draftDir);

        if (listDrafts) {
            var summaries = drafts.list();
            if (summaries.isEmpty()) {
                out.println("No drafts in " + draftDir);
            }
            for (var draft : summaries) {
                out.printf("%s  %-11s  step %d  updated %s%n",
                    draft.draftId(), draft.status(), draft.currentStepIndex() + 1, draft.updatedAt());
            }
            return 0;
        }

        if (showDraft != null) {
            Optional<Map<String, Object>> snapshot = drafts.load(showDraft);
            if (snapshot.isEmpty()) {
                out.println("Draft not found: " + showDraft);
                return 1;
            }
            SurveyContext context;
            try {
                context = SurveyContext.fromMap(snapshot.get());
            } catch (DateTimeException | IllegalArgumentException e) {
                out.println("Draft is damaged: " + showDraft + " (" + e.getMessage() + ")");
                return 1;
            }
            context.getSummary().forEach((key, value) -> out.printf("%-17s %s%n", key, value));
            return 0;
        }

        if (steps) {
            var wizard = new OfficeSurveyWizard(gateway, drafts, Confirmation.ALWAYS, user);
            wizard.open();
            out.println(wizard.getWizardTitle() + ":");
            int number = 1;
            for (BaseStep<SurveyContext> step : wizard.steps()) {
                String flag = step.isOptional() ? " (optional)" : "";
                out.printf("  %d. %s%s%n", number++, step.getStepTitle(), flag);
            }
            return 0;
        }

        OfficeSurveyWizard wizard;
        if (resumeDraft != null) {
            try {
                wizard = OfficeSurveyWizard.loadFromDraft(drafts, resumeDraft, () -> newWizard(drafts));
            } catch (IllegalArgumentException e) {
                out.println("Error: " + e.getMessage());
                return 1;
            } catch (DateTimeException e) {
                out.println("Error: draft " + resumeDraft + " is damaged (" + e.getMessage() + ")");
                return 1;
            }
        } else {
            wizard = newWizard(drafts);
            wizard.open();
        }

        out.println(ConsoleSession.HELP);
        new ConsoleSession(wizard, out).run(in);
        return wizard.context().status() == WizardStatus.CANCELLED ? 2 : 0;
    }

    private OfficeSurveyWizard newWizard(DraftRepository drafts) {
        var wizard = new OfficeSurveyWizard(gateway, drafts, this::confirm, user);
        wizard.setView(new ConsoleWizardView(out));
        return wizard;
    }

    private boolean confirm(String question) {
        out.println(question + " [y/N]");
        try {
            String answer = in.readLine();
            return answer != null && answer.trim().equalsIgnoreCase("y");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
