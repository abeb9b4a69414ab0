package dev.wizards;

import dev.wizards.cli.SurveyWizardCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SurveyWizardCli()).execute(args);
        System.exit(exitCode);
    }
}
