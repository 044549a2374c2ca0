package com.stemtutor.dispatch.cli;

import com.stemtutor.core.model.SolutionStep;
import com.stemtutor.core.service.TutorResponse;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the tutor CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STEM TUTOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TUTOR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void step(SolutionStep step) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [STEP " + step.index() + "]|@ @|bold " + step.title() + "|@"));
        if (step.expression() != null && !step.expression().isBlank()) {
            System.out.println("      " + step.expression());
        }
        System.out.println("      " + step.explanation());
    }

    public static void response(TutorResponse response) {
        System.out.println();
        System.out.println("SESSION " + response.sessionId());
        switch (response.status()) {
            case TutorResponse.COMPLETED -> {
                success("Lesson ready" + (response.topic() != null ? ": " + response.topic() : ""));
                if (response.steps() != null) {
                    response.steps().forEach(ConsoleOutput::step);
                }
                if (response.finalAnswer() != null) {
                    System.out.println(CommandLine.Help.Ansi.AUTO.string(
                            "@|bold,fg(green) Answer:|@ " + response.finalAnswer()));
                }
            }
            case TutorResponse.REQUIRES_DISAMBIGUATION -> {
                info("Which topic fits best? Resume with: stemtutor resume "
                        + response.sessionId() + " \"<topic>\"");
                if (response.candidates() != null) {
                    response.candidates().forEach(c -> System.out.println("  - " + c));
                }
            }
            case TutorResponse.REQUIRES_CLARIFICATION ->
                    info("Could you provide more details? Resume with: stemtutor resume "
                            + response.sessionId() + " \"<topic>\"");
            default -> error("Session ended with status " + response.status());
        }
        if (response.degradedSteps() != null) {
            error("Degraded steps: " + String.join(", ", response.degradedSteps()));
        }
    }
}
