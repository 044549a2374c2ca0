package com.stemtutor.dispatch.cli;

import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.persistence.CheckpointQueryService;
import com.stemtutor.core.state.TutorState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: stemtutor status &lt;session-id&gt;
 * <p>
 * Reads the latest checkpoint of a session and shows where it stopped.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check session status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    private final CheckpointQueryService queryService;

    public StatusCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var snapshotOpt = queryService.getLatestSnapshot(sessionId);
        if (snapshotOpt.isEmpty()) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return;
        }

        var snapshot = snapshotOpt.get();
        TutorState state = snapshot.state();

        System.out.println();
        System.out.println("SESSION " + snapshot.sessionId());
        System.out.println("Input: " + state.inputKind() + " | Identity: " + state.identity());
        System.out.println("Problem: " + truncate(state.problemText(), 60));

        SessionStatus status = state.status();
        if (status == SessionStatus.COMPLETED) {
            ConsoleOutput.success("Status: " + status);
        } else if (status == SessionStatus.FAILED) {
            ConsoleOutput.error("Status: " + status);
        } else {
            ConsoleOutput.info("Status: " + status);
        }

        ConsoleOutput.info(String.format("Topic: %s | Confidence: %.2f",
                state.topic().orElse("-"), state.confidence()));
        ConsoleOutput.info("Last step: " + snapshot.lastCompletedStep()
                + (snapshot.nextStep() != null ? " | Next: " + snapshot.nextStep() : ""));

        if (status == SessionStatus.HALTED_DISAMBIGUATE) {
            System.out.println();
            System.out.println("Candidates:");
            state.candidates().forEach(c -> System.out.println("  - " + c));
        }

        var degraded = state.degradedSteps();
        if (!degraded.isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Degraded steps: " + String.join(", ", degraded));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
