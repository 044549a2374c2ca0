package com.stemtutor.dispatch.cli;

import com.stemtutor.core.engine.SessionNotFoundException;
import com.stemtutor.core.engine.SessionNotResumableException;
import com.stemtutor.core.service.TutorService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: stemtutor resume &lt;session-id&gt; "&lt;topic&gt;"
 */
@Command(name = "resume", mixinStandardHelpOptions = true,
        description = "Continue a halted session with a chosen topic")
@Component
public class ResumeCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Parameters(index = "1", description = "Selected topic, e.g. \"Math - Algebra\"")
    private String selectedTopic;

    private final TutorService tutorService;

    public ResumeCommand(TutorService tutorService) {
        this.tutorService = tutorService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Resuming session " + sessionId + " with topic " + selectedTopic);
        try {
            ConsoleOutput.response(tutorService.resume(sessionId, selectedTopic));
        } catch (SessionNotFoundException | SessionNotResumableException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (Exception e) {
            ConsoleOutput.error("Resume failed: " + AnalyzeCommand.rootCauseMessage(e));
        }
    }
}
