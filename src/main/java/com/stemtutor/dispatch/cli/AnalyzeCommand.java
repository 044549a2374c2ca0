package com.stemtutor.dispatch.cli;

import com.stemtutor.core.model.InputKind;
import com.stemtutor.core.ratelimit.RateLimitExceededException;
import com.stemtutor.core.service.ProblemSubmission;
import com.stemtutor.core.service.TutorService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * CLI command: stemtutor analyze "&lt;problem&gt;" | --image &lt;file&gt;
 * <p>
 * Runs one tutoring session and prints either the lesson or what the
 * session is waiting for.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze a STEM problem")
@Component
public class AnalyzeCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Problem text")
    private String problem;

    @Option(names = {"--image", "-i"}, description = "Path to a photo of the problem")
    private Path image;

    @Option(names = {"--identity", "-u"}, description = "Rate-limit identity (default: ${DEFAULT-VALUE})",
            defaultValue = "cli")
    private String identity;

    @Option(names = {"--session", "-s"}, description = "Session id to use")
    private String sessionId;

    private final TutorService tutorService;

    public AnalyzeCommand(TutorService tutorService) {
        this.tutorService = tutorService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        ProblemSubmission submission;
        if (image != null) {
            try {
                String encoded = Base64.getEncoder().encodeToString(Files.readAllBytes(image));
                submission = new ProblemSubmission(sessionId, identity, InputKind.IMAGE, encoded);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read image " + image + ": " + e.getMessage());
                return;
            }
        } else if (problem != null && !problem.isBlank()) {
            submission = new ProblemSubmission(sessionId, identity, InputKind.TEXT, problem);
        } else {
            ConsoleOutput.error("Provide problem text or --image <file>");
            return;
        }

        ConsoleOutput.info("Analyzing problem...");
        try {
            ConsoleOutput.response(tutorService.analyze(submission));
        } catch (RateLimitExceededException e) {
            ConsoleOutput.error("Rate limit exceeded, retry in " + e.getResetInSeconds() + "s");
        } catch (Exception e) {
            ConsoleOutput.error("Analysis failed: " + rootCauseMessage(e));
        }
    }

    static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
