package com.stemtutor.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: analyze, resume, status, quota, serve.
 */
@Command(
        name = "stemtutor",
        mixinStandardHelpOptions = true,
        version = "STEM Tutor 0.1.0",
        description = "Resumable STEM tutoring workflow powered by LangGraph4j",
        subcommands = {
                AnalyzeCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                QuotaCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TutorCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
