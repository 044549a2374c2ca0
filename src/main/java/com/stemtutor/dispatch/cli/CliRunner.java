package com.stemtutor.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TutorCommand tutorCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TutorCommand tutorCommand, IFactory factory) {
        this.tutorCommand = tutorCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // The embedded web server owns the JVM in serve mode.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(tutorCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
