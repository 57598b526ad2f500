package com.lineage.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final LineageCommand lineageCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LineageCommand lineageCommand, IFactory factory) {
        this.lineageCommand = lineageCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // In serve mode the embedded web server owns the process lifetime.
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = new CommandLine(lineageCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
