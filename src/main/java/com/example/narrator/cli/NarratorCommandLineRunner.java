package com.example.narrator.cli;

import com.example.narrator.service.PipelineOrchestrator;
import com.example.narrator.service.PipelineOrchestratorFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Runs {@link NarrateCommand} with the process arguments once the context is up. A missing source is a
 * usage error like any other and ends the process with exit code 1.
 */
@Component
@ConditionalOnProperty(prefix = "narrator.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NarratorCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PipelineOrchestrator orchestrator;
    private final PipelineOrchestratorFactory factory;
    private int exitCode;

    public NarratorCommandLineRunner(PipelineOrchestrator orchestrator, PipelineOrchestratorFactory factory) {
        this.orchestrator = orchestrator;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        String[] commandArgs = withoutSpringProperties(args);
        exitCode = NarrateCommand.commandLine(new NarrateCommand(orchestrator, factory)).execute(commandArgs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** Drops {@code --some.property=value} arguments, which Spring has already consumed. */
    static String[] withoutSpringProperties(String[] args) {
        return Arrays.stream(args)
                .filter(arg -> !(arg.startsWith("--") && arg.contains("=") && arg.substring(2, arg.indexOf('=')).contains(".")))
                .toArray(String[]::new);
    }
}
