package com.example.narrator.cli;

import com.example.narrator.dto.OutputPackage;
import com.example.narrator.dto.PipelineRequest;
import com.example.narrator.service.PipelineOrchestrator;
import com.example.narrator.service.PipelineOrchestratorFactory;
import com.example.narrator.util.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "narrator",
        mixinStandardHelpOptions = true,
        description = "Turn an article, a text or a slide document into a narrated video"
)
public class NarrateCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(NarrateCommand.class);

    @CommandLine.Parameters(
            index = "0",
            paramLabel = "SOURCE",
            description = "Article URL, the text itself, or a path to a PDF slide document"
    )
    private String source;

    @CommandLine.Option(
            names = {"--type"},
            description = "Source type: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "URL"
    )
    private SourceType type = SourceType.URL;

    @CommandLine.Option(
            names = {"--target-length"},
            paramLabel = "SECONDS",
            description = "Target video length in seconds (default: derived from reading time)"
    )
    private Integer targetLength;

    @CommandLine.Option(
            names = {"--no-quality-check"},
            description = "Skip the quality review of the generated script"
    )
    private boolean noQualityCheck;

    @CommandLine.Option(
            names = {"--output-dir"},
            paramLabel = "DIR",
            description = "Root directory for job output (default: narrator.pipeline.output-dir)"
    )
    private Path outputDir;

    @CommandLine.Option(
            names = {"--cleanup"},
            description = "Delete the temp working directory after a successful run"
    )
    private boolean cleanup;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final PipelineOrchestrator orchestrator;
    private final PipelineOrchestratorFactory factory;

    public NarrateCommand(PipelineOrchestrator orchestrator, PipelineOrchestratorFactory factory) {
        this.orchestrator = orchestrator;
        this.factory = factory;
    }

    @Override
    public Integer call() {
        PipelineRequest request = new PipelineRequest(source, type, targetLength,
                noQualityCheck ? Boolean.FALSE : null,
                cleanup ? Boolean.FALSE : null);
        PipelineOrchestrator target = outputDir != null ? factory.create(outputDir) : orchestrator;
        OutputPackage output = target.execute(request);
        spec.commandLine().getOut().println("Output directory: " + output.paths().directory());
        spec.commandLine().getOut().println("Video: " + output.paths().video());
        spec.commandLine().getOut().flush();
        LOGGER.debug("CLI run finished jobId={}", output.jobId());
        return 0;
    }

    /**
     * Command line with this project's conventions: case-insensitive types, and every failure, usage
     * errors included, reported as one {@code Error: <message>} line with exit code 1.
     */
    public static CommandLine commandLine(NarrateCommand command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            LOGGER.debug("CLI run failed", ex);
            commandLine.getErr().println("Error: " + ex.getMessage());
            commandLine.getErr().flush();
            return 1;
        });
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine commandLine = ex.getCommandLine();
            commandLine.getErr().println("Error: " + ex.getMessage());
            commandLine.usage(commandLine.getErr());
            commandLine.getErr().flush();
            return 1;
        });
        return cmd;
    }
}
