package org.channelsim.cli.commands;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.channelsim.cli.CommandLineInterface;
import org.channelsim.compiler.api.RateEquationException;
import org.channelsim.io.SimulationRequest;
import org.channelsim.io.json.DocumentReadException;
import org.channelsim.io.json.JsonModelReader;
import org.channelsim.io.json.ResultJsonWriter;
import org.channelsim.io.json.SimulationRequestDocument;
import org.channelsim.io.validation.ModelValidator;
import org.channelsim.io.validation.ValidationException;
import org.channelsim.io.validation.ValidationResult;
import org.channelsim.runtime.IntegrationFailureException;
import org.channelsim.runtime.SimulationEngine;
import org.channelsim.runtime.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that reads a simulation request (model, protocol, duration, steps), runs it and
 * writes the result as JSON.
 * <p>
 * Results go to stdout unless {@code --output} is given; diagnostics go to stderr and the log.
 */
@Command(
    name = "simulate",
    mixinStandardHelpOptions = true,
    description = "Run a simulation request and write the result traces as JSON"
)
public class SimulateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SimulateCommand.class);

    @Option(
        names = {"-i", "--input"},
        required = true,
        description = "Request JSON file with 'model', 'protocol', 'duration_ms' and 'steps' ('-' for stdin)"
    )
    private String input;

    @Option(
        names = {"-o", "--output"},
        description = "Result JSON file (default: stdout)"
    )
    private Path output;

    @Option(
        names = {"--duration-ms"},
        description = "Override the request's duration_ms"
    )
    private Double durationMs;

    @Option(
        names = {"--steps"},
        description = "Override the request's number of output samples"
    )
    private Integer steps;

    @Option(
        names = {"--pretty"},
        description = "Indent the JSON output"
    )
    private boolean pretty;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            SimulationRequestDocument document = readRequest();
            if (durationMs != null) {
                document.durationMs = durationMs;
            }
            if (steps != null) {
                document.steps = steps;
            }

            ValidationResult<SimulationRequest> validation = new ModelValidator().validateRequest(document);
            if (validation instanceof ValidationResult.Valid<SimulationRequest> valid) {
                valid.warnings().forEach(warning -> log.warn(warning));
            }
            SimulationRequest request = validation.orElseThrow();

            SimulationEngine engine = new SimulationEngine(request.model(), request.protocol(),
                    parent.getEngineSettings());
            SimulationResult result = engine.run(request.durationMs(), request.steps());

            ResultJsonWriter writer = new ResultJsonWriter(pretty);
            if (output != null) {
                try (Writer fileWriter = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                    writer.write(result, fileWriter);
                }
                log.info("Wrote {} samples to {}", result.sampleCount(), output);
            } else {
                writeTo(writer, result, out);
            }
            return 0;

        } catch (ValidationException e) {
            err.println("Invalid request:");
            e.getErrors().forEach(error -> err.println("  " + error));
            log.error("Request validation failed with {} errors", e.getErrors().size());
            return 1;
        } catch (DocumentReadException | RateEquationException | IntegrationFailureException e) {
            log.error("Simulation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Unexpected error while simulating {}", input, e);
            err.println("Unexpected error: " + e);
            return 1;
        }
    }

    private SimulationRequestDocument readRequest() throws DocumentReadException {
        JsonModelReader reader = new JsonModelReader();
        if ("-".equals(input)) {
            Reader stdin = new InputStreamReader(System.in, StandardCharsets.UTF_8);
            return reader.readRequest(stdin);
        }
        return reader.readRequest(Path.of(input));
    }

    private static void writeTo(ResultJsonWriter writer, SimulationResult result, PrintWriter out) throws IOException {
        BufferedWriter buffered = new BufferedWriter(out);
        writer.write(result, buffered);
        buffered.newLine();
        buffered.flush();
    }
}
