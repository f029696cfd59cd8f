package org.channelsim.cli.commands;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.channelsim.compiler.RateEquationCompiler;
import org.channelsim.compiler.api.RateEquationException;
import org.channelsim.io.SimulationRequest;
import org.channelsim.io.json.DocumentReadException;
import org.channelsim.io.json.JsonModelReader;
import org.channelsim.io.validation.ModelValidator;
import org.channelsim.io.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * CLI command that checks a simulation request without running it.
 * <p>
 * Structural checks run first; if they pass, every rate equation is compiled so that syntax
 * errors and undefined symbols are reported with their offsets.
 */
@Command(
    name = "validate",
    mixinStandardHelpOptions = true,
    description = "Check a simulation request for structural and rate equation errors"
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(
        names = {"-i", "--input"},
        required = true,
        description = "Request JSON file to validate"
    )
    private Path input;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        ValidationResult<SimulationRequest> result;
        try {
            result = new ModelValidator().validateRequest(new JsonModelReader().readRequest(input));
        } catch (DocumentReadException e) {
            log.error("Cannot validate {}: {}", input, e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (result instanceof ValidationResult.Invalid<SimulationRequest> invalid) {
            err.println("Invalid request " + input + ":");
            invalid.errors().forEach(error -> err.println("  " + error));
            return 1;
        }

        ValidationResult.Valid<SimulationRequest> valid = (ValidationResult.Valid<SimulationRequest>) result;
        valid.warnings().forEach(warning -> out.println("Warning: " + warning));

        List<String> compileErrors = compileAll(valid.value().model().rateFunctions());
        if (!compileErrors.isEmpty()) {
            err.println("Invalid rate functions in " + input + ":");
            compileErrors.forEach(error -> err.println("  " + error));
            return 1;
        }

        out.println("Request " + input + " is valid: " + valid.value().model().stateCount() + " states, "
                + valid.value().model().transitions().size() + " transitions, "
                + valid.value().protocol().epochs().size() + " epochs.");
        return 0;
    }

    private static List<String> compileAll(Map<String, String> rateFunctions) {
        RateEquationCompiler compiler = new RateEquationCompiler();
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, String> entry : rateFunctions.entrySet()) {
            try {
                compiler.compile(entry.getValue());
            } catch (RateEquationException e) {
                errors.add("Rate function '" + entry.getKey() + "': " + e.getMessage());
            }
        }
        return errors;
    }
}
