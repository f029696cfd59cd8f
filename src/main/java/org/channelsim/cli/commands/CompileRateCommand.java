package org.channelsim.cli.commands;

import java.util.List;
import java.util.concurrent.Callable;

import org.channelsim.compiler.RateEquationCompiler;
import org.channelsim.compiler.api.RateEquationException;
import org.channelsim.compiler.api.RateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "compile-rate",
    mixinStandardHelpOptions = true,
    description = "Compile a single rate equation and print its value at the given voltages"
)
public class CompileRateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileRateCommand.class);

    @Parameters(index = "0", description = "Rate equation, e.g. \"0.1 * exp(V / 25.0)\"")
    private String equation;

    @Option(
        names = {"-v", "--voltage"},
        split = ",",
        defaultValue = "0",
        description = "Membrane voltages in mV to evaluate at (default: ${DEFAULT-VALUE})"
    )
    private List<Double> voltages;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        RateFunction function;
        try {
            function = new RateEquationCompiler().compile(equation);
        } catch (RateEquationException e) {
            log.error("Failed to compile rate equation: {}", e.getMessage());
            err.println("Error at offset " + e.getOffset() + ": " + e.getMessage());
            err.println("  " + equation);
            err.println("  " + " ".repeat(Math.max(0, e.getOffset())) + "^");
            return 1;
        }

        for (double voltage : voltages) {
            out.printf("V = %s mV -> %s /s%n", voltage, function.rate(voltage));
        }
        return 0;
    }
}
