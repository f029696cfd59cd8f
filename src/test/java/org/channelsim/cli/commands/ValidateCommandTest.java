package org.channelsim.cli.commands;

import org.channelsim.cli.CommandLineInterface;
import org.channelsim.test.ChannelModelFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine cmdLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @Test
    void testValidRequest() throws Exception {
        Path request = write(ChannelModelFixtures.twoStateRequestJson(300.0, 301));

        int exitCode = cmdLine.execute("validate", "-i", request.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(out.toString()).contains("is valid: 2 states, 2 transitions, 1 epochs.");
    }

    @Test
    void testOverlappingEpochsAreReportedAsWarnings() throws Exception {
        String overlapping = ChannelModelFixtures.twoStateRequestJson(300.0, 301).replace(
                "\"epochs\": [",
                "\"epochs\": [{\"variable\": \"voltage_mV\", \"start_time_ms\": 0, \"duration_ms\": 150, \"value\": 0},");
        Path request = write(overlapping);

        int exitCode = cmdLine.execute("validate", "-i", request.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("Warning: protocol: Epochs on 'voltage_mV' overlap between 100.0 and 150.0 ms");
    }

    @Test
    void testRateEquationErrorsAreReported() throws Exception {
        String broken = ChannelModelFixtures.twoStateRequestJson(300.0, 301)
                .replace("0.2 * exp(-V / 50)", "0.2 * exp(-V / 50");
        Path request = write(broken);

        int exitCode = cmdLine.execute("validate", "-i", request.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Rate function 'beta': Expected ')'");
    }

    @Test
    void testStructuralErrorsAreReported() throws Exception {
        String broken = ChannelModelFixtures.twoStateRequestJson(300.0, 301)
                .replace("\"variable\": \"voltage_mV\"", "\"variable\": \"voltage\"");
        Path request = write(broken);

        int exitCode = cmdLine.execute("validate", "-i", request.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("protocol: Epoch 0: 'voltage' is not a valid variable.");
    }

    private Path write(String json) throws Exception {
        Path file = tempDir.resolve("request.json");
        Files.writeString(file, json);
        return file;
    }
}
