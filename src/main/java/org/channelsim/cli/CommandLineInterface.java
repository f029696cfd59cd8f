package org.channelsim.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.channelsim.cli.commands.CompileRateCommand;
import org.channelsim.cli.commands.SimulateCommand;
import org.channelsim.cli.commands.ValidateCommand;
import org.channelsim.cli.config.ConfigLoader;
import org.channelsim.cli.config.LoggingConfigurator;
import org.channelsim.runtime.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "channelsim",
    mixinStandardHelpOptions = true,
    version = "ChannelSim 1.0",
    description = "ChannelSim - Markov-state ion channel simulator with potassium electrodiffusion",
    subcommands = {
        SimulateCommand.class,
        ValidateCommand.class,
        CompileRateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/channelsim.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("channelsim");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case DEBUG -> logger.debug(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("channelsim.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     *
     * @throws IllegalArgumentException if an explicitly given config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return The engine settings from {@code channelsim.engine}, defaults for missing keys.
     */
    public EngineSettings getEngineSettings() {
        Config root = getConfig();
        return EngineSettings.fromConfig(root.hasPath("channelsim.engine")
                ? root.getConfig("channelsim.engine")
                : ConfigFactory.empty());
    }
}
