package org.pxdforge.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.pxdforge.cli.commands.GenerateCommand;
import org.pxdforge.cli.config.ConfigLoader;
import org.pxdforge.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "pxdforge",
    mixinStandardHelpOptions = true,
    version = "pxdforge 1.0",
    description = "pxdforge - Cython declarations from C/C++ AST dumps",
    subcommands = {
        GenerateCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "AST dumps are JSON files written by the front end, one per header:",
        "",
        "    pxdforge generate build/ast/foo.ast.json -o include/foo.pxd",
        "    pxdforge generate -D build/ast -o bindings"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOGGING_FORMAT_PROPERTY = "pxdforge.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/pxdforge.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // no subcommand given
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
        commandLine.setCommandName("pxdforge");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            throw e;
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LOGGING_FORMAT_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * The application configuration, loaded on first use.
     *
     * @throws IllegalArgumentException if the explicit configuration file is missing.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
