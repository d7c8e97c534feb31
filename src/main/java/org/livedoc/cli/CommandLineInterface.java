package org.livedoc.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.livedoc.cli.commands.ExpandCommand;
import org.livedoc.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "livedoc",
    mixinStandardHelpOptions = true,
    version = "livedoc 1.0",
    description = "Registers live documents and expands them into resolved node trees",
    subcommands = {
        ExpandCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/livedoc.conf)"
    )
    private File configFile;

    private Config config;

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
        commandLine.setCommandName("livedoc");
        return commandLine;
    }

    /**
     * The resolved configuration, loaded on first use.
     *
     * @throws IllegalArgumentException if an explicitly given config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.info(message);
                    case WARN -> LOG.warn(message);
                }
            });
        }
        return config;
    }
}
