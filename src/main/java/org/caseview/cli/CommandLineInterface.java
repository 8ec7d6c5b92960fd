package org.caseview.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.caseview.cli.commands.CaseCommand;
import org.caseview.cli.commands.CasesCommand;
import org.caseview.cli.commands.SourcesCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "caseview",
    mixinStandardHelpOptions = true,
    version = "caseview 1.0",
    description = "Inspect recorded optimization and solver cases in a SQLite case store",
    subcommands = {
        SourcesCommand.class,
        CasesCommand.class,
        CaseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file layered over the built-in defaults"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("caseview");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration once.
     * <p>
     * Load order: system properties, then the {@code --config} file (or
     * {@code -Dconfig.file}), then classpath defaults.
     *
     * @throws IllegalArgumentException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        File file = configFile;
        if (file == null) {
            String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                file = new File(systemConfigPath).getAbsoluteFile();
            }
        }
        try {
            if (file != null) {
                if (!file.exists()) {
                    throw new IllegalArgumentException("Configuration file not found: " + file.getAbsolutePath());
                }
                log.debug("Using configuration file {}", file.getAbsolutePath());
                config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.parseFile(file))
                    .withFallback(ConfigFactory.load())
                    .resolve();
            } else {
                config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.load())
                    .resolve();
            }
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
        return config;
    }
}
