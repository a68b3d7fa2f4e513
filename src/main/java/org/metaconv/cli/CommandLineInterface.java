package org.metaconv.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.metaconv.cli.commands.CompileCommand;
import org.metaconv.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "metaconv",
    mixinStandardHelpOptions = true,
    version = "metaconv 1.0",
    description = "Compiles Perl tag-table expressions into Java functions",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "metaconv.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: metaconv.conf)"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("metaconv");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // Config load order: System Props > Env Vars > File > Classpath defaults
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            this.config = load(this.configFile);
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.exists()) {
                logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                this.config = load(cwdConfigFile);
            } else {
                // -Dconfig.file is honoured by ConfigFactory.load()
                logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                this.config = load(null);
            }
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private static Config load(final File file) {
        try {
            Config base = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                base = base.withFallback(ConfigFactory.parseFile(file));
            }
            return base.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new IllegalStateException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
