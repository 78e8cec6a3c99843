package org.pulsecheck.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.pulsecheck.cli.commands.CheckCommand;
import org.pulsecheck.cli.commands.ProbesCommand;
import org.pulsecheck.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "pulsecheck",
    mixinStandardHelpOptions = true,
    version = "PulseCheck 1.0",
    description = "PulseCheck - dependency health aggregation with circuit breaking",
    subcommands = {
        CheckCommand.class,
        ProbesCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class HealthCheckCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckCli.class);

    static final String CONFIG_FILE_NAME = "pulsecheck.conf";
    static final String ENVIRONMENT_VARIABLE = "PULSECHECK_ENV";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: pulsecheck.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new HealthCheckCli());
        commandLine.setCommandName("pulsecheck");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * <p>
     * Load order: system properties &gt; environment variables &gt; config file &gt; classpath defaults.
     * The config file is the one given via {@code --config}, else {@code -Dconfig.file}, else
     * {@code pulsecheck.conf} in the working directory; without any of them only the classpath
     * defaults apply.
     *
     * @return The resolved configuration.
     * @throws ConfigException if an explicitly named file is missing or the configuration is invalid.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }

        final File file = resolveConfigFile();
        Config fileConfig = ConfigFactory.empty();
        if (file != null) {
            log.info("Using configuration file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            log.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        }

        config = layer(fileConfig, System.getenv());

        LoggingConfigurator.configure(config);
        return config;
    }

    /**
     * Stacks the configuration sources. Documented environment variables such as
     * {@value #ENVIRONMENT_VARIABLE} are mapped onto their keys and sit above the file.
     */
    static Config layer(final Config fileConfig, final Map<String, String> environment) {
        return ConfigFactory.systemProperties()
            .withFallback(environmentOverrides(environment))
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.load())
            .resolve();
    }

    static Config environmentOverrides(final Map<String, String> environment) {
        final String value = environment.get(ENVIRONMENT_VARIABLE);
        if (value == null || value.isBlank()) {
            return ConfigFactory.empty();
        }
        return ConfigFactory.parseMap(Map.of("pulsecheck.environment", value), "environment variable " + ENVIRONMENT_VARIABLE);
    }

    private File resolveConfigFile() {
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new ConfigException.Generic(
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            return configFile;
        }
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new ConfigException.Generic(
                    "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile.getAbsolutePath());
            }
            return systemConfigFile;
        }
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.exists() ? cwdConfigFile : null;
    }
}
