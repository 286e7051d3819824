package org.pharmaguard.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.utils.LoggingUtils;
import org.pharmaguard.utils.Utils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton wrapping {@link org.aeonbits.owner} configuration loading so that path variables used in
 * {@link Config.Sources} annotations always resolve, even when the user supplied no config file.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value assigned to an unset path variable so owner skips that source.
     */
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * Quick way to get the pipeline configuration.
     */
    public PharmaGuardConfig getPharmaGuardConfig() {
        return getOrCreate(PharmaGuardConfig.class);
    }

    /**
     * Wrapper around {@link ConfigCache#getOrCreate(Class, Map[])} which resolves the path variables of
     * {@code clazz} first.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    /**
     * Get the configuration file name from the command line, if the config file option is present.
     *
     * @param args Command-line arguments passed to this program.
     * @param configFileOption The command-line option indicating that the config file is next
     * @return The name of the configuration file for this program or {@code null}.
     */
    public static String getConfigFilenameFromArgs(final String[] args, final String configFileOption) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        for (int i = 0; i < args.length; ++i) {
            if (args[i].equals(configFileOption)) {
                if ((i + 1) < args.length && !args[i + 1].startsWith("-")) {
                    return args[i + 1];
                }
                // Option was provided, but no file was specified.
                throw new UserException.BadInput("Configuration file not given after config file option specified: " + configFileOption);
            }
        }
        return null;
    }

    /**
     * Points the {@link PharmaGuardConfig} file variable at the file named on the command line (if any) and creates
     * the cached configuration. Must run before any tool is instantiated, since tool argument defaults read the config.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList, final String configFileOption) {
        Utils.nonNull(argList);
        Utils.nonNull(configFileOption);
        final String configFileName = getConfigFilenameFromArgs(argList, configFileOption);
        if (configFileName != null) {
            org.aeonbits.owner.ConfigFactory.setProperty(PharmaGuardConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName);
        }
        getOrCreate(PharmaGuardConfig.class);
    }

    /**
     * Logs all the keys and values of {@code config} at the given level.
     */
    public static <T extends Accessible> void logConfigFields(final T config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if (!logger.isEnabled(level)) {
            return;
        }
        logger.log(level, "Configuration file values: ");
        for (final String key : new TreeSet<>(config.propertyNames())) {
            logger.log(level, "\t" + key + " = " + config.getProperty(key));
        }
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if (alreadyResolvedPathVariables.contains(clazz)) {
            return;
        }
        setUnsetPathVariablesToNoPath(getSourcesAnnotationPathVariables(clazz));
        alreadyResolvedPathVariables.add(clazz);
    }

    /**
     * Any path variable not found in the environment, the system properties or the owner factory properties
     * is set to {@link #NO_PATH_VARIABLE_VALUE} so that the next source is consulted.
     */
    @VisibleForTesting
    void setUnsetPathVariablesToNoPath(final List<String> filenameProperties) {
        final Properties systemProperties = System.getProperties();
        final Map<String, String> environmentProperties = System.getenv();

        for (final String property : filenameProperties) {
            if (environmentProperties.containsKey(property)) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property));
            } else if (systemProperties.containsKey(property)) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + systemProperties.get(property));
            } else if (org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property)) {
                logger.debug("Config path variable found in Config Factory Properties: " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property));
            } else {
                logger.debug("Config path variable not found: " + property + " - setting value to " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get the variables named in the {@link Config.Sources} annotation of {@code configClass}.
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();
        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if (annotation != null) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }
}
