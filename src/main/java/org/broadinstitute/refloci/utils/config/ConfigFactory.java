package org.broadinstitute.refloci.utils.config;

import com.google.common.annotations.VisibleForTesting;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.refloci.utils.Utils;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * Resolves the path variables used in {@link org.aeonbits.owner.Config.Sources} annotations before handing
 * creation over to Owner, so that unset variables fall through to the next source instead of being read as
 * literal paths.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * Quick way to get the RefLoci configuration.
     */
    public RefLociConfig getRefLociConfig() {
        return getOrCreate(RefLociConfig.class);
    }

    /**
     * Wrapper around {@link org.aeonbits.owner.ConfigFactory#create(Class, Map[])} that resolves path variables first.
     * Each call returns a fresh instance; use this when a caller needs settings that differ from the shared ones.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Wrapper around {@link ConfigCache#getOrCreate(Class, Map[])} that resolves path variables first.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if (alreadyResolvedPathVariables.add(clazz)) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
        }
    }

    /**
     * Any of the given {@code filenameProperties} that is not defined as a system property, an environment variable
     * or an Owner property is set to {@link #NO_PATH_VARIABLE_VALUE}, so Owner finds nothing there and moves on.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
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
                logger.debug("Config path variable not found: " + property + " - setting value to default empty variable: " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config file variables from the given {@link Config} class.
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

    /**
     * Logs all the parameters in the given {@link Config} object at DEBUG.
     */
    public static <T extends Config & org.aeonbits.owner.Accessible> void logConfigFields(final T config) {
        Utils.nonNull(config);
        if (!logger.isDebugEnabled()) {
            return;
        }
        final Properties properties = new Properties();
        config.fill(properties);
        new TreeMap<>(properties).forEach((key, value) -> logger.debug("{} = {}", key, value));
    }
}
