package org.pxdforge.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Loads the HOCON configuration of the command line tool.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dpxdforge.generator.strict=true})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file ({@code config/pxdforge.conf} or the file given explicitly)</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * <p>
 * Substitutions are resolved after all layers are composed, so an override of a value that
 * {@code reference.conf} refers to reaches every reference.
 *
 * @see #resolve(File, ConfigMessageHandler) for the file discovery cascade
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "pxdforge.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the configuration, taking the first file found:
     * <ol>
     *   <li>the file passed via {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/pxdforge.conf} below the working directory</li>
     *   <li>{@code config/pxdforge.conf} below the installation directory, inferred from
     *       the location of the running jar</li>
     *   <li>none: {@code reference.conf} only</li>
     * </ol>
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null}.
     * @param handler            callback for resolution messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: " + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        // Generation runs fine on defaults, so this is only informational.
        handler.log(MessageLevel.INFO,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found, using defaults from classpath.");
        return loadDefaults();
    }

    /**
     * Loads a configuration file layered over the classpath defaults.
     *
     * @param configFile the file to load.
     * @return the resolved configuration.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads the classpath defaults, still overridable by system properties.
     *
     * @return the resolved configuration.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Looks for {@code APP_HOME/config/pxdforge.conf}, where {@code APP_HOME} is the
     * parent of the {@code lib} directory holding the running jar.
     *
     * @return the file, or {@code null} if the location is unknown or holds no file.
     */
    private static File detectInstallationConfigFile() {
        final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
        final CodeSource codeSource = protectionDomain != null ? protectionDomain.getCodeSource() : null;
        final URL location = codeSource != null ? codeSource.getLocation() : null;
        if (location == null) {
            return null;
        }
        final File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jarOrClasses.isFile()) {
            // classes directory: development runs use the working directory instead
            return null;
        }
        final File libDir = jarOrClasses.getParentFile();
        final File appHome = libDir != null ? libDir.getParentFile() : null;
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
