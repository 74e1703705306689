package org.filemetrics.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Loads {@link AppConfig} from YAML. Lookup order: the {@code filemetrics.config} system property,
 * {@code conf/config.yaml} under the working directory, then the bundled {@code config.yaml}.
 */
public class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());

    public static final String CONFIG_PROPERTY = "filemetrics.config";
    static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");
    static final String BUNDLED_CONFIG = "/config.yaml";

    static AppConfig appConfig;

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    public static synchronized AppConfig getConfig() throws IOException {
        if (appConfig == null) {
            String override = System.getProperty(CONFIG_PROPERTY);
            if (override != null && !override.isBlank()) {
                appConfig = load(Path.of(override));
            } else if (Files.isRegularFile(DEFAULT_CONFIG_PATH)) {
                appConfig = load(DEFAULT_CONFIG_PATH);
            } else {
                appConfig = loadBundled();
            }
        }
        return appConfig;
    }

    public static AppConfig load(final Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath))
            throw new IOException("Config file not found: " + configPath);
        APP_LOGGER.info("Loading configuration from " + configPath);
        try (InputStream in = Files.newInputStream(configPath)) {
            return read(in);
        }
    }

    static AppConfig loadBundled() throws IOException {
        try (InputStream in = ConfigManager.class.getResourceAsStream(BUNDLED_CONFIG)) {
            if (in == null) {
                APP_LOGGER.warning("No bundled " + BUNDLED_CONFIG + " on the classpath, using defaults");
                return AppConfig.defaults();
            }
            APP_LOGGER.fine("Loading bundled configuration");
            return read(in);
        }
    }

    private static AppConfig read(final InputStream in) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        AppConfig config = yamlMapper.readValue(in, AppConfig.class);
        return config != null ? config : AppConfig.defaults();
    }

    static synchronized void reset() {
        appConfig = null;
    }
}
