package com.stationsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link DetectionSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates the result, so a bad file stops the
 * run before any row is read.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Environment variable that can override the default settings location. */
    public static final String ENV_CONFIG_PATH = "DETECTION_CONFIG_PATH";

    /** Classpath resource holding the default settings. */
    public static final String DEFAULT_RESOURCE = "detection.yml";

    private SettingsLoader() {
        // utility class
    }

    /**
     * Load settings from {@value #ENV_CONFIG_PATH} when it names an existing
     * file, otherwise from the classpath.
     *
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     */
    public static DetectionSettings load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading detection settings from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading detection settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file path; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DetectionSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectionSettings.class, options));
        DetectionSettings settings;
        try {
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detection settings: " + e.getMessage(), e);
        }

        if (settings == null) {
            LOG.warn("Detection settings document is empty, using defaults");
            settings = new DetectionSettings();
        }
        settings.validate();

        LOG.info("Loaded {}", settings);
        return settings;
    }
}
