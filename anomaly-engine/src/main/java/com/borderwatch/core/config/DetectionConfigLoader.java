package com.borderwatch.core.config;

import com.borderwatch.core.model.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the default {@link DetectionConfig} that requests are built on.
 *
 * <p>
 * {@link #load()} honours {@value #ENV_CONFIG_PATH} when it names a regular
 * file and otherwise reads the bundled {@value #DEFAULT_RESOURCE}. An empty
 * document yields the built-in defaults; anything else is validated through
 * {@link DetectionProperties#validate()} before it is converted.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionConfigLoader.class);

    /** Names a YAML file that replaces the bundled defaults. */
    public static final String ENV_CONFIG_PATH = "DETECTION_CONFIG_PATH";

    /** Bundled defaults on the classpath. */
    public static final String DEFAULT_RESOURCE = "detection.yml";

    private DetectionConfigLoader() {
        // utility class - not instantiable
    }

    /**
     * @return the validated defaults for this process
     * @throws IllegalStateException if the selected document is malformed or
     *                               invalid
     */
    public static DetectionConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * Resolve the defaults given the value of {@value #ENV_CONFIG_PATH}.
     * A blank value selects the bundled resource; a value that does not name
     * a regular file is logged and also falls back to it.
     */
    static DetectionConfig load(String overridePath) {
        if (overridePath != null && !overridePath.isBlank()) {
            Path path = Path.of(overridePath.trim());
            if (Files.isRegularFile(path)) {
                return fromFile(path);
            }
            LOG.warn("{}={} is not a regular file - using classpath {}", ENV_CONFIG_PATH, path, DEFAULT_RESOURCE);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @return the validated configuration
     * @throws IllegalArgumentException if {@code path} is not a regular file
     * @throws IllegalStateException    if the file cannot be read or is invalid
     */
    public static DetectionConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Detection config file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detection config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return the validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource cannot be read or is
     *                                  invalid
     */
    public static DetectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = DetectionConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DetectionConfig read(Reader reader, String origin) {
        DetectionProperties properties;
        try {
            properties = newYaml().load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detection config " + origin + ": " + e.getMessage(), e);
        }
        if (properties == null) {
            LOG.warn("Detection config {} is empty - using built-in defaults", origin);
            properties = new DetectionProperties();
        }
        properties.validate();

        DetectionConfig config = properties.toConfig();
        LOG.info("Detection defaults from {}: {}", origin, config);
        return config;
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(DetectionProperties.class, options));
    }
}
