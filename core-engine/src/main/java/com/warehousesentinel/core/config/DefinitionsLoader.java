package com.warehousesentinel.core.config;

import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.DefinitionRegistry;
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
import java.util.List;
import java.util.Objects;

/**
 * Loads and validates definitions from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_DEFINITIONS_PATH} (file system
 * path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method converts the parsed beans with
 * {@link DefinitionsConfig#toRegistry()}, so an invalid definition fails the
 * load with a {@link DefinitionException} listing every problem. Duplicate
 * YAML keys are rejected by the parser.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefinitionsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionsLoader.class);

    /** Environment variable that can override the default definitions location. */
    public static final String ENV_DEFINITIONS_PATH = "DEFINITIONS_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "definitions.yml";

    private DefinitionsLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load definitions using automatic resolution.
     *
     * @return validated registry
     * @throws DefinitionException if a definition is invalid
     */
    public static DefinitionRegistry load() {
        return load(System.getenv(ENV_DEFINITIONS_PATH));
    }

    /**
     * Load from {@code path} when it names an existing file, otherwise from
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @param path configured path, may be {@code null}
     * @return validated registry
     */
    public static DefinitionRegistry load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading definitions from path: {}", path);
            return fromFile(path);
        }
        if (path != null && !path.isBlank()) {
            LOG.warn("Definitions path {} does not exist, falling back to classpath", path);
        }
        LOG.info("Loading definitions from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load definitions from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return validated registry
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or parsing fails
     * @throws DefinitionException      if a definition is invalid
     */
    public static DefinitionRegistry fromFile(String path) {
        Objects.requireNonNull(path, "Definitions file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Definitions file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read definitions file: " + path, e);
        }
    }

    /**
     * Load definitions from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return validated registry
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or parsing fails
     * @throws DefinitionException      if a definition is invalid
     */
    public static DefinitionRegistry fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DefinitionsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DefinitionRegistry parseAndValidate(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DefinitionsConfig.class, options));

        DefinitionsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed definitions in " + origin + ": " + e.getMessage(), e);
        }

        if (config == null || config.isEmpty()) {
            LOG.warn("No definitions found in {}", origin);
            return DefinitionRegistry.of(List.of(), List.of(), List.of(), List.of());
        }
        return config.toRegistry();
    }
}
