package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link PagelensConfig} from YAML, deep-merged over the built-in defaults ({@code pagelens-defaults.yaml}).
 */
public final class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULTS_RESOURCE = "/pagelens-defaults.yaml";

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public PagelensConfig defaults() {
        return bind(defaultsTree());
    }

    /**
     * Reads a YAML file. A missing file yields the defaults.
     *
     * @throws IllegalArgumentException when the file is not valid YAML or holds invalid values
     */
    public PagelensConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            logger.info("Config file {} not found, using defaults", path);
            return defaults();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read config " + path, e);
        }
    }

    public PagelensConfig load(InputStream in) {
        JsonNode loaded;
        try {
            loaded = yaml.readTree(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("Config is not valid YAML: " + e.getMessage(), e);
        }
        ObjectNode merged = defaultsTree();
        if (loaded != null && loaded.isObject()) {
            JsonTrees.deepMerge(merged, loaded);
        }
        return bind(merged);
    }

    /**
     * Returns a new config with {@code overrides} deep-merged over {@code base}. {@code base} is not modified.
     *
     * @throws IllegalArgumentException when the overrides are not an object or hold invalid values
     */
    public PagelensConfig withOverrides(PagelensConfig base, JsonNode overrides) {
        if (overrides == null || overrides.isNull() || overrides.isMissingNode()) {
            return base;
        }
        if (!overrides.isObject()) {
            throw new IllegalArgumentException("config_overrides must be an object");
        }
        if (overrides.isEmpty()) {
            return base;
        }
        ObjectNode tree = yaml.valueToTree(base);
        JsonTrees.deepMerge(tree, overrides);
        return bind(tree);
    }

    public JsonNode toTree(PagelensConfig config) {
        return yaml.valueToTree(config);
    }

    private ObjectNode defaultsTree() {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                return yaml.createObjectNode();
            }
            JsonNode tree = yaml.readTree(in);
            return tree != null && tree.isObject() ? (ObjectNode) tree : yaml.createObjectNode();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    private PagelensConfig bind(JsonNode tree) {
        try {
            return yaml.treeToValue(tree, PagelensConfig.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
    }
}
