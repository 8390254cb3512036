package pocketcube.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads {@link EngineConfig} from JSON. Absent fields keep their defaults and are reported
 * once at WARN; present but invalid values fail with {@link ConfigException}.
 */
public final class ConfigLoader {
    public static final String DEFAULT_RESOURCE = "pocketcube.json";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final List<String> FIELDS = List.of("scrambleLength", "scrambleSeed", "colorScheme");

    private ConfigLoader() {}

    public static EngineConfig load(ObjectMapper mapper) {
        return loadResource(mapper, DEFAULT_RESOURCE);
    }

    public static EngineConfig loadResource(ObjectMapper mapper, String resource) {
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(resource, "resource");

        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Config resource {} not found. Falling back to defaults.", resource);
                return defaults();
            }
            return bind(mapper, mapper.readTree(in), resource);
        }
        catch (IOException e) {
            throw new ConfigException("Could not read config resource " + resource, e);
        }
    }

    public static EngineConfig load(ObjectMapper mapper, Path configFile) {
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(configFile, "configFile");

        try {
            return bind(mapper, mapper.readTree(Files.readString(configFile)), configFile.toString());
        }
        catch (IOException e) {
            throw new ConfigException("Could not read config file " + configFile, e);
        }
    }

    public static EngineConfig defaults() {
        EngineConfig config = new EngineConfig();
        config.validate();
        return config;
    }

    private static EngineConfig bind(ObjectMapper mapper, JsonNode root, String source) throws IOException {
        if (root == null || root.isNull() || root.isMissingNode()) {
            log.warn("Config {} is empty. Falling back to defaults.", source);
            return defaults();
        }
        if (!root.isObject())
            throw new ConfigException("Config root must be a JSON object: " + source);

        for (String field: FIELDS) {
            if (!root.has(field))
                log.warn("Config {} has no '{}', using the default", source, field);
        }

        EngineConfig config = mapper.treeToValue(root, EngineConfig.class);
        if (config == null)
            config = new EngineConfig();
        config.validate();
        return config;
    }
}
