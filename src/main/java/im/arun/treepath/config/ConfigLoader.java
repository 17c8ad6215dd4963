package im.arun.treepath.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.treepath.model.PathStyle;
import im.arun.treepath.model.TreeStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "treepath.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final TreePathConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private TreePathConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), TreePathConfig.class);
                }
                logger.warn("Config file {} not found, trying classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, TreePathConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new TreePathConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new TreePathConfig();
        }
    }

    /**
     * Defaults merged with {@code userOptions}. Keys may be snake_case or camelCase.
     *
     * @throws IllegalArgumentException if a known key carries an unusable value
     */
    public TreePathConfig load(Map<String, Object> userOptions) {
        TreePathConfig config = copy(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "tree_style":
                case "treeStyle":
                    config.setTreeStyle(value instanceof TreeStyle ? (TreeStyle) value : TreeStyle.parse(value.toString()));
                    break;
                case "path_style":
                case "pathStyle":
                    config.setPathStyle(value instanceof PathStyle ? (PathStyle) value : PathStyle.parse(value.toString()));
                    break;
                case "root_path_threshold":
                case "rootPathThreshold":
                    config.setRootPathThreshold(parseInt(key, value));
                    break;
                case "leaf_path_threshold":
                case "leafPathThreshold":
                    config.setLeafPathThreshold(parseInt(key, value));
                    break;
                case "path_width_threshold":
                case "pathWidthThreshold":
                    config.setPathWidthThreshold(parseInt(key, value));
                    break;
                case "path_length_threshold":
                case "pathLengthThreshold":
                    config.setPathLengthThreshold(parseInt(key, value));
                    break;
                case "lcrs_depth_limit":
                case "lcrsDepthLimit":
                    config.setLcrsDepthLimit(parseInt(key, value));
                    break;
                case "seed":
                    config.setSeed(value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString()));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    public TreePathConfig getDefaultConfig() {
        return copy(defaultConfig);
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " expects an integer, got: " + value, e);
        }
    }

    public static TreePathConfig copy(TreePathConfig source) {
        TreePathConfig copy = new TreePathConfig();
        copy.setTreeStyle(source.getTreeStyle());
        copy.setPathStyle(source.getPathStyle());
        copy.setRootPathThreshold(source.getRootPathThreshold());
        copy.setLeafPathThreshold(source.getLeafPathThreshold());
        copy.setPathWidthThreshold(source.getPathWidthThreshold());
        copy.setPathLengthThreshold(source.getPathLengthThreshold());
        copy.setLcrsDepthLimit(source.getLcrsDepthLimit());
        copy.setSeed(source.getSeed());
        return copy;
    }
}
