package com.taskenv.config;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskStatus;
import com.taskenv.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads environment configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static EnvironmentConfig load(String path) {
        log.info("Loading environment configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static EnvironmentConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(inputStream);

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMap(document, "configuration root");

        // The environment section may sit at the root or under 'environment'
        Map<String, Object> envConfig = root.containsKey("environment")
                ? asMap(root.get("environment"), "'environment'")
                : root;

        String name = getString(envConfig, "name", "default-environment");
        String version = getString(envConfig, "version", "1.0");
        List<SeedTaskConfig> seedTasks = parseSeedTasks(envConfig.get("seed-tasks"));

        EnvironmentConfig config = new EnvironmentConfig(name, version, seedTasks);
        log.info("Loaded environment configuration: {} v{} with {} seed tasks", name, version, seedTasks.size());
        return config;
    }

    private static List<SeedTaskConfig> parseSeedTasks(Object value) {
        if (value == null) {
            log.warn("No seed-tasks configured, episodes start with an empty board");
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'seed-tasks' must be a list, got: " + value);
        }
        List<SeedTaskConfig> seeds = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            seeds.add(parseSeedTask(asMap(list.get(i), "Seed task #" + i), i));
        }
        return seeds;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Integer value = getInteger(map, key);
        return value != null ? value : defaultValue;
    }

    /**
     * Integer value of a key. Only whole numbers within int range are accepted.
     */
    private static Integer getInteger(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            return l.intValue();
        }
        throw new ConfigurationException("'" + key + "' must be an integer, got: " + value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException(what + " must be a mapping, got: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new ConfigurationException("'" + key + "' must be a list, got: " + value);
        }
        return items.stream().map(String::valueOf).toList();
    }
}
