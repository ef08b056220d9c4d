package com.phillippitts.terrarium.config;

import com.phillippitts.terrarium.config.properties.ConfigProperties;
import com.phillippitts.terrarium.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the layered configuration directory:
 *
 * <pre>
 * config/
 *   config.json
 *   gpio_config.json
 *   safety_limits.json
 *   policies/*.json
 *   species/**&#47;*.json      (searched recursively)
 *   terrariums/*.json
 * </pre>
 *
 * Absent files and directories yield empty sections. A file that exists but cannot be read or
 * is not a JSON object fails the whole load with {@link ConfigurationException}.
 */
@Component
public class LayeredConfigurationLoader {

    private static final Logger LOG = LogManager.getLogger(LayeredConfigurationLoader.class);
    private static final String JSON_SUFFIX = ".json";

    private final Path directory;

    @Autowired
    public LayeredConfigurationLoader(ConfigProperties properties) {
        this(Path.of(properties.getDirectory()));
    }

    public LayeredConfigurationLoader(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @throws ConfigurationException if any present file is unreadable or malformed
     */
    public LayeredConfiguration load() {
        if (!Files.isDirectory(directory)) {
            LOG.warn("Configuration directory {} not found; continuing with empty configuration", directory);
            return LayeredConfiguration.empty();
        }
        LayeredConfiguration config = new LayeredConfiguration(
                readOptional(directory.resolve("config.json")),
                readOptional(directory.resolve("gpio_config.json")),
                readOptional(directory.resolve("safety_limits.json")),
                readNamed(directory.resolve("policies"), false),
                readNamed(directory.resolve("species"), true),
                readNamed(directory.resolve("terrariums"), false));
        LOG.info("Configuration loaded from {} (policies={}, species={}, terrariums={})",
                directory, config.policies().size(), config.species().size(), config.terrariums().size());
        return config;
    }

    private Map<String, Object> readOptional(Path file) {
        if (!Files.isRegularFile(file)) {
            LOG.debug("Optional configuration file {} not present", file);
            return Map.of();
        }
        return read(file);
    }

    private Map<String, Map<String, Object>> readNamed(Path dir, boolean recursive) {
        if (!Files.isDirectory(dir)) {
            return Map.of();
        }
        List<Path> files;
        try (Stream<Path> paths = recursive ? Files.walk(dir) : Files.list(dir)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new ConfigurationException(dir.toString(), "Cannot list configuration directory", e);
        }
        Map<String, Map<String, Object>> named = new LinkedHashMap<>();
        for (Path file : files) {
            String stem = stem(file);
            if (named.put(stem, read(file)) != null) {
                LOG.warn("Duplicate configuration name {} under {}; {} wins", stem, dir, file);
            }
        }
        return named;
    }

    private static Map<String, Object> read(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return new JSONObject(content).toMap();
        } catch (IOException e) {
            throw new ConfigurationException(file.toString(), "Cannot read configuration file", e);
        } catch (JSONException e) {
            throw new ConfigurationException(file.toString(), "Malformed JSON: " + e.getMessage(), e);
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - JSON_SUFFIX.length());
    }
}
