package com.contestfeed.infrastructure.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads an identity mapping table from a flat YAML file of {@code externalId: contestId} pairs.
 *
 * <pre>
 * 1021: A
 * 1022: B
 * </pre>
 *
 * Keys and values are read as strings even when YAML parses them as numbers.
 */
public class MappingFileLoader {

    private static final Logger logger = LoggerFactory.getLogger(MappingFileLoader.class);

    private MappingFileLoader() {
    }

    /**
     * @return the mapping, empty if the file does not exist or is empty
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is not a flat YAML map
     */
    public static Map<String, String> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            logger.warn("Mapping file {} not found, every id of this kind will be skipped", path);
            return Map.of();
        }

        Object parsed;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            parsed = new Yaml().load(reader);
        }
        if (parsed == null) {
            return Map.of();
        }
        if (!(parsed instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Mapping file " + path + " must contain a YAML map");
        }

        Map<String, String> mapping = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Mapping file " + path + " has an empty key or value");
            }
            if (entry.getValue() instanceof Map || entry.getValue() instanceof Iterable) {
                throw new IllegalArgumentException("Mapping file " + path + " must be flat, got nested value for "
                    + entry.getKey());
            }
            mapping.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
        }
        logger.info("Loaded {} mappings from {}", mapping.size(), path);
        return mapping;
    }
}
