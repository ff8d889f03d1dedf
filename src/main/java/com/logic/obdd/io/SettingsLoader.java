package com.logic.obdd.io;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link EditorSettings} from the classpath or from a file.
 */
public final class SettingsLoader {
    private static final Logger log = LogManager.getLogger(SettingsLoader.class);

    public static final String DEFAULT_RESOURCE = "obdd-editor.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {
        // Utility class
    }

    /** Loads {@value #DEFAULT_RESOURCE} from the classpath, or defaults if absent. */
    public static EditorSettings load() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static EditorSettings loadResource(String resource) {
        try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on classpath, using default settings", resource);
                return new EditorSettings();
            }
            EditorSettings settings = MAPPER.readValue(in, EditorSettings.class);
            log.debug("Loaded settings from classpath:{}", resource);
            return settings;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load editor settings from classpath:" + resource, e);
        }
    }

    /** Loads settings from a JSON file. */
    public static EditorSettings load(Path path) {
        try {
            EditorSettings settings = MAPPER.readValue(Files.readString(path), EditorSettings.class);
            log.info("Loaded settings from {}", path);
            return settings;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load editor settings from " + path, e);
        }
    }
}
