package com.logic.obdd.io;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Editor configuration, read from {@code obdd-editor.json}.
 *
 * Every field has a default, so an empty JSON object is a valid configuration.
 * Key bindings map a key name (a single character, "ESC" or "DEL") to an
 * {@link com.logic.obdd.api.EditorCommand} name; a non-empty map replaces the
 * built-in bindings entirely.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorSettings {
    private int canvasWidth = 800;
    private int canvasHeight = 600;
    private double newNodeOffset = 80;

    /** Must be a power of two. */
    private int ringBufferSize = 1024;

    /** Also write a Mermaid rendering next to every exported JSON file. */
    private boolean exportMermaid;

    private Map<String, String> keyBindings = new LinkedHashMap<>();
}
