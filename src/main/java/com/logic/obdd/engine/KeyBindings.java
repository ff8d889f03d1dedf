package com.logic.obdd.engine;

import com.logic.obdd.api.EditorCommand;
import com.logic.obdd.api.InputEvent.KeyPress;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Keyboard shortcut table: key to {@link EditorCommand}.
 *
 * Letter keys match case-insensitively. Default table:
 *
 * <pre>
 * n        add node          r      set root
 * 1        connect 1-edge    0      connect 0-edge
 * d        delete edges      x/DEL  delete node
 * ESC      cancel            e / i  export / import
 * </pre>
 */
public final class KeyBindings {
    private final Map<Character, EditorCommand> bindings;

    private KeyBindings(Map<Character, EditorCommand> bindings) {
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    public static KeyBindings defaults() {
        Map<Character, EditorCommand> map = new LinkedHashMap<>();
        map.put('n', EditorCommand.ADD_NODE);
        map.put('r', EditorCommand.SET_ROOT);
        map.put('1', EditorCommand.CONNECT_ONE);
        map.put('0', EditorCommand.CONNECT_ZERO);
        map.put('d', EditorCommand.DELETE_EDGES);
        map.put('x', EditorCommand.DELETE_NODE);
        map.put(KeyPress.DELETE, EditorCommand.DELETE_NODE);
        map.put(KeyPress.ESCAPE, EditorCommand.CANCEL);
        map.put('e', EditorCommand.EXPORT);
        map.put('i', EditorCommand.IMPORT);
        return new KeyBindings(map);
    }

    /**
     * Builds a table from configuration: key names ("n", "ESC", "DEL") to
     * command names ("ADD_NODE"). An empty or null map gives the defaults.
     *
     * @throws IllegalArgumentException on an unknown key name or command.
     */
    public static KeyBindings fromNames(Map<String, String> names) {
        if (names == null || names.isEmpty())
            return defaults();
        Map<Character, EditorCommand> map = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : names.entrySet()) {
            char key = parseKey(e.getKey());
            if (e.getValue() == null)
                throw new IllegalArgumentException("Unknown command 'null' for key " + e.getKey());
            EditorCommand command;
            try {
                command = EditorCommand.valueOf(e.getValue().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unknown command '" + e.getValue() + "' for key " + e.getKey());
            }
            map.put(key, command);
        }
        return new KeyBindings(map);
    }

    /** @return the bound command, or null if the key is unbound. */
    public EditorCommand lookup(char key) {
        return bindings.get(Character.toLowerCase(key));
    }

    public Map<Character, EditorCommand> asMap() {
        return bindings;
    }

    private static char parseKey(String name) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Empty key name");
        switch (name.toUpperCase(Locale.ROOT)) {
            case "ESC", "ESCAPE":
                return KeyPress.ESCAPE;
            case "DEL", "DELETE":
                return KeyPress.DELETE;
            default:
                if (name.length() != 1)
                    throw new IllegalArgumentException("Unknown key name: " + name);
                return Character.toLowerCase(name.charAt(0));
        }
    }
}
