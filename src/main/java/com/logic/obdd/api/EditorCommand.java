package com.logic.obdd.api;

/**
 * Commands of the editor's keyboard and button surface.
 *
 * Each command maps one to one onto an interaction state machine event.
 */
public enum EditorCommand {
    ADD_NODE,
    SET_ROOT,
    CONNECT_ZERO,
    CONNECT_ONE,
    DELETE_EDGES,
    DELETE_NODE,
    CANCEL,
    CLEAR_ALL,
    EXPORT,
    IMPORT;

    /**
     * The edge kind a connect command starts, or null for other commands.
     */
    public EdgeKind edgeKind() {
        return switch (this) {
            case CONNECT_ZERO -> EdgeKind.ZERO;
            case CONNECT_ONE -> EdgeKind.ONE;
            default -> null;
        };
    }
}
