package com.logic.obdd.api;

/** Pointer appearance requested from the render surface. */
public enum CursorStyle {
    NORMAL,
    /** Shown while an edge connection waits for its target. */
    CROSSHAIR
}
