package com.logic.obdd.engine;

import com.logic.obdd.api.Position;

/**
 * Where the graph places nodes it creates on its own.
 *
 * @param width          canvas width in pixels.
 * @param height         canvas height in pixels.
 * @param newNodeOffset  vertical distance between a selected node and a node
 *                       added while it is selected.
 */
public record CanvasLayout(double width, double height, double newNodeOffset) {

    public static final CanvasLayout DEFAULT = new CanvasLayout(800, 600, 80);

    public CanvasLayout {
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("Canvas size must be positive: " + width + "x" + height);
    }

    /** Terminal "0" sits bottom left. */
    public Position falseTerminal() {
        return new Position(Math.floor(width * 0.2), Math.floor(height * 0.83));
    }

    /** Terminal "1" sits bottom right. */
    public Position trueTerminal() {
        return new Position(Math.floor(width * 0.8), Math.floor(height * 0.83));
    }

    /** Spot for a new node when nothing is selected. */
    public Position newNode() {
        return new Position(Math.floor(width / 2), Math.floor(height / 3));
    }

    /** Spot for a new node added while {@code anchor} is selected. */
    public Position above(Position anchor) {
        return anchor.translate(0, -newNodeOffset);
    }
}
