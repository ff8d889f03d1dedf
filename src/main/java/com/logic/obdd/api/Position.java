package com.logic.obdd.api;

/**
 * A point on the canvas, in canvas pixels.
 */
public record Position(double x, double y) {

    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    /** Vector from {@code other} to this point. */
    public Position minus(Position other) {
        return new Position(x - other.x, y - other.y);
    }

    public double distanceTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public String toString() {
        return "(" + Math.round(x) + ", " + Math.round(y) + ")";
    }
}
