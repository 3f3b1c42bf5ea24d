package org.bpmnml.generator;

/**
 * Axis-aligned box in diagram coordinates.
 */
public record Bounds(int x, int y, int width, int height) {

    public Waypoint center() {
        return new Waypoint(
                (int) Math.round(x + width / 2.0),
                (int) Math.round(y + height / 2.0));
    }

    public Bounds union(Bounds other) {
        int minX = Math.min(x, other.x);
        int minY = Math.min(y, other.y);
        int maxX = Math.max(x + width, other.x + other.width);
        int maxY = Math.max(y + height, other.y + other.height);
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }

    public Bounds expand(int padding) {
        return new Bounds(x - padding, y - padding, width + 2 * padding, height + 2 * padding);
    }
}
