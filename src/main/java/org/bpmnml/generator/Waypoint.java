package org.bpmnml.generator;

public record Waypoint(int x, int y) {

    public static final Waypoint ORIGIN = new Waypoint(0, 0);
}
