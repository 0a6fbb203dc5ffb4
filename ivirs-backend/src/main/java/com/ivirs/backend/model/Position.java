package com.ivirs.backend.model;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Planar coordinate in simulation distance units (metres on the highway scenario).
 */
@Value
public class Position {

    double x;
    double y;

    public double distanceTo(Position other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public Position offset(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    /** [x, y] form used by the structured telemetry records. */
    public List<Double> toList() {
        return Arrays.asList(x, y);
    }
}
