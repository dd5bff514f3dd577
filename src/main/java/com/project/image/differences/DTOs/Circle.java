package com.project.image.differences.DTOs;

/** Bounding circle of a region, in pixel space. */
public record Circle(double x, double y, double radius) {

    public boolean overlaps(Circle other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy) < radius + other.radius;
    }
}
