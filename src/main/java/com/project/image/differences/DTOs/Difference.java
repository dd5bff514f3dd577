package com.project.image.differences.DTOs;

/**
 * One clickable difference. Coordinates are normalized: {@code x} by image width, {@code y} by
 * image height and {@code radius} by the shorter image side. {@code foundTime} belongs to the
 * game client and is always {@code null} when produced by the detector.
 */
public record Difference(int id, double x, double y, double radius, Long foundTime) {

    public Difference(int id, double x, double y, double radius) {
        this(id, x, y, radius, null);
    }
}
