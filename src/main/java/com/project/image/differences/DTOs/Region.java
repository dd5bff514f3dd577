package com.project.image.differences.DTOs;

/** Connected group of differing pixels; bounds are inclusive. */
public record Region(int minX, int maxX, int minY, int maxY, int size) {

    public Region {
        if (size < 1 || minX > maxX || minY > maxY) {
            throw new IllegalArgumentException("Invalid region bounds or size: " + minX + ".." + maxX
                    + ", " + minY + ".." + maxY + ", size=" + size);
        }
    }

    /** Bounding-box width counting both edge pixels. */
    public int width()  { return maxX - minX + 1; }
    public int height() { return maxY - minY + 1; }

    public int boundingArea() {
        return width() * height();
    }

    /** Distance between the two bounding boxes, 0 when they touch or overlap. */
    public double gapTo(Region other) {
        int dx = Math.max(0, Math.max(minX, other.minX) - Math.min(maxX, other.maxX));
        int dy = Math.max(0, Math.max(minY, other.minY) - Math.min(maxY, other.maxY));
        return Math.sqrt((double) dx * dx + (double) dy * dy);
    }

    public Region union(Region other) {
        return new Region(
                Math.min(minX, other.minX), Math.max(maxX, other.maxX),
                Math.min(minY, other.minY), Math.max(maxY, other.maxY),
                size + other.size);
    }
}
