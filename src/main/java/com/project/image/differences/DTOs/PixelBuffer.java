package com.project.image.differences.DTOs;

import java.util.Arrays;

/**
 * Decoded RGBA image: {@code width * height * 4} bytes, row-major, one byte per channel.
 * The array is shared with the caller, not copied; the detector never writes to it and
 * smoothing produces a new buffer. Equality compares pixel content.
 */
public record PixelBuffer(int width, int height, byte[] rgba) {

    public PixelBuffer {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative image dimensions: " + width + "x" + height);
        }
        if (rgba == null || rgba.length != width * height * 4) {
            throw new IllegalArgumentException("RGBA buffer length does not match " + width + "x" + height);
        }
    }

    public int pixelCount() {
        return width * height;
    }

    public boolean sameDimensions(PixelBuffer other) {
        return width == other.width && height == other.height;
    }

    public int red(int pixel)   { return rgba[4 * pixel] & 0xFF; }
    public int green(int pixel) { return rgba[4 * pixel + 1] & 0xFF; }
    public int blue(int pixel)  { return rgba[4 * pixel + 2] & 0xFF; }
    public int alpha(int pixel) { return rgba[4 * pixel + 3] & 0xFF; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
