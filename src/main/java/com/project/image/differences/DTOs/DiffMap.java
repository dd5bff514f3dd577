package com.project.image.differences.DTOs;

import java.util.Arrays;

/**
 * Per-pixel difference mask, row-major, plus the number of set pixels. The mask array is not
 * copied; equality compares its content.
 */
public record DiffMap(int width, int height, boolean[] mask, int differencePixelCount) {

    public boolean isEmpty() {
        return differencePixelCount == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiffMap other)) return false;
        return width == other.width && height == other.height
                && differencePixelCount == other.differencePixelCount && Arrays.equals(mask, other.mask);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + differencePixelCount) + Arrays.hashCode(mask);
    }

    @Override
    public String toString() {
        return "DiffMap[" + width + "x" + height + ", differencePixelCount=" + differencePixelCount + "]";
    }
}
