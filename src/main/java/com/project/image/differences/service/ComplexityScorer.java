package com.project.image.differences.service;

import com.project.image.differences.DTOs.PixelBuffer;

/**
 * Cheap "how busy is this picture" heuristic: the share of interior pixels whose brightness
 * jumps sharply towards the right or lower neighbour.
 */
public class ComplexityScorer {

    /** Brightness step (0-255 scale) above which a pixel counts as an edge. */
    static final double EDGE_THRESHOLD = 25.0;

    /**
     * @return edge pixels / interior pixels, where the interior excludes a one pixel border;
     *         0 for images that have no interior
     */
    public double score(PixelBuffer image) {
        final int w = image.width(), h = image.height();
        if (w < 3 || h < 3) return 0.0;

        int edgeCount = 0;
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int idx = y * w + x;
                double current = brightness(image, idx);
                double right   = brightness(image, idx + 1);
                double below   = brightness(image, idx + w);

                if (Math.abs(current - right) > EDGE_THRESHOLD || Math.abs(current - below) > EDGE_THRESHOLD) {
                    edgeCount++;
                }
            }
        }
        long interior = (long) (w - 2) * (h - 2);
        return edgeCount / (double) interior;
    }

    private static double brightness(PixelBuffer image, int pixel) {
        return (image.red(pixel) + image.green(pixel) + image.blue(pixel)) / 3.0;
    }
}
