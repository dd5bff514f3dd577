package com.project.image.differences.service;

import com.project.image.differences.DTOs.DiffMap;
import com.project.image.differences.DTOs.PixelBuffer;
import com.project.image.differences.exceptions.AnalysisError;
import com.project.image.differences.exceptions.DifferenceAnalysisException;

/** Smooths both images and marks every pixel whose RGB distance exceeds the threshold. */
public class DiffMapBuilder {

    private final ImageSmoother smoother;

    public DiffMapBuilder(ImageSmoother smoother) {
        this.smoother = smoother;
    }

    public DiffMap build(PixelBuffer original, PixelBuffer modified, int blurRadius, double colorThreshold) {
        checkDimensions(original, modified);

        PixelBuffer a = smoother.smooth(original, blurRadius);
        PixelBuffer b = smoother.smooth(modified, blurRadius);
        return compare(a, b, colorThreshold);
    }

    /** Thresholds the per-pixel Euclidean distance over R, G and B; alpha is ignored. */
    public DiffMap compare(PixelBuffer a, PixelBuffer b, double colorThreshold) {
        checkDimensions(a, b);

        final int n = a.pixelCount();
        final byte[] p = a.rgba(), q = b.rgba();
        boolean[] mask = new boolean[n];
        int count = 0;

        for (int i = 0; i < n; i++) {
            int o = 4 * i;
            int dr = (p[o] & 0xFF) - (q[o] & 0xFF);
            int dg = (p[o + 1] & 0xFF) - (q[o + 1] & 0xFF);
            int db = (p[o + 2] & 0xFF) - (q[o + 2] & 0xFF);
            double distance = Math.sqrt(dr * dr + dg * dg + db * db);
            if (distance > colorThreshold) {
                mask[i] = true;
                count++;
            }
        }
        return new DiffMap(a.width(), a.height(), mask, count);
    }

    static void checkDimensions(PixelBuffer original, PixelBuffer modified) {
        if (original.width() == 0 || original.height() == 0
                || modified.width() == 0 || modified.height() == 0) {
            throw new DifferenceAnalysisException(AnalysisError.ZERO_DIMENSION,
                    "Image dimensions are zero, cannot analyze.");
        }
        if (!original.sameDimensions(modified)) {
            throw new DifferenceAnalysisException(AnalysisError.DIMENSION_MISMATCH,
                    String.format("Image dimensions do not match: %dx%d vs %dx%d",
                            original.width(), original.height(), modified.width(), modified.height()));
        }
    }
}
