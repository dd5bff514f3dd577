package com.project.image.differences.service;

import com.project.image.differences.DTOs.PixelBuffer;

/**
 * Separable Gaussian blur with sigma equal to the radius, computed in plain Java.
 * Edges are clamped; alpha is copied through unchanged.
 */
public class GaussianSmoother implements ImageSmoother {

    @Override
    public PixelBuffer smooth(PixelBuffer image, int radius) {
        if (radius <= 0 || image.pixelCount() == 0) return image;

        final int w = image.width(), h = image.height();
        final float[] kernel = kernel(radius);
        final int half = kernel.length / 2;
        final byte[] src = image.rgba();

        // horizontal pass into float buffer, 3 channels per pixel
        float[] tmp = new float[w * h * 3];
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                float r = 0, g = 0, b = 0;
                for (int k = -half; k <= half; k++) {
                    int xx = clamp(x + k, w);
                    int s = 4 * (row + xx);
                    float wk = kernel[k + half];
                    r += wk * (src[s] & 0xFF);
                    g += wk * (src[s + 1] & 0xFF);
                    b += wk * (src[s + 2] & 0xFF);
                }
                int t = 3 * (row + x);
                tmp[t] = r; tmp[t + 1] = g; tmp[t + 2] = b;
            }
        }

        // vertical pass back to bytes
        byte[] out = new byte[src.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float r = 0, g = 0, b = 0;
                for (int k = -half; k <= half; k++) {
                    int yy = clamp(y + k, h);
                    int t = 3 * (yy * w + x);
                    float wk = kernel[k + half];
                    r += wk * tmp[t];
                    g += wk * tmp[t + 1];
                    b += wk * tmp[t + 2];
                }
                int d = 4 * (y * w + x);
                out[d]     = toByte(r);
                out[d + 1] = toByte(g);
                out[d + 2] = toByte(b);
                out[d + 3] = src[d + 3];
            }
        }
        return new PixelBuffer(w, h, out);
    }

    /** Normalized 1-D kernel of half-width ceil(3 * sigma). */
    static float[] kernel(int sigma) {
        int half = (int) Math.ceil(3.0 * sigma);
        float[] k = new float[2 * half + 1];
        double twoSigmaSq = 2.0 * sigma * sigma;
        double sum = 0;
        for (int i = -half; i <= half; i++) {
            double v = Math.exp(-(i * i) / twoSigmaSq);
            k[i + half] = (float) v;
            sum += v;
        }
        for (int i = 0; i < k.length; i++) {
            k[i] = (float) (k[i] / sum);
        }
        return k;
    }

    private static int clamp(int v, int size) {
        return (v < 0) ? 0 : Math.min(size - 1, v);
    }

    private static byte toByte(float v) {
        int i = Math.round(v);
        return (byte) ((i < 0) ? 0 : Math.min(255, i));
    }
}
