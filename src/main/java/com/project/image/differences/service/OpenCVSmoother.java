package com.project.image.differences.service;

import com.project.image.differences.DTOs.PixelBuffer;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gaussian blur through the OpenCV Java bindings. Uses the native library bundled with
 * {@code org.openpnp:opencv}; alpha is blurred with the colour channels but ignored downstream.
 */
public class OpenCVSmoother implements ImageSmoother {
    private static final Logger log = LoggerFactory.getLogger(OpenCVSmoother.class);

    private static volatile boolean loaded;

    /** Loads the bundled native library once; returns whether OpenCV is usable. */
    public static synchronized boolean load() {
        if (loaded) return true;
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV {} loaded successfully", Core.VERSION);
        } catch (Throwable e) {
            log.error("Failed to load OpenCV", e);
        }
        return loaded;
    }

    public OpenCVSmoother() {
        if (!load()) {
            throw new IllegalStateException("OpenCV native library is not available");
        }
    }

    @Override
    public PixelBuffer smooth(PixelBuffer image, int radius) {
        if (radius <= 0 || image.pixelCount() == 0) return image;

        Mat src = new Mat(image.height(), image.width(), CvType.CV_8UC4);
        Mat dst = new Mat();
        try {
            src.put(0, 0, image.rgba());
            Imgproc.GaussianBlur(src, dst, new Size(0, 0), radius, radius, Core.BORDER_REPLICATE);

            byte[] out = new byte[image.rgba().length];
            dst.get(0, 0, out);
            return new PixelBuffer(image.width(), image.height(), out);
        } finally {
            src.release();
            dst.release();
        }
    }
}
