package com.project.image.differences.service;

import com.project.image.differences.DTOs.PixelBuffer;

/** Low-pass filter applied to each image before pixels are compared. */
public interface ImageSmoother {

    /**
     * @param image  source buffer, left untouched
     * @param radius blur strength in pixels; 0 means no smoothing
     * @return a smoothed buffer of the same dimensions
     */
    PixelBuffer smooth(PixelBuffer image, int radius);
}
