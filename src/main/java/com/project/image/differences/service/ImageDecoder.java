package com.project.image.differences.service;

import com.project.image.differences.DTOs.PixelBuffer;
import com.project.image.differences.exceptions.AnalysisError;
import com.project.image.differences.exceptions.DifferenceAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import javax.imageio.ImageIO;

/** Decodes uploaded image files into RGBA buffers the detector can read. */
@Service
public class ImageDecoder {
    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    public PixelBuffer decode(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DifferenceAnalysisException(AnalysisError.SOURCE_UNREADABLE, "Empty upload");
        }
        try (InputStream in = file.getInputStream()) {
            return decode(in, file.getOriginalFilename());
        } catch (IOException e) {
            throw new DifferenceAnalysisException(AnalysisError.SOURCE_UNREADABLE,
                    "Failed to read image " + file.getOriginalFilename(), e);
        }
    }

    public PixelBuffer decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DifferenceAnalysisException(AnalysisError.SOURCE_UNREADABLE, "Empty image data");
        }
        return decode(new ByteArrayInputStream(bytes), "image");
    }

    private PixelBuffer decode(InputStream in, String name) {
        BufferedImage image;
        try {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new DifferenceAnalysisException(AnalysisError.SOURCE_UNREADABLE,
                    "Failed to decode image " + name, e);
        }
        if (image == null) {
            throw new DifferenceAnalysisException(AnalysisError.SOURCE_UNREADABLE,
                    "File " + name + " is not a valid image or is corrupted.");
        }
        log.debug("Image {} decoded: {}x{}", name, image.getWidth(), image.getHeight());
        return toPixelBuffer(image);
    }

    public static PixelBuffer toPixelBuffer(BufferedImage image) {
        final int w = image.getWidth(), h = image.getHeight(), n = w * h;
        int[] argb = new int[n];
        image.getRGB(0, 0, w, h, argb, 0, w);

        byte[] rgba = new byte[n * 4];
        for (int i = 0; i < n; i++) {
            int p = argb[i];
            rgba[4 * i]     = (byte) ((p >> 16) & 0xFF);
            rgba[4 * i + 1] = (byte) ((p >> 8) & 0xFF);
            rgba[4 * i + 2] = (byte) (p & 0xFF);
            rgba[4 * i + 3] = (byte) ((p >>> 24) & 0xFF);
        }
        return new PixelBuffer(w, h, rgba);
    }
}
