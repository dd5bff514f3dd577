package com.project.image.differences.controller;

import com.project.image.differences.DTOs.AnalysisParams;
import com.project.image.differences.DTOs.DetectionReport;
import com.project.image.differences.DTOs.ParameterSuggestion;
import com.project.image.differences.DTOs.PixelBuffer;
import com.project.image.differences.service.DifferenceDetectionService;
import com.project.image.differences.service.ImageDecoder;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api")
@Validated
public class DifferenceController {
    private static final Logger log = LoggerFactory.getLogger(DifferenceController.class);

    static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp"
    );
    static final long MAX_UPLOAD_BYTES = 10L * 1024 * 1024;

    private final DifferenceDetectionService detectionService;
    private final ImageDecoder imageDecoder;

    public DifferenceController(DifferenceDetectionService detectionService, ImageDecoder imageDecoder) {
        this.detectionService = detectionService;
        this.imageDecoder = imageDecoder;
    }

    /**
     * Finds the differences between two uploaded images. Tuning parameters that are not sent
     * are taken from the adaptive suggestion for the original image.
     */
    @PostMapping(value = "/differences", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public DetectionReport detect(
            @RequestParam("original") @NotNull MultipartFile original,
            @RequestParam("modified") @NotNull MultipartFile modified,
            @RequestParam(name = "blurRadius", required = false) @Min(0) @Max(5) Integer blurRadius,
            @RequestParam(name = "colorThreshold", required = false) @DecimalMin("0") @DecimalMax("442") Double colorThreshold,
            @RequestParam(name = "minRegionSize", required = false) @Min(1) @Max(1000) Integer minRegionSize,
            @RequestParam(name = "mergeDistance", required = false) @DecimalMin("0") @DecimalMax("1000") Double mergeDistance,
            @RequestParam(name = "minDensity", required = false) @DecimalMin("0") @DecimalMax("1") Double minDensity,
            @RequestParam(name = "minAspectRatio", required = false) @DecimalMin("0.01") @DecimalMax("1") Double minAspectRatio,
            @RequestParam(name = "maxAspectRatio", required = false) @DecimalMin("1") @DecimalMax("20") Double maxAspectRatio,
            @RequestParam(name = "maxRegionSizePercent", required = false) @DecimalMin("0.05") @DecimalMax("1") Double maxRegionSizePercent,
            @RequestParam(name = "circleRadiusMultiplier", required = false) @DecimalMin("1") @DecimalMax("2") Double circleRadiusMultiplier
    ) {
        validateUploadedFile(original);
        validateUploadedFile(modified);

        log.info("Processing pair: {} ({}KB) / {} ({}KB)",
                original.getOriginalFilename(), original.getSize() / 1024,
                modified.getOriginalFilename(), modified.getSize() / 1024);

        PixelBuffer originalPixels = imageDecoder.decode(original);
        PixelBuffer modifiedPixels = imageDecoder.decode(modified);

        AnalysisParams params = detectionService.suggestParameters(originalPixels).params();
        if (blurRadius != null) params = params.withBlurRadius(blurRadius);
        if (colorThreshold != null) params = params.withColorThreshold(colorThreshold);
        if (minRegionSize != null) params = params.withMinRegionSize(minRegionSize);
        if (mergeDistance != null) params = params.withMergeDistance(mergeDistance);
        if (minDensity != null) params = params.withMinDensity(minDensity);
        if (minAspectRatio != null) params = params.withMinAspectRatio(minAspectRatio);
        if (maxAspectRatio != null) params = params.withMaxAspectRatio(maxAspectRatio);
        if (maxRegionSizePercent != null) params = params.withMaxRegionSizePercent(maxRegionSizePercent);
        if (circleRadiusMultiplier != null) params = params.withCircleRadiusMultiplier(circleRadiusMultiplier);
        log.debug("Effective parameters: {}", params);

        DetectionReport report = detectionService.analyze(originalPixels, modifiedPixels, params);
        log.info("Detection completed with {} differences", report.differences().size());
        return report;
    }

    @PostMapping(value = "/parameters/suggest", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ParameterSuggestion suggest(@RequestParam("image") @NotNull MultipartFile image) {
        validateUploadedFile(image);
        ParameterSuggestion suggestion = detectionService.suggestParameters(imageDecoder.decode(image));
        log.info("Suggested {} preset for {} (complexity {})",
                suggestion.preset(), image.getOriginalFilename(), String.format("%.4f", suggestion.complexity()));
        return suggestion;
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please select an image to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                    "Unsupported file type: " + contentType +
                            ". Supported types: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new MaxUploadSizeExceededException(MAX_UPLOAD_BYTES);
        }
    }
}
