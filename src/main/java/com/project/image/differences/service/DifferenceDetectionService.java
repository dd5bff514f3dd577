package com.project.image.differences.service;

import com.project.image.differences.DTOs.AnalysisParams;
import com.project.image.differences.DTOs.DetectionReport;
import com.project.image.differences.DTOs.DiffMap;
import com.project.image.differences.DTOs.Difference;
import com.project.image.differences.DTOs.ParameterSuggestion;
import com.project.image.differences.DTOs.PixelBuffer;
import com.project.image.differences.DTOs.Region;
import com.project.image.differences.exceptions.AnalysisError;
import com.project.image.differences.exceptions.DifferenceAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point of the detection engine. Every call is synchronous and self-contained: working
 * buffers are allocated per call and nothing is shared, so one instance can serve many threads.
 */
@Service
public class DifferenceDetectionService {
    private static final Logger log = LoggerFactory.getLogger(DifferenceDetectionService.class);

    private final ComplexityScorer complexityScorer = new ComplexityScorer();
    private final ParameterSelector parameterSelector;
    private final DiffMapBuilder diffMapBuilder;
    private final RegionLabeler regionLabeler = new RegionLabeler();
    private final RegionFilter regionFilter = new RegionFilter();
    private final RegionMerger regionMerger = new RegionMerger();
    private final CircleResolver circleResolver = new CircleResolver();

    @Autowired
    public DifferenceDetectionService(ImageSmoother smoother, ParameterSelector parameterSelector) {
        this.diffMapBuilder = new DiffMapBuilder(smoother);
        this.parameterSelector = parameterSelector;
    }

    /** Pure-Java smoothing and the built-in presets. */
    public DifferenceDetectionService() {
        this(new GaussianSmoother(), new ParameterSelector(ParameterPresets.defaults()));
    }

    public List<Difference> detect(PixelBuffer original, PixelBuffer modified, AnalysisParams params) {
        return analyze(original, modified, params).differences();
    }

    /** Same as {@link #detect} but also reports how many regions survived each stage. */
    public DetectionReport analyze(PixelBuffer original, PixelBuffer modified, AnalysisParams params) {
        if (original == null || modified == null) {
            throw new DifferenceAnalysisException(AnalysisError.SOURCE_UNREADABLE, "Both images are required.");
        }
        if (params == null) {
            throw new IllegalArgumentException("Analysis parameters are required");
        }

        log.info("Starting difference detection for images {}x{}", original.width(), original.height());
        final int w = original.width(), h = original.height();

        DiffMap diffMap = diffMapBuilder.build(original, modified, params.blurRadius(), params.colorThreshold());
        log.debug("Difference pixels above threshold {}: {}", params.colorThreshold(), diffMap.differencePixelCount());

        if (diffMap.isEmpty()) {
            log.info("No differing pixels found");
            return new DetectionReport(w, h, params, 0, 0, 0, 0, List.of());
        }

        List<Region> labeled = regionLabeler.label(diffMap);
        List<Region> filtered = regionFilter.filter(labeled, params);
        List<Region> merged = regionMerger.merge(filtered, params.mergeDistance());
        log.debug("Regions: {} labeled, {} after filtering, {} after merging",
                labeled.size(), filtered.size(), merged.size());

        List<Difference> differences = circleResolver.resolve(merged, params, w, h);
        log.info("{} final differences found", differences.size());

        return new DetectionReport(w, h, params, diffMap.differencePixelCount(),
                labeled.size(), filtered.size(), merged.size(), List.copyOf(differences));
    }

    public ParameterSuggestion suggestParameters(PixelBuffer image) {
        if (image == null) {
            throw new DifferenceAnalysisException(AnalysisError.SOURCE_UNREADABLE, "An image is required.");
        }
        if (image.width() == 0 || image.height() == 0) {
            throw new DifferenceAnalysisException(AnalysisError.ZERO_DIMENSION,
                    "Image dimensions are zero, cannot analyze.");
        }

        double complexity = complexityScorer.score(image);
        String preset = parameterSelector.presetName(complexity);
        log.debug("Image complexity {} -> {} preset", String.format("%.4f", complexity), preset);

        return new ParameterSuggestion(complexity, preset, parameterSelector.select(complexity));
    }
}
