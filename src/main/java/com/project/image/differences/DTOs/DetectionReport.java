package com.project.image.differences.DTOs;

import java.util.List;

public record DetectionReport(
        int width,
        int height,
        AnalysisParams params,
        int differencePixelCount,   // mask pixels above the color threshold
        int labeledRegions,         // connected components before filtering
        int filteredRegions,        // after size / aspect / density filters
        int mergedRegions,          // after proximity merging
        List<Difference> differences
) {}
