package com.project.image.differences.service;

import com.project.image.differences.DTOs.AnalysisParams;
import com.project.image.differences.DTOs.Region;

import java.util.ArrayList;
import java.util.List;

/** Drops regions that look like noise rather than a deliberate change. */
public class RegionFilter {

    /**
     * Regions larger than {@code minRegionSize * LARGE_REGION_FACTOR} skip the density test:
     * big sparse changes are kept rather than treated as noise.
     */
    public static final int LARGE_REGION_FACTOR = 10;

    public List<Region> filter(List<Region> regions, AnalysisParams params) {
        List<Region> kept = new ArrayList<>(regions.size());
        for (Region region : regions) {
            if (isLargeEnough(region, params)
                    && hasAcceptableAspectRatio(region, params)
                    && isDenseEnough(region, params)) {
                kept.add(region);
            }
        }
        return kept;
    }

    static boolean isLargeEnough(Region region, AnalysisParams params) {
        return region.size() >= params.minRegionSize();
    }

    static boolean hasAcceptableAspectRatio(Region region, AnalysisParams params) {
        double aspect = region.width() / (double) region.height();
        return aspect >= params.minAspectRatio() && aspect <= params.maxAspectRatio();
    }

    static boolean isDenseEnough(Region region, AnalysisParams params) {
        int area = region.boundingArea();
        if (area <= 0) return false;

        boolean veryLarge = region.size() > (long) params.minRegionSize() * LARGE_REGION_FACTOR;
        double density = region.size() / (double) area;
        return veryLarge || density >= params.minDensity();
    }
}
