package com.project.image.differences.DTOs;

/**
 * Tuning knobs for one detection run. Everything downstream of the complexity score is
 * driven by these values only.
 *
 * @param blurRadius             Gaussian sigma in pixels applied to both images, 0 disables smoothing
 * @param colorThreshold         minimum Euclidean RGB distance for a pixel to count as different
 * @param minRegionSize          minimum pixel count of a connected region
 * @param mergeDistance          regions whose bounding boxes are closer than this are merged
 * @param minDensity             minimum pixel count / bounding-box area ratio
 * @param minAspectRatio         lower bound of bounding-box width / height
 * @param maxAspectRatio         upper bound of bounding-box width / height
 * @param maxRegionSizePercent   largest allowed box side as a fraction of the shorter image side
 * @param circleRadiusMultiplier padding applied to the bounding-circle radius
 */
public record AnalysisParams(
        int blurRadius,
        double colorThreshold,
        int minRegionSize,
        double mergeDistance,
        double minDensity,
        double minAspectRatio,
        double maxAspectRatio,
        double maxRegionSizePercent,
        double circleRadiusMultiplier
) {

    public AnalysisParams withBlurRadius(int value) {
        return new AnalysisParams(value, colorThreshold, minRegionSize, mergeDistance, minDensity,
                minAspectRatio, maxAspectRatio, maxRegionSizePercent, circleRadiusMultiplier);
    }

    public AnalysisParams withColorThreshold(double value) {
        return new AnalysisParams(blurRadius, value, minRegionSize, mergeDistance, minDensity,
                minAspectRatio, maxAspectRatio, maxRegionSizePercent, circleRadiusMultiplier);
    }

    public AnalysisParams withMinRegionSize(int value) {
        return new AnalysisParams(blurRadius, colorThreshold, value, mergeDistance, minDensity,
                minAspectRatio, maxAspectRatio, maxRegionSizePercent, circleRadiusMultiplier);
    }

    public AnalysisParams withMergeDistance(double value) {
        return new AnalysisParams(blurRadius, colorThreshold, minRegionSize, value, minDensity,
                minAspectRatio, maxAspectRatio, maxRegionSizePercent, circleRadiusMultiplier);
    }

    public AnalysisParams withMinDensity(double value) {
        return new AnalysisParams(blurRadius, colorThreshold, minRegionSize, mergeDistance, value,
                minAspectRatio, maxAspectRatio, maxRegionSizePercent, circleRadiusMultiplier);
    }

    public AnalysisParams withMinAspectRatio(double value) {
        return new AnalysisParams(blurRadius, colorThreshold, minRegionSize, mergeDistance, minDensity,
                value, maxAspectRatio, maxRegionSizePercent, circleRadiusMultiplier);
    }

    public AnalysisParams withMaxAspectRatio(double value) {
        return new AnalysisParams(blurRadius, colorThreshold, minRegionSize, mergeDistance, minDensity,
                minAspectRatio, value, maxRegionSizePercent, circleRadiusMultiplier);
    }

    public AnalysisParams withMaxRegionSizePercent(double value) {
        return new AnalysisParams(blurRadius, colorThreshold, minRegionSize, mergeDistance, minDensity,
                minAspectRatio, maxAspectRatio, value, circleRadiusMultiplier);
    }

    public AnalysisParams withCircleRadiusMultiplier(double value) {
        return new AnalysisParams(blurRadius, colorThreshold, minRegionSize, mergeDistance, minDensity,
                minAspectRatio, maxAspectRatio, maxRegionSizePercent, value);
    }
}
