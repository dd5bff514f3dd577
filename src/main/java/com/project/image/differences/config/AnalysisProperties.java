package com.project.image.differences.config;

import com.project.image.differences.DTOs.AnalysisParams;
import com.project.image.differences.service.ParameterPresets;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

/**
 * Externalized preset table ({@code app.analysis.*}). Anything left unset, down to a single
 * field of a preset, falls back to {@link ParameterPresets#defaults()}.
 */
@ConfigurationProperties(prefix = "app.analysis")
public record AnalysisProperties(
        Double lowComplexityBreakpoint,
        Double highComplexityBreakpoint,
        Preset low,
        Preset medium,
        Preset high,
        String smoother
) {

    public static final String GAUSSIAN = "gaussian";
    public static final String OPENCV = "opencv";

    /** One preset as configured; {@code null} fields keep the built-in value. */
    public record Preset(
            Integer blurRadius,
            Double colorThreshold,
            Integer minRegionSize,
            Double mergeDistance,
            Double minDensity,
            Double minAspectRatio,
            Double maxAspectRatio,
            Double maxRegionSizePercent,
            Double circleRadiusMultiplier
    ) {

        public AnalysisParams over(AnalysisParams base) {
            return new AnalysisParams(
                    blurRadius != null ? blurRadius : base.blurRadius(),
                    colorThreshold != null ? colorThreshold : base.colorThreshold(),
                    minRegionSize != null ? minRegionSize : base.minRegionSize(),
                    mergeDistance != null ? mergeDistance : base.mergeDistance(),
                    minDensity != null ? minDensity : base.minDensity(),
                    minAspectRatio != null ? minAspectRatio : base.minAspectRatio(),
                    maxAspectRatio != null ? maxAspectRatio : base.maxAspectRatio(),
                    maxRegionSizePercent != null ? maxRegionSizePercent : base.maxRegionSizePercent(),
                    circleRadiusMultiplier != null ? circleRadiusMultiplier : base.circleRadiusMultiplier());
        }
    }

    public ParameterPresets toPresets() {
        ParameterPresets d = ParameterPresets.defaults();
        return new ParameterPresets(
                lowComplexityBreakpoint != null ? lowComplexityBreakpoint : d.lowComplexityBreakpoint(),
                highComplexityBreakpoint != null ? highComplexityBreakpoint : d.highComplexityBreakpoint(),
                low != null ? low.over(d.low()) : d.low(),
                medium != null ? medium.over(d.medium()) : d.medium(),
                high != null ? high.over(d.high()) : d.high());
    }

    public String smootherOrDefault() {
        return (smoother == null || smoother.isBlank()) ? GAUSSIAN : smoother.trim().toLowerCase(Locale.ROOT);
    }
}
