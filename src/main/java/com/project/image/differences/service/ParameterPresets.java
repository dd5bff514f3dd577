package com.project.image.differences.service;

import com.project.image.differences.DTOs.AnalysisParams;

/**
 * Lookup table from image complexity to analysis parameters. The breakpoints and values are
 * tuned by hand on generated images; they are configuration, not something derived at runtime.
 *
 * @param lowComplexityBreakpoint  complexity below this uses {@code low}
 * @param highComplexityBreakpoint complexity below this (and not below the low one) uses {@code medium}
 */
public record ParameterPresets(
        double lowComplexityBreakpoint,
        double highComplexityBreakpoint,
        AnalysisParams low,
        AnalysisParams medium,
        AnalysisParams high
) {

    public ParameterPresets {
        if (lowComplexityBreakpoint > highComplexityBreakpoint) {
            throw new IllegalArgumentException("Complexity breakpoints out of order: "
                    + lowComplexityBreakpoint + " > " + highComplexityBreakpoint);
        }
        if (low == null || medium == null || high == null) {
            throw new IllegalArgumentException("All three presets must be defined");
        }
    }

    /** Simple cartoons and clean scenes: looser thresholds, larger merge distance. */
    public static final AnalysisParams LOW = new AnalysisParams(
            1, 40, 150, 25, 0.20, 0.1, 10, 0.40, 1.3);

    /** Detailed illustrations, busy rooms. */
    public static final AnalysisParams MEDIUM = new AnalysisParams(
            2, 55, 250, 35, 0.25, 0.1, 10, 0.35, 1.2);

    /** Intricate patterns, heavy foliage: tighter density and size, smaller padding. */
    public static final AnalysisParams HIGH = new AnalysisParams(
            2, 60, 300, 45, 0.28, 0.1, 10, 0.30, 1.15);

    public static ParameterPresets defaults() {
        return new ParameterPresets(0.06, 0.15, LOW, MEDIUM, HIGH);
    }
}
