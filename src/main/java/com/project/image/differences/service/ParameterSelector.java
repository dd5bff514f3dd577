package com.project.image.differences.service;

import com.project.image.differences.DTOs.AnalysisParams;

/** Picks one of the three presets for a complexity score. */
public class ParameterSelector {

    public static final String LOW = "low";
    public static final String MEDIUM = "medium";
    public static final String HIGH = "high";

    private final ParameterPresets presets;

    public ParameterSelector(ParameterPresets presets) {
        this.presets = presets;
    }

    public String presetName(double complexity) {
        if (complexity < presets.lowComplexityBreakpoint()) return LOW;
        if (complexity < presets.highComplexityBreakpoint()) return MEDIUM;
        return HIGH;
    }

    public AnalysisParams select(double complexity) {
        switch (presetName(complexity)) {
            case LOW:
                return presets.low();
            case MEDIUM:
                return presets.medium();
            default:
                return presets.high();
        }
    }

    public ParameterPresets getPresets() {
        return presets;
    }
}
