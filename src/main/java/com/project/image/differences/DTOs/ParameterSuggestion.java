package com.project.image.differences.DTOs;

/** Adaptive starting point for a detection run, derived from one image. */
public record ParameterSuggestion(double complexity, String preset, AnalysisParams params) {}
