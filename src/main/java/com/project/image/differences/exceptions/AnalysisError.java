package com.project.image.differences.exceptions;

/** Reasons a detection run can fail. None of them are retried. */
public enum AnalysisError {
    /** The two images differ in width or height. */
    DIMENSION_MISMATCH,
    /** An image has zero width or height. */
    ZERO_DIMENSION,
    /** Pixel data could not be obtained from the supplied image source. */
    SOURCE_UNREADABLE
}
