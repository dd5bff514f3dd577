package com.project.image.differences.config;

import com.project.image.differences.service.GaussianSmoother;
import com.project.image.differences.service.ImageSmoother;
import com.project.image.differences.service.OpenCVSmoother;
import com.project.image.differences.service.ParameterPresets;
import com.project.image.differences.service.ParameterSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the engine collaborators from {@link AnalysisProperties}. */
@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisConfig {
    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    @Bean
    public ParameterSelector parameterSelector(AnalysisProperties properties) {
        ParameterPresets presets = properties.toPresets();
        log.info("Complexity breakpoints: low < {}, high >= {}",
                presets.lowComplexityBreakpoint(), presets.highComplexityBreakpoint());
        return new ParameterSelector(presets);
    }

    @Bean
    public ImageSmoother imageSmoother(AnalysisProperties properties) {
        String kind = properties.smootherOrDefault();
        switch (kind) {
            case AnalysisProperties.GAUSSIAN:
                return new GaussianSmoother();
            case AnalysisProperties.OPENCV:
                log.info("Using OpenCV smoothing backend");
                return new OpenCVSmoother();
            default:
                throw new IllegalArgumentException("Unknown smoother '" + kind + "', expected "
                        + AnalysisProperties.GAUSSIAN + " or " + AnalysisProperties.OPENCV);
        }
    }
}
