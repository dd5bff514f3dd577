package com.project.image.differences.controller;

import com.project.image.differences.service.ParameterPresets;
import com.project.image.differences.service.ParameterSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes the configured preset table so clients can show the starting values of a tuning panel.
 */
@RestController
@RequestMapping("/api/parameters")
public class ParameterController {
    private static final Logger log = LoggerFactory.getLogger(ParameterController.class);

    private final ParameterSelector parameterSelector;

    public ParameterController(ParameterSelector parameterSelector) {
        this.parameterSelector = parameterSelector;
    }

    @GetMapping("/presets")
    public ParameterPresets presets() {
        log.debug("Serving preset table");
        return parameterSelector.getPresets();
    }
}
