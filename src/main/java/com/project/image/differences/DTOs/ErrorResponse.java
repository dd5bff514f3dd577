package com.project.image.differences.DTOs;

public record ErrorResponse(String error, String message) {}
