package com.forecastmind.core.model;

/**
 * Thrown when a forecast is requested with a preset id that is not defined.
 */
public class UnknownPresetException extends RuntimeException {
    public UnknownPresetException(String presetId) {
        super("Unknown preset: " + presetId);
    }
}
