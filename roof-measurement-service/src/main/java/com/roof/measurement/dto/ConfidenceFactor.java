package com.roof.measurement.dto;

/**
 * One signal's contribution to a confidence score.
 *
 * @param impact points added (negative when subtracted)
 */
public record ConfidenceFactor(String name, int impact, String description) {}
