package com.roof.measurement.dto;

/**
 * Static metadata of a measurement tier. Lower tier numbers are expected to be more accurate.
 *
 * @param tierNumber resolution order, 1 first
 * @param name human readable source name
 * @param accuracy expected accuracy band, e.g. "92-95%"
 */
public record TierDescriptor(int tierNumber, String name, String accuracy) {}
