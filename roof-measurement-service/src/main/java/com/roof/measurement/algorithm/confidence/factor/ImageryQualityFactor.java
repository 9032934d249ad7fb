package com.roof.measurement.algorithm.confidence.factor;

import com.roof.measurement.dto.ImageryQuality;

/**
 * Confidence adjustment by imagery grade.
 */
public enum ImageryQualityFactor {
  HIGH(10),
  MEDIUM(0),
  LOW(-15),
  UNKNOWN(-10);

  private final int impact;

  ImageryQualityFactor(int impact) {
    this.impact = impact;
  }

  public int getImpact() {
    return impact;
  }

  public static ImageryQualityFactor fromQuality(ImageryQuality quality) {
    return switch (quality) {
      case HIGH -> HIGH;
      case MEDIUM -> MEDIUM;
      case LOW -> LOW;
      case UNKNOWN -> UNKNOWN;
    };
  }
}
