package com.roof.measurement.algorithm.confidence.factor;

/**
 * Confidence adjustment by imagery age.
 */
public enum ImageryAgeFactor {
  /** Up to one year old */
  CURRENT(1.0, 5),

  /** Up to two years old */
  RECENT(2.0, 0),

  /** Up to three years old */
  AGING(3.0, -5),

  /** Older than three years */
  STALE(Double.MAX_VALUE, -10);

  private final double maxAgeYears;
  private final int impact;

  ImageryAgeFactor(double maxAgeYears, int impact) {
    this.maxAgeYears = maxAgeYears;
    this.impact = impact;
  }

  public int getImpact() {
    return impact;
  }

  public static ImageryAgeFactor fromAgeYears(double ageYears) {
    for (ImageryAgeFactor factor : values()) {
      if (ageYears <= factor.maxAgeYears) {
        return factor;
      }
    }
    return STALE;
  }
}
