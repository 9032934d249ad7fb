package com.roof.measurement.algorithm.confidence.factor;

/**
 * Confidence adjustment by pitch.
 */
public enum PitchFactor {
  FLAT(5.0, 5),
  STANDARD(33.7, 0),
  STEEP(45.0, -5),
  VERY_STEEP(90.0, -15);

  private final double maxDegrees;
  private final int impact;

  PitchFactor(double maxDegrees, int impact) {
    this.maxDegrees = maxDegrees;
    this.impact = impact;
  }

  public int getImpact() {
    return impact;
  }

  public static PitchFactor fromDegrees(double degrees) {
    for (PitchFactor factor : values()) {
      if (degrees <= factor.maxDegrees) {
        return factor;
      }
    }
    return VERY_STEEP;
  }
}
