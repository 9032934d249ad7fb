package com.roof.measurement.algorithm.confidence.factor;

/**
 * Confidence adjustment by number of roof faces.
 */
public enum SegmentCountFactor {
  SIMPLE(4, 5),
  MODERATE(8, 0),
  COMPLEX(12, -5),
  VERY_COMPLEX(Integer.MAX_VALUE, -10);

  private final int maxSegments;
  private final int impact;

  SegmentCountFactor(int maxSegments, int impact) {
    this.maxSegments = maxSegments;
    this.impact = impact;
  }

  public int getImpact() {
    return impact;
  }

  public static SegmentCountFactor fromCount(int segmentCount) {
    for (SegmentCountFactor factor : values()) {
      if (segmentCount <= factor.maxSegments) {
        return factor;
      }
    }
    return VERY_COMPLEX;
  }
}
