package com.roof.measurement.algorithm.confidence.factor;

/**
 * Confidence adjustment by agreement between independent sources. Weak agreement scores zero.
 */
public enum SourceAgreementFactor {
  EXCELLENT(95.0, 15),
  STRONG(90.0, 10),
  GOOD(80.0, 5),
  WEAK(0.0, 0);

  private final double minAgreement;
  private final int impact;

  SourceAgreementFactor(double minAgreement, int impact) {
    this.minAgreement = minAgreement;
    this.impact = impact;
  }

  public int getImpact() {
    return impact;
  }

  public static SourceAgreementFactor fromAgreement(double agreementPercent) {
    for (SourceAgreementFactor factor : values()) {
      if (agreementPercent >= factor.minAgreement) {
        return factor;
      }
    }
    return WEAK;
  }
}
