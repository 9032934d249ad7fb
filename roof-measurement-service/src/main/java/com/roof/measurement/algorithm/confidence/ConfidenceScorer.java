package com.roof.measurement.algorithm.confidence;

import com.roof.measurement.algorithm.confidence.factor.ImageryAgeFactor;
import com.roof.measurement.algorithm.confidence.factor.ImageryQualityFactor;
import com.roof.measurement.algorithm.confidence.factor.PitchFactor;
import com.roof.measurement.algorithm.confidence.factor.SegmentCountFactor;
import com.roof.measurement.algorithm.confidence.factor.SourceAgreementFactor;
import com.roof.measurement.dto.ConfidenceFactor;
import com.roof.measurement.dto.ConfidenceLevel;
import com.roof.measurement.dto.ConfidenceResult;
import com.roof.measurement.dto.ConfidenceSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns measurement quality signals into a 0-100 confidence score and level.
 *
 * <p>Scoring starts from a baseline (70, or 85 for user-traced input) and applies one adjustment
 * per signal, clamping to [0, 100] after each step:
 *
 * <ul>
 *   <li>calibration: +25 for an exact report match, otherwise +10 for regional calibration
 *   <li>LiDAR data: +20
 *   <li>imagery grade, imagery age, roof faces and pitch: see the factor enums
 *   <li>agreement between sources, only when more than one source was compared
 * </ul>
 *
 * <p>A single source without LiDAR and without an exact calibration match is capped at 85.
 *
 * <p>Every adjustment is non-decreasing in its signal and clamping is monotone, so adding
 * corroborating evidence never lowers the score. The scorer holds no state.
 */
@Component
public class ConfidenceScorer {

  private static final Logger logger = LoggerFactory.getLogger(ConfidenceScorer.class);

  static final int DEFAULT_BASELINE = 70;
  static final int MANUAL_BASELINE = 85;
  static final int EXACT_CALIBRATION_BONUS = 25;
  static final int REGIONAL_CALIBRATION_BONUS = 10;
  static final int LIDAR_BONUS = 20;
  static final int SINGLE_SOURCE_CAP = 85;

  private static final int MIN_SCORE = 0;
  private static final int MAX_SCORE = 100;

  /**
   * Scores a signal set. Identical input always yields identical output.
   *
   * @param signals quality signals of the measurement
   * @return score, level and the factors that produced it
   */
  public ConfidenceResult score(ConfidenceSignals signals) {
    List<ConfidenceFactor> factors = new ArrayList<>();

    int score = signals.manualInput() ? MANUAL_BASELINE : DEFAULT_BASELINE;
    factors.add(new ConfidenceFactor("Baseline", score,
        signals.manualInput() ? "User-traced measurement" : "Automated measurement"));

    if (signals.exactCalibration()) {
      score = apply(score, EXACT_CALIBRATION_BONUS, "Calibration",
          "Verified report exists for this building", factors);
    } else if (signals.hasCalibration()) {
      score = apply(score, REGIONAL_CALIBRATION_BONUS, "Calibration",
          "Regional calibration from nearby verified reports", factors);
    }

    if (signals.lidarData()) {
      score = apply(score, LIDAR_BONUS, "LiDAR", "Measured from LiDAR elevation data", factors);
    }

    if (signals.imageryQuality() != null) {
      ImageryQualityFactor quality = ImageryQualityFactor.fromQuality(signals.imageryQuality());
      score = apply(score, quality.getImpact(), "Imagery quality",
          signals.imageryQuality() + " quality imagery", factors);
    }

    if (signals.imageryAgeYears() != null) {
      ImageryAgeFactor age = ImageryAgeFactor.fromAgeYears(signals.imageryAgeYears());
      score = apply(score, age.getImpact(), "Imagery age",
          String.format(Locale.ROOT, "Imagery is %.1f year(s) old", signals.imageryAgeYears()), factors);
    }

    if (signals.segmentCount() > 0) {
      SegmentCountFactor segments = SegmentCountFactor.fromCount(signals.segmentCount());
      score = apply(score, segments.getImpact(), "Roof complexity",
          signals.segmentCount() + " roof segment(s)", factors);
    }

    PitchFactor pitch = PitchFactor.fromDegrees(signals.pitchDegrees());
    score = apply(score, pitch.getImpact(), "Pitch",
        String.format(Locale.ROOT, "%.1f° pitch", signals.pitchDegrees()), factors);

    if (signals.sourceCount() > 1 && signals.sourceAgreement() != null) {
      SourceAgreementFactor agreement = SourceAgreementFactor.fromAgreement(signals.sourceAgreement());
      score = apply(score, agreement.getImpact(), "Source agreement",
          String.format(Locale.ROOT, "%d sources agree to %.1f%%", signals.sourceCount(), signals.sourceAgreement()),
          factors);
    }

    boolean corroborated = signals.sourceCount() > 1 || signals.lidarData() || signals.exactCalibration();
    if (!corroborated && score > SINGLE_SOURCE_CAP) {
      factors.add(new ConfidenceFactor("Single source", SINGLE_SOURCE_CAP - score,
          "Uncorroborated single-source measurement is capped at " + SINGLE_SOURCE_CAP));
      score = SINGLE_SOURCE_CAP;
    }

    ConfidenceLevel level = ConfidenceLevel.fromScore(score);
    logger.debug("Confidence score {} ({}) from {} factor(s)", score, level, factors.size());
    return new ConfidenceResult(score, level, factors);
  }

  private static int apply(int score, int impact, String name, String description,
      List<ConfidenceFactor> factors) {
    int updated = Math.max(MIN_SCORE, Math.min(MAX_SCORE, score + impact));
    factors.add(new ConfidenceFactor(name, updated - score, description));
    return updated;
  }
}
