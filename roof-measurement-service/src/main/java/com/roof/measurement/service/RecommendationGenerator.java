package com.roof.measurement.service;

import com.roof.measurement.dto.ConfidenceLevel;
import com.roof.measurement.dto.ConfidenceResult;
import com.roof.measurement.dto.CrossValidationResult;
import com.roof.measurement.dto.GafCalibrationResult;
import com.roof.measurement.dto.TierFailure;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic advice text for a measurement report.
 */
@Component
public class RecommendationGenerator {

    static final String UPLOAD_REPORT = "Upload a historical GAF report for this address to improve accuracy.";
    static final String PROFESSIONAL_MEASUREMENT = "Consider requesting a professional roof measurement.";
    static final String UPLOAD_FOR_GAF_CONFIDENCE = "Upload a GAF report to achieve GAF-level confidence.";
    static final String REVIEW_DISCREPANCIES = "Review measurement discrepancies before finalizing quote.";
    static final String USE_MANUAL_TRACING =
        "Use the manual tracing tool to outline the roof for more accurate measurements.";

    public List<String> generate(CrossValidationResult crossValidation, ConfidenceResult confidence,
            GafCalibrationResult calibration, List<TierFailure> higherTierFailures) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add(crossValidation.recommendation());

        if (confidence.level() == ConfidenceLevel.LOW) {
            recommendations.add(UPLOAD_REPORT);
            recommendations.add(PROFESSIONAL_MEASUREMENT);
        } else if (confidence.level() == ConfidenceLevel.MODERATE && calibration == null) {
            recommendations.add(UPLOAD_FOR_GAF_CONFIDENCE);
        }

        if (crossValidation.hasDiscrepancies()) {
            recommendations.add(REVIEW_DISCREPANCIES);
        }

        if (higherTierFailures != null && !higherTierFailures.isEmpty() && confidence.level() != ConfidenceLevel.HIGH) {
            TierFailure best = higherTierFailures.get(0);
            recommendations.add("A more accurate source (" + best.tierName() + ") was unavailable: "
                + best.reason() + ".");
        }
        return recommendations;
    }

    /**
     * Advice when no automated source produced a measurement.
     */
    public List<String> manualTracingRequired(List<TierFailure> failures) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add("No automated measurement source was available for this location ("
            + failures.size() + " source(s) tried).");
        recommendations.add(USE_MANUAL_TRACING);
        recommendations.add(UPLOAD_REPORT);
        return recommendations;
    }
}
