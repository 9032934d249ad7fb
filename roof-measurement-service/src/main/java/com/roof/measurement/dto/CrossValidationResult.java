package com.roof.measurement.dto;

import java.util.List;

/**
 * @param finalMeasurement selected candidate
 * @param agreementScore 0 to 100, 100 when all candidates match
 * @param sourceCount number of candidates compared
 * @param discrepancies pairs exceeding the discrepancy threshold
 * @param recommendation narration of the selection
 */
public record CrossValidationResult(
        MeasurementResult finalMeasurement,
        double agreementScore,
        int sourceCount,
        List<Discrepancy> discrepancies,
        String recommendation) {

    public CrossValidationResult {
        discrepancies = discrepancies == null ? List.of() : List.copyOf(discrepancies);
    }

    public boolean hasDiscrepancies() {
        return !discrepancies.isEmpty();
    }
}
