package com.roof.measurement.dto;

import java.util.List;

public record ConfidenceResult(int score, ConfidenceLevel level, List<ConfidenceFactor> factors) {

    public ConfidenceResult {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }
}
