package com.roof.measurement.exception;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String reportId) {
        super("GAF report not found: " + reportId);
    }
}
