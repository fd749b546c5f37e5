package com.telcobright.searchagg.stats;

/**
 * A single measure could not be computed for a single segment.
 * The query keeps going; the error is recorded for the caller to report.
 */
public class MeasureEvaluationException extends Exception {

    private final String measureId;

    public MeasureEvaluationException(String measureId, String message) {
        super(message);
        this.measureId = measureId;
    }

    public MeasureEvaluationException(String measureId, String message, Throwable cause) {
        super(message, cause);
        this.measureId = measureId;
    }

    public String getMeasureId() {
        return measureId;
    }
}
