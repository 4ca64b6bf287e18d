package com.knowledge.extraction.quality;

import java.util.Locale;

/**
 * Raised when a hard quality threshold is crossed. Fatal for the document it names;
 * other documents are unaffected.
 */
public class ThresholdViolation extends RuntimeException {

    private final String documentId;
    private final String thresholdName;
    private final double threshold;
    private final double observed;

    public ThresholdViolation(String documentId, String thresholdName, double threshold, double observed) {
        super(String.format(Locale.ROOT, "Document %s violated %s: observed %.3f, required %.3f",
                documentId, thresholdName, observed, threshold));
        this.documentId = documentId;
        this.thresholdName = thresholdName;
        this.threshold = threshold;
        this.observed = observed;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getThresholdName() {
        return thresholdName;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getObserved() {
        return observed;
    }
}
