package com.backend.artscan.exception;

public class AnalysisUnavailableException extends ArtScanException {

    public AnalysisUnavailableException(String message) {
        super(message, true);
    }

    public AnalysisUnavailableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
