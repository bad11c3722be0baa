package com.backend.artscan.exception;

public class IssueReportNotFoundException extends ArtScanException {

    public IssueReportNotFoundException(Long reportId) {
        super("Issue report not found: " + reportId, false);
    }
}
