package com.backend.artscan.exception;

public class ScanCancelledException extends ArtScanException {

    public ScanCancelledException(String stage) {
        super("Scan cancelled before " + stage, true);
    }
}
