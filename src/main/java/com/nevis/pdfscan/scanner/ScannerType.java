package com.nevis.pdfscan.scanner;

/**
 * Identity tag of a scanner implementation, recorded on scan metrics.
 */
public enum ScannerType {
    REGEX("regex");

    private final String value;

    ScannerType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
