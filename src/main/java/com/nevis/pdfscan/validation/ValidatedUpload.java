package com.nevis.pdfscan.validation;

public record ValidatedUpload(String filename, byte[] content) {

    public long size() {
        return content.length;
    }
}
