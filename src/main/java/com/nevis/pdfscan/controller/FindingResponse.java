package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;

import java.util.UUID;

public record FindingResponse(
    UUID id,
    FindingType type,
    String location,
    double confidence
) {

    public static FindingResponse from(Finding finding) {
        return new FindingResponse(finding.id(), finding.findingType(), finding.location(), finding.confidence());
    }
}
