package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.model.FindingType;
import com.nevis.pdfscan.service.DocumentService;
import com.nevis.pdfscan.service.FindingService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/findings")
@RequiredArgsConstructor
public class FindingController {

    private final FindingService findingService;
    private final DocumentService documentService;

    @GetMapping("/{documentId}")
    public ResponseEntity<DocumentFindingsResponse> getDocumentFindings(@PathVariable UUID documentId) {
        return ResponseEntity.ok(documentService.getFindings(documentId));
    }

    @GetMapping
    public ResponseEntity<FindingsPageResponse> listFindings(
        @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
        @RequestParam(defaultValue = "0") @Min(0) int offset,
        @RequestParam(name = "finding_type", required = false) FindingType findingType) {

        return ResponseEntity.ok(findingService.list(limit, offset, Optional.ofNullable(findingType)));
    }
}
