package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.exception.UploadProcessingException;
import com.nevis.pdfscan.service.DocumentProcessingService;
import com.nevis.pdfscan.service.DocumentService;
import com.nevis.pdfscan.validation.UploadValidator;
import com.nevis.pdfscan.validation.ValidatedUpload;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentProcessingService processingService;
    private final DocumentService documentService;
    private final UploadValidator uploadValidator;

    @PostMapping("/upload")
    public ResponseEntity<UploadResponse> upload(@RequestParam(name = "file", required = false) MultipartFile file) {
        ValidatedUpload upload = uploadValidator.validateAndRead(file);

        try {
            return ResponseEntity.ok(processingService.processUpload(upload.filename(), upload.size(), upload.content()));
        } catch (RuntimeException e) {
            throw new UploadProcessingException(e);
        }
    }

    @GetMapping("/documents")
    public ResponseEntity<DocumentsPageResponse> listDocuments(
        @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
        @RequestParam(defaultValue = "0") @Min(0) int offset) {

        return ResponseEntity.ok(documentService.list(limit, offset));
    }

    @GetMapping("/documents/{id}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID id) {
        return ResponseEntity.ok(documentService.getById(id));
    }
}
