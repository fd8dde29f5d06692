package com.nevis.pdfscan.service;

import com.nevis.pdfscan.config.Backends;
import com.nevis.pdfscan.controller.UploadResponse;
import com.nevis.pdfscan.exception.ErrorKind;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.Metric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs an upload through pending, processing and then completed or failed.
 * <p>
 * Document writes are not transactional with finding writes: findings stored before a failure stay stored.
 */
@Service
@Slf4j
public class DocumentProcessingServiceImpl implements DocumentProcessingService {

    private final Backends backends;
    private final Path tempDirectory;

    public DocumentProcessingServiceImpl(
        Backends backends,
        @Value("${app.processing.temp-dir:${java.io.tmpdir}}") String tempDirectory
    ) {
        this.backends = backends;
        this.tempDirectory = Path.of(tempDirectory);
    }

    @Override
    public UploadResponse processUpload(String filename, long fileSize, byte[] content) {
        return process(filename, fileSize, content).orElseThrow();
    }

    @Override
    public ProcessingOutcome process(String filename, long fileSize, byte[] content) {
        long uploadStarted = System.nanoTime();

        Document document = Document.create(filename, fileSize);
        log.info("Doc {}: received {} ({} bytes)", document.id(), filename, fileSize);

        backends.documents().save(document);
        backends.documents().updateStatus(document.id(), DocumentStatus.PROCESSING, null);

        int findingsCount;
        try (TemporaryPdf pdf = TemporaryPdf.write(tempDirectory, document.id(), content)) {
            long scanStarted = System.nanoTime();
            List<Finding> findings = backends.scanner().scan(pdf.path());
            double scanMs = elapsedMs(scanStarted);

            for (Finding finding : findings) {
                backends.findings().save(finding.withDocumentId(document.id()));
            }
            findingsCount = findings.size();

            backends.documents().updateStatus(document.id(), DocumentStatus.COMPLETED, null);
            backends.metrics().save(Metric.create(Metric.SCAN, scanMs, document.id(), metadata(
                "findings_count", findingsCount,
                "scanner_type", backends.scanner().scannerType().value()
            )));
        } catch (RuntimeException | Error e) {
            return fail(document.id(), e);
        }

        // recorded on success only; a failed run returns above
        backends.metrics().save(Metric.create(Metric.UPLOAD, elapsedMs(uploadStarted), document.id(), metadata(
            "file_size", fileSize,
            "filename", filename
        )));

        Document stored = backends.documents().findById(document.id()).orElse(document);
        log.info("Doc {}: {} with {} findings", document.id(), stored.status().value(), findingsCount);

        return new ProcessingOutcome.Success(new UploadResponse(
            stored.id(),
            filename,
            stored.status(),
            stored.uploadTime(),
            fileSize,
            findingsCount
        ));
    }

    private ProcessingOutcome fail(UUID documentId, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        ErrorKind kind = ErrorKind.classify(error);
        log.error("Doc {}: processing failed ({}): {}", documentId, kind, message, error);

        try {
            backends.documents().updateStatus(documentId, DocumentStatus.FAILED, message);
        } catch (RuntimeException statusError) {
            statusError.addSuppressed(error);
            throw statusError;
        }
        return new ProcessingOutcome.Failure(documentId, kind, message, error);
    }

    private static Map<String, Object> metadata(String key1, Object value1, String key2, Object value2) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(key1, value1);
        metadata.put(key2, value2);
        return metadata;
    }

    private static double elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }
}
