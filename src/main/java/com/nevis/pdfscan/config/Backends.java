package com.nevis.pdfscan.config;

import com.nevis.pdfscan.repository.DocumentRepository;
import com.nevis.pdfscan.repository.FindingRepository;
import com.nevis.pdfscan.repository.MetricsRepository;
import com.nevis.pdfscan.scanner.PdfScanner;

import java.util.Objects;

/**
 * The storage and scanner implementations used by a running process.
 * <p>
 * Built once at startup and shared by every request; each implementation handles its own thread-safety.
 */
public record Backends(
    DocumentRepository documents,
    FindingRepository findings,
    MetricsRepository metrics,
    PdfScanner scanner
) {

    public Backends {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(findings, "findings");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(scanner, "scanner");
    }

    @Override
    public String toString() {
        return "Backends(document=" + documents.getClass().getSimpleName()
            + ", finding=" + findings.getClass().getSimpleName()
            + ", metrics=" + metrics.getClass().getSimpleName()
            + ", scanner=" + scanner.scannerType().value()
            + ")";
    }
}
