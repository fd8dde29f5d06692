package com.nevis.pdfscan.scanner;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;

import java.nio.file.Path;
import java.util.List;

/**
 * Extracts sensitive-data findings from a PDF on disk.
 * <p>
 * Implementations do not know which stored document they are scanning: every returned finding
 * carries a placeholder document id that the caller must replace before persisting it.
 */
public interface PdfScanner {

    /**
     * Scans every readable page of the file. A page whose text cannot be extracted is skipped.
     *
     * @param file PDF to scan
     * @return findings in page order
     * @throws com.nevis.pdfscan.exception.PdfNotFoundException   when the file does not exist
     * @throws com.nevis.pdfscan.exception.InvalidPdfException    when the file is not a valid PDF
     * @throws com.nevis.pdfscan.exception.EncryptedPdfException  when the PDF is password-protected
     * @throws com.nevis.pdfscan.exception.PdfProcessingException on any other read failure
     */
    List<Finding> scan(Path file);

    List<FindingType> supportedPatterns();

    ScannerType scannerType();
}
