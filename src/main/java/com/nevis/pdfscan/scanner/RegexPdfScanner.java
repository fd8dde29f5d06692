package com.nevis.pdfscan.scanner;

import com.nevis.pdfscan.exception.EncryptedPdfException;
import com.nevis.pdfscan.exception.InvalidPdfException;
import com.nevis.pdfscan.exception.PdfNotFoundException;
import com.nevis.pdfscan.exception.PdfProcessingException;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scanner that matches fixed regular expressions against the text of each PDF page.
 * A pattern match is certain, so every finding has confidence 1.0.
 */
@Slf4j
public class RegexPdfScanner implements PdfScanner {

    static final double MATCH_CONFIDENCE = 1.0;

    private static final Map<FindingType, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(FindingType.SSN, Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"));
        PATTERNS.put(FindingType.EMAIL, Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"));
    }

    @Override
    public List<Finding> scan(Path file) {
        if (file == null || !Files.exists(file)) {
            throw new PdfNotFoundException(file);
        }

        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            if (document.isEncrypted()) {
                throw new EncryptedPdfException();
            }
            return scanPages(document);
        } catch (InvalidPasswordException e) {
            throw new EncryptedPdfException(e);
        } catch (IOException e) {
            throw new InvalidPdfException("Invalid or corrupt PDF file: " + file, e);
        } catch (EncryptedPdfException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PdfProcessingException("Failed to process PDF: " + e.getMessage(), e);
        }
    }

    private List<Finding> scanPages(PDDocument document) {
        List<Finding> findings = new ArrayList<>();
        int totalPages = document.getNumberOfPages();
        log.debug("Scanning {} pages", totalPages);

        for (int page = 1; page <= totalPages; page++) {
            String text;
            try {
                PDFTextStripper stripper = new PDFTextStripper();
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                text = stripper.getText(document);
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable page {}: {}", page, e.getMessage());
                continue;
            }

            if (text == null || text.isBlank()) {
                continue;
            }
            findings.addAll(match(text, page));
        }
        return findings;
    }

    private List<Finding> match(String text, int page) {
        List<Finding> findings = new ArrayList<>();
        String location = "page " + page;

        PATTERNS.forEach((type, pattern) -> {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                // the document id is a placeholder, the caller assigns the real one
                findings.add(Finding.create(UUID.randomUUID(), type, location, MATCH_CONFIDENCE));
            }
        });
        return findings;
    }

    @Override
    public List<FindingType> supportedPatterns() {
        return List.copyOf(PATTERNS.keySet());
    }

    @Override
    public ScannerType scannerType() {
        return ScannerType.REGEX;
    }
}
