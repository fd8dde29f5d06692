package com.nevis.pdfscan.scanner;

import com.nevis.pdfscan.exception.EncryptedPdfException;
import com.nevis.pdfscan.exception.InvalidPdfException;
import com.nevis.pdfscan.exception.PdfNotFoundException;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegexPdfScannerTest {

    private final RegexPdfScanner scanner = new RegexPdfScanner();

    @TempDir
    Path tempDir;

    private Path write(String name, byte[] content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content);
        return file;
    }

    @Test
    @DisplayName("One SSN and one email on page 1 should yield exactly two findings")
    void scan_ShouldFindSsnAndEmail() throws IOException {
        Path file = write("pii.pdf", PdfFixtures.pdf(List.of(List.of("SSN: 123-45-6789", "email: a@b.com"))));

        List<Finding> findings = scanner.scan(file);

        assertThat(findings).hasSize(2);
        assertThat(findings).extracting(Finding::findingType)
            .containsExactlyInAnyOrder(FindingType.SSN, FindingType.EMAIL);
        assertThat(findings).allSatisfy(finding -> {
            assertThat(finding.location()).isEqualTo("page 1");
            assertThat(finding.confidence()).isEqualTo(1.0);
        });
    }

    @Test
    @DisplayName("Locations should name the 1-based page of each match")
    void scan_ShouldReportPagePerMatch() throws IOException {
        Path file = write("pages.pdf", PdfFixtures.pdf(List.of(
            List.of("Nothing sensitive here"),
            List.of("Contact: jane.doe@example.org"),
            List.of("ID 987-65-4321 and 111-22-3333")
        )));

        List<Finding> findings = scanner.scan(file);

        assertThat(findings).extracting(Finding::location)
            .containsExactly("page 2", "page 3", "page 3");
        assertThat(findings).extracting(Finding::findingType)
            .containsExactly(FindingType.EMAIL, FindingType.SSN, FindingType.SSN);
    }

    @Test
    @DisplayName("Each finding should carry its own placeholder document id")
    void scan_ShouldAssignPlaceholderDocumentIds() throws IOException {
        Path file = write("ids.pdf", PdfFixtures.pdf(List.of(List.of("123-45-6789", "987-65-4321"))));

        List<Finding> findings = scanner.scan(file);

        assertThat(findings).hasSize(2);
        assertThat(findings.get(0).documentId()).isNotEqualTo(findings.get(1).documentId());
    }

    @Test
    @DisplayName("Text without sensitive data should yield no findings")
    void scan_ShouldReturnEmptyForCleanText() throws IOException {
        Path file = write("clean.pdf", PdfFixtures.pdf(List.of(List.of("Quarterly report, 12-345 units"))));

        assertThat(scanner.scan(file)).isEmpty();
    }

    @Test
    @DisplayName("A password-protected PDF should be reported as unsupported")
    void scan_ShouldRejectEncryptedPdf() throws IOException {
        Path file = write("locked.pdf", PdfFixtures.encryptedPdf(List.of(List.of("SSN: 123-45-6789"))));

        assertThatThrownBy(() -> scanner.scan(file))
            .isInstanceOf(EncryptedPdfException.class)
            .hasMessageContaining("password-protected");
    }

    @Test
    @DisplayName("Bytes that are not a PDF should be reported as invalid")
    void scan_ShouldRejectGarbage() throws IOException {
        Path file = write("garbage.pdf", "definitely not a pdf".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> scanner.scan(file)).isInstanceOf(InvalidPdfException.class);
    }

    @Test
    @DisplayName("A missing file should be reported as not found")
    void scan_ShouldRejectMissingFile() {
        Path missing = tempDir.resolve("missing.pdf");

        assertThatThrownBy(() -> scanner.scan(missing)).isInstanceOf(PdfNotFoundException.class);
    }

    @Test
    @DisplayName("The scanner should advertise its patterns and identity")
    void scanner_ShouldDescribeItself() {
        assertThat(scanner.supportedPatterns()).containsExactly(FindingType.SSN, FindingType.EMAIL);
        assertThat(scanner.scannerType()).isEqualTo(ScannerType.REGEX);
    }
}
