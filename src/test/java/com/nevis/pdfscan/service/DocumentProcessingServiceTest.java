package com.nevis.pdfscan.service;

import com.nevis.pdfscan.config.BackendFactory;
import com.nevis.pdfscan.config.Backends;
import com.nevis.pdfscan.controller.UploadResponse;
import com.nevis.pdfscan.exception.EncryptedPdfException;
import com.nevis.pdfscan.exception.ErrorKind;
import com.nevis.pdfscan.exception.InvalidPdfException;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricQuery;
import com.nevis.pdfscan.repository.InMemoryMetricsRepository;
import com.nevis.pdfscan.scanner.PdfFixtures;
import com.nevis.pdfscan.scanner.PdfScanner;
import com.nevis.pdfscan.scanner.RegexPdfScanner;
import com.nevis.pdfscan.scanner.ScannerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DocumentProcessingServiceTest {

    private static final byte[] CONTENT = "%PDF-1.7 test".getBytes();

    @TempDir
    Path tempDir;

    private PdfScanner scanner;
    private Backends backends;
    private DocumentProcessingService service;

    @BeforeEach
    void setUp() {
        scanner = mock(PdfScanner.class);
        when(scanner.scannerType()).thenReturn(ScannerType.REGEX);
        backends = BackendFactory.inMemory(scanner);
        service = new DocumentProcessingServiceImpl(backends, tempDir.toString());
    }

    private long tempFileCount() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.count();
        }
    }

    private List<Metric> metrics(String operation) {
        return backends.metrics().findAll(MetricQuery.builder().operation(operation).build(), 100, 0);
    }

    @Nested
    @DisplayName("Successful uploads")
    class SuccessTest {

        @Test
        @DisplayName("Should complete the document and store findings under its id")
        void processUpload_ShouldCompleteAndStoreFindings() throws IOException {
            Finding ssn = Finding.create(UUID.randomUUID(), FindingType.SSN, "page 1", 1.0);
            Finding email = Finding.create(UUID.randomUUID(), FindingType.EMAIL, "page 1", 1.0);
            when(scanner.scan(any(Path.class))).thenReturn(List.of(ssn, email));

            UploadResponse response = service.processUpload("report.pdf", CONTENT.length, CONTENT);

            assertThat(response.status()).isEqualTo(DocumentStatus.COMPLETED);
            assertThat(response.findingsCount()).isEqualTo(2);
            assertThat(response.filename()).isEqualTo("report.pdf");
            assertThat(response.fileSize()).isEqualTo(CONTENT.length);

            Document stored = backends.documents().findById(response.documentId()).orElseThrow();
            assertThat(stored.status()).isEqualTo(DocumentStatus.COMPLETED);
            assertThat(stored.uploadTime()).isEqualTo(response.uploadTime());

            List<Finding> findings = backends.findings().findByDocumentId(response.documentId());
            assertThat(findings).extracting(Finding::id).containsExactly(ssn.id(), email.id());
            assertThat(findings).allSatisfy(f -> assertThat(f.documentId()).isEqualTo(response.documentId()));
            assertThat(backends.findings().count(Optional.of(ssn.documentId()))).isZero();

            assertThat(tempFileCount()).isZero();
        }

        @Test
        @DisplayName("Should record one scan and one upload metric")
        void processUpload_ShouldRecordMetrics() {
            when(scanner.scan(any(Path.class))).thenReturn(List.of(
                Finding.create(UUID.randomUUID(), FindingType.SSN, "page 1", 1.0)));

            UploadResponse response = service.processUpload("report.pdf", CONTENT.length, CONTENT);

            assertThat(metrics(Metric.SCAN)).singleElement().satisfies(metric -> {
                assertThat(metric.documentId()).isEqualTo(response.documentId());
                assertThat(metric.durationMs()).isGreaterThanOrEqualTo(0.0);
                assertThat(metric.metadata())
                    .containsEntry("findings_count", 1)
                    .containsEntry("scanner_type", "regex");
            });
            assertThat(metrics(Metric.UPLOAD)).singleElement().satisfies(metric -> {
                assertThat(metric.documentId()).isEqualTo(response.documentId());
                assertThat(metric.metadata())
                    .containsEntry("file_size", (long) CONTENT.length)
                    .containsEntry("filename", "report.pdf");
            });
        }

        @Test
        @DisplayName("Scanner should receive a staged copy of the upload")
        void processUpload_ShouldScanStagedFile() {
            List<Path> scanned = new ArrayList<>();
            when(scanner.scan(any(Path.class))).thenAnswer(invocation -> {
                Path file = invocation.getArgument(0);
                scanned.add(file);
                assertThat(file).exists().hasBinaryContent(CONTENT);
                assertThat(file.getParent()).isEqualTo(tempDir);
                assertThat(file.getFileName().toString()).startsWith("pdf_scan_").endsWith(".pdf");
                return List.of();
            });

            UploadResponse response = service.processUpload("empty.pdf", CONTENT.length, CONTENT);

            assertThat(response.findingsCount()).isZero();
            assertThat(scanned).singleElement().satisfies(file -> assertThat(file).doesNotExist());
        }

        @Test
        @DisplayName("A real PDF with an SSN and an email should produce two findings")
        void processUpload_WithRegexScanner() {
            Backends regexBackends = BackendFactory.inMemory(new RegexPdfScanner());
            DocumentProcessingService regexService = new DocumentProcessingServiceImpl(regexBackends, tempDir.toString());
            byte[] pdf = PdfFixtures.pdf(List.of(List.of("SSN: 123-45-6789", "email: a@b.com")));

            UploadResponse response = regexService.processUpload("pii.pdf", pdf.length, pdf);

            assertThat(response.status()).isEqualTo(DocumentStatus.COMPLETED);
            assertThat(response.findingsCount()).isEqualTo(2);
            assertThat(regexBackends.findings().findByDocumentId(response.documentId()))
                .extracting(Finding::location)
                .containsOnly("page 1");
        }

        @Test
        @DisplayName("Concurrent uploads should each complete with their own findings")
        void processUpload_ShouldHandleConcurrentUploads() throws Exception {
            when(scanner.scan(any(Path.class))).thenAnswer(invocation ->
                List.of(Finding.create(UUID.randomUUID(), FindingType.EMAIL, "page 1", 1.0)));

            ExecutorService executor = Executors.newFixedThreadPool(4);
            List<Callable<UploadResponse>> uploads = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                String filename = "doc-" + i + ".pdf";
                uploads.add(() -> service.processUpload(filename, CONTENT.length, CONTENT));
            }

            List<UploadResponse> responses = new ArrayList<>();
            try {
                for (Future<UploadResponse> future : executor.invokeAll(uploads)) {
                    responses.add(future.get());
                }
            } finally {
                executor.shutdown();
            }

            assertThat(responses).extracting(UploadResponse::documentId).doesNotHaveDuplicates();
            assertThat(responses).allSatisfy(r -> {
                assertThat(r.status()).isEqualTo(DocumentStatus.COMPLETED);
                assertThat(backends.findings().count(Optional.of(r.documentId()))).isEqualTo(1);
            });
            assertThat(backends.documents().findAll(100, 0)).hasSize(12);
            assertThat(metrics(Metric.UPLOAD)).hasSize(12);
            assertThat(tempFileCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Failed uploads")
    class FailureTest {

        @Test
        @DisplayName("An encrypted PDF should fail the document and rethrow the scanner's exception")
        void processUpload_ShouldMarkFailedAndRethrow() throws IOException {
            EncryptedPdfException failure = new EncryptedPdfException();
            when(scanner.scan(any(Path.class))).thenThrow(failure);

            assertThatThrownBy(() -> service.processUpload("locked.pdf", CONTENT.length, CONTENT))
                .isSameAs(failure);

            Document document = backends.documents().findAll(10, 0).get(0);
            assertThat(document.status()).isEqualTo(DocumentStatus.FAILED);
            assertThat(document.errorMessage()).isEqualTo(failure.getMessage());
            assertThat(backends.findings().count(Optional.empty())).isZero();
            assertThat(metrics(Metric.UPLOAD)).isEmpty();
            assertThat(metrics(Metric.SCAN)).isEmpty();
            assertThat(tempFileCount()).isZero();
        }

        @Test
        @DisplayName("process should describe the failure instead of throwing")
        void process_ShouldReturnFailureOutcome() {
            when(scanner.scan(any(Path.class))).thenThrow(new InvalidPdfException("Invalid or corrupt PDF file", null));

            ProcessingOutcome outcome = service.process("broken.pdf", CONTENT.length, CONTENT);

            assertThat(outcome).isInstanceOf(ProcessingOutcome.Failure.class);
            ProcessingOutcome.Failure failure = (ProcessingOutcome.Failure) outcome;
            assertThat(failure.errorKind()).isEqualTo(ErrorKind.INVALID_FORMAT);
            assertThat(failure.message()).isEqualTo("Invalid or corrupt PDF file");
            assertThat(backends.documents().findById(failure.documentId()))
                .get()
                .extracting(Document::status)
                .isEqualTo(DocumentStatus.FAILED);
        }

        @Test
        @DisplayName("An Error from the scanner should fail the document and be rethrown unchanged")
        void processUpload_ShouldMarkFailedOnError() throws IOException {
            StackOverflowError overflow = new StackOverflowError("deep");
            when(scanner.scan(any(Path.class))).thenThrow(overflow);

            assertThatThrownBy(() -> service.processUpload("nested.pdf", CONTENT.length, CONTENT))
                .isSameAs(overflow);

            Document document = backends.documents().findAll(10, 0).get(0);
            assertThat(document.status()).isEqualTo(DocumentStatus.FAILED);
            assertThat(document.errorMessage()).isEqualTo("deep");
            assertThat(metrics(Metric.UPLOAD)).isEmpty();
            assertThat(tempFileCount()).isZero();
        }

        @Test
        @DisplayName("process should report an Error as a processing failure")
        void process_ShouldReturnFailureOutcomeForError() {
            when(scanner.scan(any(Path.class))).thenThrow(new OutOfMemoryError());

            ProcessingOutcome outcome = service.process("huge.pdf", CONTENT.length, CONTENT);

            assertThat(outcome).isInstanceOf(ProcessingOutcome.Failure.class);
            ProcessingOutcome.Failure failure = (ProcessingOutcome.Failure) outcome;
            assertThat(failure.errorKind()).isEqualTo(ErrorKind.PROCESSING_FAILURE);
            assertThat(failure.message()).isEqualTo("OutOfMemoryError");
            assertThat(failure.cause()).isInstanceOf(OutOfMemoryError.class);
            assertThatThrownBy(failure::orElseThrow).isInstanceOf(OutOfMemoryError.class);
        }

        @Test
        @DisplayName("An exception without a message should record its type name")
        void processUpload_ShouldRecordTypeNameWhenMessageMissing() {
            when(scanner.scan(any(Path.class))).thenThrow(new IllegalStateException());

            assertThatThrownBy(() -> service.processUpload("odd.pdf", CONTENT.length, CONTENT))
                .isInstanceOf(IllegalStateException.class);

            Document document = backends.documents().findAll(10, 0).get(0);
            assertThat(document.errorMessage()).isEqualTo("IllegalStateException");
        }

        @Test
        @DisplayName("Findings stored before a failure should remain stored")
        void processUpload_ShouldKeepFindingsSavedBeforeFailure() {
            Finding finding = Finding.create(UUID.randomUUID(), FindingType.SSN, "page 1", 1.0);
            when(scanner.scan(any(Path.class))).thenReturn(List.of(finding));

            Backends failingMetrics = new Backends(
                backends.documents(),
                backends.findings(),
                new InMemoryMetricsRepository() {
                    @Override
                    public void save(Metric metric) {
                        throw new IllegalStateException("metrics store unavailable");
                    }
                },
                scanner
            );
            DocumentProcessingService failingService = new DocumentProcessingServiceImpl(failingMetrics, tempDir.toString());

            assertThatThrownBy(() -> failingService.processUpload("a.pdf", CONTENT.length, CONTENT))
                .hasMessage("metrics store unavailable");

            Document document = backends.documents().findAll(10, 0).get(0);
            assertThat(document.status()).isEqualTo(DocumentStatus.FAILED);
            assertThat(backends.findings().findByDocumentId(document.id())).hasSize(1);
        }
    }
}
