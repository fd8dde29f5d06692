package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.exception.DocumentNotFoundException;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@RequiredArgsConstructor
public class ClickHouseDocumentRepository implements DocumentRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, filename, toUnixTimestamp64Micro(upload_time) AS upload_time_us,
               status, file_size, error_message, version
        FROM documents FINAL
        """;

    private final JdbcClient jdbcClient;

    private record VersionedDocument(Document document, long version) {}

    private final RowMapper<VersionedDocument> documentRowMapper = (rs, rowNum) -> {
        String errorMessage = rs.getString("error_message");
        Document document = new Document(
            UUID.fromString(rs.getString("id")),
            rs.getString("filename"),
            ClickHouseTime.fromMicros(rs.getLong("upload_time_us")),
            DocumentStatus.fromValue(rs.getString("status")),
            rs.getLong("file_size"),
            errorMessage == null || errorMessage.isEmpty() ? null : errorMessage
        );
        return new VersionedDocument(document, rs.getLong("version"));
    };

    @Override
    public void save(Document document) {
        insert(document, ClickHouseTime.nowMicros());
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return findVersioned(id).map(VersionedDocument::document);
    }

    @Override
    public void updateStatus(UUID id, DocumentStatus status, String errorMessage) {
        VersionedDocument current = findVersioned(id)
            .orElseThrow(() -> new DocumentNotFoundException(id));

        long version = Math.max(current.version() + 1, ClickHouseTime.nowMicros());
        insert(current.document().withStatus(status, errorMessage), version);
    }

    @Override
    public List<Document> findAll(int limit, int offset) {
        return jdbcClient.sql(SELECT_COLUMNS + """
                ORDER BY upload_time DESC, id
                LIMIT :limit OFFSET :offset
                """)
            .param("limit", limit)
            .param("offset", offset)
            .query(documentRowMapper)
            .list()
            .stream()
            .map(VersionedDocument::document)
            .toList();
    }

    private Optional<VersionedDocument> findVersioned(UUID id) {
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE id = toUUID(:id)")
            .param("id", id.toString())
            .query(documentRowMapper)
            .optional();
    }

    private void insert(Document document, long version) {
        jdbcClient.sql("""
                INSERT INTO documents (id, filename, upload_time, status, file_size, error_message, version)
                VALUES (toUUID(:id), :filename, fromUnixTimestamp64Micro(:uploadTime, 'UTC'),
                        :status, :fileSize, :errorMessage, :version)
                """)
            .param("id", document.id().toString())
            .param("filename", document.filename())
            .param("uploadTime", ClickHouseTime.toMicros(document.uploadTime()))
            .param("status", document.status().value())
            .param("fileSize", document.fileSize())
            .param("errorMessage", Objects.requireNonNullElse(document.errorMessage(), ""))
            .param("version", version)
            .update();
    }
}
