package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RequiredArgsConstructor
public class ClickHouseFindingRepository implements FindingRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, document_id, finding_type, location, confidence
        FROM findings FINAL
        """;

    private static final String ORDER_BY = "ORDER BY confidence DESC, created_at, id\n";

    private final JdbcClient jdbcClient;

    private final RowMapper<Finding> findingRowMapper = (rs, rowNum) -> new Finding(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("document_id")),
        FindingType.fromValue(rs.getString("finding_type")),
        rs.getString("location"),
        rs.getDouble("confidence")
    );

    @Override
    public void save(Finding finding) {
        jdbcClient.sql("""
                INSERT INTO findings (id, document_id, finding_type, location, confidence)
                VALUES (toUUID(:id), toUUID(:documentId), :findingType, :location, :confidence)
                """)
            .param("id", finding.id().toString())
            .param("documentId", finding.documentId().toString())
            .param("findingType", finding.findingType().value())
            .param("location", finding.location())
            .param("confidence", finding.confidence())
            .update();
    }

    @Override
    public List<Finding> findByDocumentId(UUID documentId) {
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE document_id = toUUID(:documentId)\n" + ORDER_BY)
            .param("documentId", documentId.toString())
            .query(findingRowMapper)
            .list();
    }

    @Override
    public List<Finding> findAll(int limit, int offset, Optional<FindingType> findingType) {
        String where = findingType.isPresent() ? "WHERE finding_type = :findingType\n" : "";

        var statement = jdbcClient.sql(SELECT_COLUMNS + where + ORDER_BY + "LIMIT :limit OFFSET :offset")
            .param("limit", limit)
            .param("offset", offset);

        if (findingType.isPresent()) {
            statement = statement.param("findingType", findingType.get().value());
        }

        return statement.query(findingRowMapper).list();
    }

    @Override
    public long count(Optional<UUID> documentId) {
        if (documentId.isEmpty()) {
            return jdbcClient.sql("SELECT count() FROM findings FINAL")
                .query(Long.class)
                .single();
        }
        return jdbcClient.sql("SELECT count() FROM findings FINAL WHERE document_id = toUUID(:documentId)")
            .param("documentId", documentId.get().toString())
            .query(Long.class)
            .single();
    }

    @Override
    public long countByType(FindingType findingType) {
        return jdbcClient.sql("SELECT count() FROM findings FINAL WHERE finding_type = :findingType")
            .param("findingType", findingType.value())
            .query(Long.class)
            .single();
    }
}
