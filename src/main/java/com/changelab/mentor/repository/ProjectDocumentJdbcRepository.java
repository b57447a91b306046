package com.changelab.mentor.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ProjectDocumentJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ProjectDocumentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<DocumentRow> load(String projectId) {
        List<DocumentRow> rows = jdbcTemplate.query(
                "SELECT project_id, document, revision, created_at, updated_at FROM project_documents WHERE project_id = ?",
                (rs, n) -> new DocumentRow(rs.getString(1), rs.getString(2), rs.getLong(3),
                        Instant.parse(rs.getString(4)), Instant.parse(rs.getString(5))),
                projectId);
        return rows.stream().findFirst();
    }

    public void save(DocumentRow row) {
        jdbcTemplate.update(
                "MERGE INTO project_documents(project_id, document, revision, created_at, updated_at) KEY(project_id) VALUES (?,?,?,?,?)",
                row.projectId(), row.document(), row.revision(), row.createdAt().toString(), row.updatedAt().toString());
    }

    public record DocumentRow(String projectId, String document, long revision, Instant createdAt, Instant updatedAt) {}
}
