package com.pipelinerecon.reconciliationapi.batches;

import com.pipelinerecon.domain.reconciliation.RecordType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcBatchRepository implements BatchRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcBatchRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long insert(String name, RecordType recordType, String description) {
    String sql =
        """
        INSERT INTO batches (name, record_type, description, created_at)
        VALUES (?, ?, ?, ?)
        RETURNING id
        """;
    Long id =
        jdbcTemplate.queryForObject(
            sql, Long.class, name, recordType.name(), description, Timestamp.from(Instant.now()));
    if (id == null) {
      throw new IllegalStateException("Batch insert returned no id");
    }
    return id;
  }

  @Override
  public Optional<BatchView> findById(long batchId) {
    String sql =
        """
        SELECT id, name, record_type, description, created_at, updated_at
        FROM batches
        WHERE id = ?
        """;
    return firstRow(jdbcTemplate.query(sql, this::mapRow, batchId));
  }

  @Override
  public Optional<BatchView> findByName(String name) {
    String sql =
        """
        SELECT id, name, record_type, description, created_at, updated_at
        FROM batches
        WHERE name = ?
        """;
    return firstRow(jdbcTemplate.query(sql, this::mapRow, name));
  }

  @Override
  public List<BatchView> findAll() {
    String sql =
        """
        SELECT id, name, record_type, description, created_at, updated_at
        FROM batches
        ORDER BY id ASC
        """;
    return jdbcTemplate.query(sql, this::mapRow);
  }

  @Override
  public boolean existsById(long batchId) {
    Boolean exists =
        jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM batches WHERE id = ?)", Boolean.class, batchId);
    return Boolean.TRUE.equals(exists);
  }

  @Override
  public boolean deleteById(long batchId) {
    return jdbcTemplate.update("DELETE FROM batches WHERE id = ?", batchId) > 0;
  }

  private BatchView mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new BatchView(
        rs.getLong("id"),
        rs.getString("name"),
        RecordType.valueOf(rs.getString("record_type")),
        rs.getString("description"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private static Optional<BatchView> firstRow(List<BatchView> rows) {
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
