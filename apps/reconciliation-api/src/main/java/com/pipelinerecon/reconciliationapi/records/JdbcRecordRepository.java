package com.pipelinerecon.reconciliationapi.records;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcRecordRepository implements RecordRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcRecordRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long insert(long batchId, NewRecord record) {
    String sql =
        """
        INSERT INTO records (batch_id, record_id, status, metadata, created_at)
        VALUES (?, ?, ?, ?, ?)
        RETURNING id
        """;
    Long id =
        jdbcTemplate.queryForObject(
            sql,
            Long.class,
            batchId,
            record.recordId(),
            record.status().name(),
            record.metadata(),
            Timestamp.from(Instant.now()));
    if (id == null) {
      throw new IllegalStateException("Record insert returned no id");
    }
    return id;
  }

  @Override
  public int insertAll(long batchId, List<NewRecord> records) {
    String sql =
        """
        INSERT INTO records (batch_id, record_id, status, metadata, created_at)
        VALUES (?, ?, ?, ?, ?)
        """;
    Timestamp now = Timestamp.from(Instant.now());
    int[][] counts =
        jdbcTemplate.batchUpdate(
            sql,
            records,
            500,
            (ps, record) -> {
              ps.setLong(1, batchId);
              ps.setLong(2, record.recordId());
              ps.setString(3, record.status().name());
              ps.setString(4, record.metadata());
              ps.setTimestamp(5, now);
            });
    int inserted = 0;
    for (int[] chunk : counts) {
      for (int count : chunk) {
        // drivers may report SUCCESS_NO_INFO (-2) for batched statements
        inserted += count < 0 ? 1 : count;
      }
    }
    return inserted;
  }

  @Override
  public Optional<RecordView> findById(long id) {
    String sql =
        """
        SELECT id, batch_id, record_id, status, metadata, created_at, updated_at
        FROM records
        WHERE id = ?
        """;
    List<RecordView> rows = jdbcTemplate.query(sql, this::mapRow, id);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  @Override
  public List<RecordView> findByBatchId(long batchId) {
    String sql =
        """
        SELECT id, batch_id, record_id, status, metadata, created_at, updated_at
        FROM records
        WHERE batch_id = ?
        ORDER BY id ASC
        """;
    return jdbcTemplate.query(sql, this::mapRow, batchId);
  }

  @Override
  public List<RecordView> findByBatchIdAndStatus(long batchId, RecordStatus status) {
    String sql =
        """
        SELECT id, batch_id, record_id, status, metadata, created_at, updated_at
        FROM records
        WHERE batch_id = ? AND status = ?
        ORDER BY id ASC
        """;
    return jdbcTemplate.query(sql, this::mapRow, batchId, status.name());
  }

  @Override
  public long countByBatchId(long batchId) {
    Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM records WHERE batch_id = ?", Long.class, batchId);
    return count == null ? 0L : count;
  }

  @Override
  public long countByBatchIdAndStatus(long batchId, RecordStatus status) {
    Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM records WHERE batch_id = ? AND status = ?",
            Long.class,
            batchId,
            status.name());
    return count == null ? 0L : count;
  }

  @Override
  public int deleteByBatchId(long batchId) {
    return jdbcTemplate.update("DELETE FROM records WHERE batch_id = ?", batchId);
  }

  private RecordView mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RecordView(
        rs.getLong("id"),
        rs.getLong("batch_id"),
        rs.getLong("record_id"),
        RecordStatus.valueOf(rs.getString("status")),
        rs.getString("metadata"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
