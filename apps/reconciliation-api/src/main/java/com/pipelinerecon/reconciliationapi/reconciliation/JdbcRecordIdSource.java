package com.pipelinerecon.reconciliationapi.reconciliation;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import com.pipelinerecon.reconciliationapi.batches.BatchNotFoundException;
import java.util.List;
import java.util.Objects;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class JdbcRecordIdSource implements RecordIdSource {
  private final JdbcTemplate jdbcTemplate;

  public JdbcRecordIdSource(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public List<Long> fetchIds(long batchId, RecordStatus status) {
    Objects.requireNonNull(status, "status must not be null");
    Boolean batchExists =
        jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM batches WHERE id = ?)", Boolean.class, batchId);
    if (!Boolean.TRUE.equals(batchExists)) {
      throw new BatchNotFoundException(batchId);
    }
    String sql =
        """
        SELECT record_id
        FROM records
        WHERE batch_id = ? AND status = ?
        ORDER BY record_id ASC
        """;
    return jdbcTemplate.queryForList(sql, Long.class, batchId, status.name());
  }
}
