package com.pipelinerecon.reconciliationapi.batches;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

import com.pipelinerecon.domain.reconciliation.RecordType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

class JdbcBatchRepositoryTest {
  private JdbcTemplate jdbcTemplate;
  private JdbcBatchRepository repository;

  @BeforeEach
  void setUp() {
    jdbcTemplate = org.mockito.Mockito.mock(JdbcTemplate.class);
    repository = new JdbcBatchRepository(jdbcTemplate);
  }

  @Test
  void shouldInsertWithEnumName() {
    when(jdbcTemplate.queryForObject(
            argThat(sql -> sql != null && sql.contains("RETURNING id")),
            eq(Long.class),
            eq("orders"),
            eq("SHIPMENT"),
            isNull(),
            any()))
        .thenReturn(42L);

    assertEquals(42L, repository.insert("orders", RecordType.SHIPMENT, null));
  }

  @Test
  void shouldReturnEmptyWhenBatchIsAbsent() {
    when(jdbcTemplate.query(
            argThat(sql -> sql != null && sql.contains("WHERE id = ?")),
            any(RowMapper.class),
            eq(5L)))
        .thenReturn(List.of());

    assertTrue(repository.findById(5L).isEmpty());
  }

  @Test
  void shouldReportDeleteOutcome() {
    when(jdbcTemplate.update(argThat(sql -> sql != null && sql.startsWith("DELETE")), eq(1L)))
        .thenReturn(1);
    when(jdbcTemplate.update(argThat(sql -> sql != null && sql.startsWith("DELETE")), eq(2L)))
        .thenReturn(0);

    assertTrue(repository.deleteById(1L));
    assertFalse(repository.deleteById(2L));
  }
}
