package com.pipelinerecon.reconciliationapi.records;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import com.pipelinerecon.reconciliationapi.batches.BatchNotFoundException;
import com.pipelinerecon.reconciliationapi.batches.BatchService;
import com.pipelinerecon.reconciliationapi.config.ReconciliationProperties;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecordServiceTest {
  private RecordRepository recordRepository;
  private BatchService batchService;
  private ReconciliationProperties properties;
  private RecordService service;

  @BeforeEach
  void setUp() {
    recordRepository = org.mockito.Mockito.mock(RecordRepository.class);
    batchService = org.mockito.Mockito.mock(BatchService.class);
    properties = new ReconciliationProperties();
    service = new RecordService(recordRepository, batchService, properties);
  }

  @Test
  void shouldCreateSingleRecord() {
    NewRecord record = new NewRecord(2001L, RecordStatus.EXPECTED, "Test order");
    RecordView stored =
        new RecordView(
            55L, 1L, 2001L, RecordStatus.EXPECTED, "Test order", Instant.now(), null);
    when(recordRepository.insert(1L, record)).thenReturn(55L);
    when(recordRepository.findById(55L)).thenReturn(Optional.of(stored));

    RecordView actual = service.create(1L, record);

    assertEquals(2001L, actual.recordId());
    assertEquals(RecordStatus.EXPECTED, actual.status());
    verify(batchService).requireExists(1L);
  }

  @Test
  void shouldRejectRecordForUnknownBatch() {
    doThrow(new BatchNotFoundException(9L)).when(batchService).requireExists(9L);

    assertThrows(
        BatchNotFoundException.class,
        () -> service.create(9L, new NewRecord(1L, RecordStatus.PROCESSED, null)));
    verify(recordRepository, never()).insert(anyLong(), org.mockito.ArgumentMatchers.any());
  }

  @Test
  void shouldBulkInsertRecords() {
    List<NewRecord> records =
        List.of(
            new NewRecord(1001L, RecordStatus.EXPECTED, "Order 1001"),
            new NewRecord(1002L, RecordStatus.EXPECTED, "Order 1002"));
    when(recordRepository.insertAll(4L, records)).thenReturn(2);

    int inserted = service.bulkCreate(4L, records);

    assertEquals(2, inserted);
  }

  @Test
  void shouldRejectEmptyBulkUpload() {
    assertThrows(IllegalArgumentException.class, () -> service.bulkCreate(4L, List.of()));
    verify(recordRepository, never()).insertAll(anyLong(), anyList());
  }

  @Test
  void shouldRejectOversizedBulkUpload() {
    properties.getBulk().setMaxRecords(1);
    List<NewRecord> records =
        List.of(
            new NewRecord(1L, RecordStatus.EXPECTED, null),
            new NewRecord(2L, RecordStatus.EXPECTED, null));

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> service.bulkCreate(4L, records));

    assertEquals("bulk upload accepts at most 1 records, got 2", ex.getMessage());
  }

  @Test
  void shouldListAllRecordsWhenStatusIsAbsent() {
    when(recordRepository.findByBatchId(3L)).thenReturn(List.of());

    service.listByBatchAndStatus(3L, null);

    verify(recordRepository).findByBatchId(3L);
    verify(recordRepository, never())
        .findByBatchIdAndStatus(anyLong(), org.mockito.ArgumentMatchers.any());
  }

  @Test
  void shouldPurgeRecordsOfBatch() {
    when(recordRepository.deleteByBatchId(3L)).thenReturn(17);

    assertEquals(17, service.purge(3L));
    verify(batchService).requireExists(3L);
  }
}
