package com.pipelinerecon.reconciliationapi.records;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import com.pipelinerecon.reconciliationapi.batches.BatchService;
import com.pipelinerecon.reconciliationapi.config.ReconciliationProperties;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RecordService {
  private static final Logger log = LoggerFactory.getLogger(RecordService.class);

  private final RecordRepository recordRepository;
  private final BatchService batchService;
  private final ReconciliationProperties properties;

  public RecordService(
      RecordRepository recordRepository,
      BatchService batchService,
      ReconciliationProperties properties) {
    this.recordRepository = recordRepository;
    this.batchService = batchService;
    this.properties = properties;
  }

  @Transactional
  public RecordView create(long batchId, NewRecord record) {
    if (record == null) {
      throw new IllegalArgumentException("record must not be null");
    }
    batchService.requireExists(batchId);
    long id = recordRepository.insert(batchId, record);
    return recordRepository
        .findById(id)
        .orElseThrow(() -> new IllegalStateException("Inserted record not found: " + id));
  }

  @Transactional
  public int bulkCreate(long batchId, List<NewRecord> records) {
    if (records == null || records.isEmpty()) {
      throw new IllegalArgumentException("records must not be empty");
    }
    int maxRecords = properties.getBulk().getMaxRecords();
    if (records.size() > maxRecords) {
      throw new IllegalArgumentException(
          "bulk upload accepts at most " + maxRecords + " records, got " + records.size());
    }
    batchService.requireExists(batchId);
    int inserted = recordRepository.insertAll(batchId, records);
    log.info("Records uploaded batch_id={} count={}", batchId, inserted);
    return inserted;
  }

  @Transactional(readOnly = true)
  public List<RecordView> listByBatch(long batchId) {
    batchService.requireExists(batchId);
    return recordRepository.findByBatchId(batchId);
  }

  @Transactional(readOnly = true)
  public List<RecordView> listByBatchAndStatus(long batchId, RecordStatus status) {
    if (status == null) {
      return listByBatch(batchId);
    }
    batchService.requireExists(batchId);
    return recordRepository.findByBatchIdAndStatus(batchId, status);
  }

  @Transactional
  public int purge(long batchId) {
    batchService.requireExists(batchId);
    int deleted = recordRepository.deleteByBatchId(batchId);
    log.info("Records purged batch_id={} deleted={}", batchId, deleted);
    return deleted;
  }
}
