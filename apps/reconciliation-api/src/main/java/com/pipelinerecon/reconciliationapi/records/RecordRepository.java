package com.pipelinerecon.reconciliationapi.records;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import java.util.List;
import java.util.Optional;

public interface RecordRepository {
  long insert(long batchId, NewRecord record);

  int insertAll(long batchId, List<NewRecord> records);

  Optional<RecordView> findById(long id);

  List<RecordView> findByBatchId(long batchId);

  List<RecordView> findByBatchIdAndStatus(long batchId, RecordStatus status);

  long countByBatchId(long batchId);

  long countByBatchIdAndStatus(long batchId, RecordStatus status);

  int deleteByBatchId(long batchId);
}
