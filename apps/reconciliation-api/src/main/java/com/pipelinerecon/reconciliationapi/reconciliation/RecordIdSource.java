package com.pipelinerecon.reconciliationapi.reconciliation;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import java.util.List;

public interface RecordIdSource {
  /**
   * Returns the record ids stored for a batch under one status, ascending, duplicates included.
   *
   * @throws com.pipelinerecon.reconciliationapi.batches.BatchNotFoundException if the batch does
   *     not exist
   */
  List<Long> fetchIds(long batchId, RecordStatus status);
}
