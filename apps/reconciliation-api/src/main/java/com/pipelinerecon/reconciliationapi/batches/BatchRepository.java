package com.pipelinerecon.reconciliationapi.batches;

import com.pipelinerecon.domain.reconciliation.RecordType;
import java.util.List;
import java.util.Optional;

public interface BatchRepository {
  long insert(String name, RecordType recordType, String description);

  Optional<BatchView> findById(long batchId);

  Optional<BatchView> findByName(String name);

  List<BatchView> findAll();

  boolean existsById(long batchId);

  /** Records of the batch go with it through the foreign key cascade. */
  boolean deleteById(long batchId);
}
