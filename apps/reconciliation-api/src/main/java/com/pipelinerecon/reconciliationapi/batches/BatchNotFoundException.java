package com.pipelinerecon.reconciliationapi.batches;

public class BatchNotFoundException extends RuntimeException {
  private final long batchId;

  public BatchNotFoundException(long batchId) {
    super("Batch with id " + batchId + " not found");
    this.batchId = batchId;
  }

  public long batchId() {
    return batchId;
  }
}
