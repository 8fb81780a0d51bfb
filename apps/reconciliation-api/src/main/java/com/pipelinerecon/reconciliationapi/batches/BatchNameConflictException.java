package com.pipelinerecon.reconciliationapi.batches;

public class BatchNameConflictException extends RuntimeException {
  public BatchNameConflictException(String name) {
    super("Batch with name '" + name + "' already exists");
  }
}
