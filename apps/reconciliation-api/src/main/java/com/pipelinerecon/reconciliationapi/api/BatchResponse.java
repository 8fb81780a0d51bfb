package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.reconciliationapi.batches.BatchView;
import java.time.Instant;

public record BatchResponse(
    long id,
    String name,
    String recordType,
    String description,
    Instant createdAt,
    Instant updatedAt) {
  public static BatchResponse from(BatchView view) {
    return new BatchResponse(
        view.id(),
        view.name(),
        view.recordType().wireValue(),
        view.description(),
        view.createdAt(),
        view.updatedAt());
  }
}
