package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.reconciliationapi.records.RecordView;
import java.time.Instant;

public record RecordResponse(
    long id,
    long batchId,
    long recordId,
    String status,
    String metadata,
    Instant createdAt,
    Instant updatedAt) {
  public static RecordResponse from(RecordView view) {
    return new RecordResponse(
        view.id(),
        view.batchId(),
        view.recordId(),
        view.status().wireValue(),
        view.metadata(),
        view.createdAt(),
        view.updatedAt());
  }
}
