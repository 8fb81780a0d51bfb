package com.pipelinerecon.reconciliationapi.records;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import java.util.Objects;

public record NewRecord(long recordId, RecordStatus status, String metadata) {
  public NewRecord {
    Objects.requireNonNull(status, "status must not be null");
  }
}
