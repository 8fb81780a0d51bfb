package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import com.pipelinerecon.reconciliationapi.records.NewRecord;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateRecordRequest(
    @NotNull(message = "recordId is required") Long recordId,
    @NotBlank(message = "status is required") String status,
    @Size(max = 4000, message = "metadata must be at most 4000 characters") String metadata) {

  public NewRecord toNewRecord() {
    return new NewRecord(recordId, RecordStatus.parse(status), metadata);
  }
}
