package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.reconciliationapi.reconciliation.ProcessingStatusView;
import java.util.List;

public record ProcessingStatusResponse(
    long batchId,
    String batchName,
    String recordType,
    List<Long> expectedRecords,
    List<Long> processedRecords,
    int expectedCount,
    int processedCount) {
  public static ProcessingStatusResponse from(ProcessingStatusView view) {
    return new ProcessingStatusResponse(
        view.batchId(),
        view.batchName(),
        view.recordType().wireValue(),
        view.expectedRecords(),
        view.processedRecords(),
        view.expectedCount(),
        view.processedCount());
  }
}
