package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.reconciliationapi.reconciliation.BatchStatisticsView;
import java.math.BigDecimal;

public record BatchStatisticsResponse(
    long batchId,
    String batchName,
    long totalRecords,
    long expectedCount,
    long processedCount,
    int missingCount,
    BigDecimal processingRate) {
  public static BatchStatisticsResponse from(BatchStatisticsView view) {
    return new BatchStatisticsResponse(
        view.batchId(),
        view.batchName(),
        view.totalRecords(),
        view.expectedCount(),
        view.processedCount(),
        view.missingCount(),
        view.processingRate());
  }
}
