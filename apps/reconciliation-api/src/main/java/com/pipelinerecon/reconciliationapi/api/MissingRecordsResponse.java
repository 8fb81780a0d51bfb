package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.reconciliationapi.reconciliation.MissingRecordsReport;
import java.math.BigDecimal;
import java.util.List;

public record MissingRecordsResponse(
    long batchId,
    String batchName,
    int totalExpected,
    int totalProcessed,
    int missingCount,
    List<Long> missingRecords,
    BigDecimal processingRate,
    int unexpectedCount,
    List<Long> unexpectedRecords) {
  public static MissingRecordsResponse from(MissingRecordsReport report) {
    return new MissingRecordsResponse(
        report.batchId(),
        report.batchName(),
        report.totalExpected(),
        report.totalProcessed(),
        report.missingCount(),
        report.missingRecords(),
        report.processingRate(),
        report.unexpectedCount(),
        report.unexpectedRecords());
  }
}
