package com.pipelinerecon.reconciliationapi.reconciliation;

import java.math.BigDecimal;
import java.util.List;

public record MissingRecordsReport(
    long batchId,
    String batchName,
    int totalExpected,
    int totalProcessed,
    int missingCount,
    List<Long> missingRecords,
    BigDecimal processingRate,
    int unexpectedCount,
    List<Long> unexpectedRecords) {}
