package com.pipelinerecon.reconciliationapi.reconciliation;

import java.math.BigDecimal;

/**
 * Aggregate counts of a batch. {@code totalRecords}, {@code expectedCount} and {@code
 * processedCount} count stored rows; {@code missingCount} and {@code processingRate} are computed
 * over distinct ids.
 */
public record BatchStatisticsView(
    long batchId,
    String batchName,
    long totalRecords,
    long expectedCount,
    long processedCount,
    int missingCount,
    BigDecimal processingRate) {}
