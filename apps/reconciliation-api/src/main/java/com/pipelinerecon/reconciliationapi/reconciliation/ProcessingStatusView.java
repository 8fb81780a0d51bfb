package com.pipelinerecon.reconciliationapi.reconciliation;

import com.pipelinerecon.domain.reconciliation.RecordType;
import java.util.List;

/** Raw id collections of a batch side by side, as stored. */
public record ProcessingStatusView(
    long batchId,
    String batchName,
    RecordType recordType,
    List<Long> expectedRecords,
    List<Long> processedRecords,
    int expectedCount,
    int processedCount) {}
