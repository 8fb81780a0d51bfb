package com.pipelinerecon.reconciliationapi.records;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import java.time.Instant;

public record RecordView(
    long id,
    long batchId,
    long recordId,
    RecordStatus status,
    String metadata,
    Instant createdAt,
    Instant updatedAt) {}
