package com.pipelinerecon.reconciliationapi.batches;

import com.pipelinerecon.domain.reconciliation.RecordType;
import java.time.Instant;

public record BatchView(
    long id,
    String name,
    RecordType recordType,
    String description,
    Instant createdAt,
    Instant updatedAt) {}
