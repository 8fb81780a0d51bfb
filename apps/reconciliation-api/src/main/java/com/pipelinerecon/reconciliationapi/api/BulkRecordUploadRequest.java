package com.pipelinerecon.reconciliationapi.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BulkRecordUploadRequest(
    @NotNull(message = "batchId is required") Long batchId,
    @NotEmpty(message = "records must not be empty")
        List<@NotNull(message = "records must not contain null entries") @Valid CreateRecordRequest>
            records) {}
