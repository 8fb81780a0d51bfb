package com.pipelinerecon.reconciliationapi.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateBatchRequest(
    @NotBlank(message = "name is required")
        @Size(max = 255, message = "name must be at most 255 characters")
        String name,
    @NotBlank(message = "recordType is required") String recordType,
    String description) {}
