package com.pipelinerecon.domain.reconciliation;

import java.util.Locale;

public enum RecordStatus {
  EXPECTED,
  PROCESSED;

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RecordStatus parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ReconciliationDomainException("status must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (RecordStatus status : values()) {
      if (status.name().equals(normalized)) {
        return status;
      }
    }
    throw new ReconciliationDomainException("Unsupported record status: " + value);
  }
}
