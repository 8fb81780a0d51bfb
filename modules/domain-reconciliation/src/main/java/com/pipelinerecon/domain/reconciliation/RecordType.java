package com.pipelinerecon.domain.reconciliation;

import java.util.Locale;

/** Kind of business record a batch tracks. Informational only; reconciliation ignores it. */
public enum RecordType {
  ORDER,
  TRANSACTION,
  FILE,
  SHIPMENT,
  PAYMENT;

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RecordType parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ReconciliationDomainException("recordType must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (RecordType type : values()) {
      if (type.name().equals(normalized)) {
        return type;
      }
    }
    throw new ReconciliationDomainException("Unsupported record type: " + value);
  }
}
