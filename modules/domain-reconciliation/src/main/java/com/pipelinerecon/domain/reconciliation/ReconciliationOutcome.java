package com.pipelinerecon.domain.reconciliation;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Result of comparing the expected and processed identifier sets of one batch. Id lists are
 * sorted ascending and free of duplicates.
 */
public record ReconciliationOutcome(
    int totalExpected,
    int totalProcessed,
    List<Long> missingRecords,
    List<Long> unexpectedRecords,
    int successfulCount,
    BigDecimal processingRate) {

  public ReconciliationOutcome {
    Objects.requireNonNull(missingRecords, "missingRecords must not be null");
    Objects.requireNonNull(unexpectedRecords, "unexpectedRecords must not be null");
    Objects.requireNonNull(processingRate, "processingRate must not be null");
    if (missingRecords.size() + successfulCount != totalExpected) {
      throw new ReconciliationDomainException(
          "missing + successful must equal totalExpected");
    }
    if (unexpectedRecords.size() + successfulCount != totalProcessed) {
      throw new ReconciliationDomainException(
          "unexpected + successful must equal totalProcessed");
    }
    missingRecords = List.copyOf(missingRecords);
    unexpectedRecords = List.copyOf(unexpectedRecords);
  }

  public int missingCount() {
    return missingRecords.size();
  }

  public int unexpectedCount() {
    return unexpectedRecords.size();
  }

  public boolean isComplete() {
    return missingRecords.isEmpty() && unexpectedRecords.isEmpty();
  }
}
