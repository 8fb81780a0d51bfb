package com.pipelinerecon.domain.reconciliation;

public class ReconciliationDomainException extends RuntimeException {
  public ReconciliationDomainException(String message) {
    super(message);
  }
}
