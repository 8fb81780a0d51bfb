package com.pipelinerecon.reconciliationapi.reconciliation;

public interface ReconciliationReporter {
  void report(MissingRecordsReport report);
}
