package com.pipelinerecon.reconciliationapi.reconciliation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingReconciliationReporter implements ReconciliationReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingReconciliationReporter.class);

  @Override
  public void report(MissingRecordsReport report) {
    log.info(
        "Batch reconciliation batch_id={} expected={} processed={} missing={} unexpected={} rate={}",
        report.batchId(),
        report.totalExpected(),
        report.totalProcessed(),
        report.missingCount(),
        report.unexpectedCount(),
        report.processingRate());
  }
}
