package com.pipelinerecon.reconciliationapi.reconciliation;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MicrometerReconciliationReporter implements ReconciliationReporter {
  private final MeterRegistry meterRegistry;

  public MicrometerReconciliationReporter(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void report(MissingRecordsReport report) {
    boolean complete = report.missingCount() == 0 && report.unexpectedCount() == 0;
    Counter.builder("reconciliation.runs.total")
        .description("Total batch reconciliations by outcome")
        .tag("outcome", complete ? "complete" : "incomplete")
        .register(meterRegistry)
        .increment();

    DistributionSummary.builder("reconciliation.missing.records")
        .description("Missing records found per reconciliation")
        .register(meterRegistry)
        .record(report.missingCount());

    DistributionSummary.builder("reconciliation.unexpected.records")
        .description("Unexpected records found per reconciliation")
        .register(meterRegistry)
        .record(report.unexpectedCount());

    DistributionSummary.builder("reconciliation.processing.rate")
        .description("Processing rate percentage per reconciliation")
        .baseUnit("percent")
        .register(meterRegistry)
        .record(report.processingRate().doubleValue());
  }
}
