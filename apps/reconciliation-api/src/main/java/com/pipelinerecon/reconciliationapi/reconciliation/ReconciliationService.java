package com.pipelinerecon.reconciliationapi.reconciliation;

import com.pipelinerecon.domain.reconciliation.RecordReconciler;
import com.pipelinerecon.domain.reconciliation.RecordStatus;
import com.pipelinerecon.domain.reconciliation.ReconciliationOutcome;
import com.pipelinerecon.reconciliationapi.batches.BatchService;
import com.pipelinerecon.reconciliationapi.batches.BatchView;
import com.pipelinerecon.reconciliationapi.config.ReconciliationProperties;
import com.pipelinerecon.reconciliationapi.records.RecordRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compares what a batch expected against what it processed. Every call reads both id collections
 * in one repeatable-read transaction, so a report never mixes two snapshots.
 */
@Service
public class ReconciliationService {
  private final BatchService batchService;
  private final RecordIdSource recordIdSource;
  private final RecordRepository recordRepository;
  private final List<ReconciliationReporter> reporters;
  private final ReconciliationProperties properties;

  public ReconciliationService(
      BatchService batchService,
      RecordIdSource recordIdSource,
      RecordRepository recordRepository,
      List<ReconciliationReporter> reporters,
      ReconciliationProperties properties) {
    this.batchService = batchService;
    this.recordIdSource = recordIdSource;
    this.recordRepository = recordRepository;
    this.reporters = List.copyOf(reporters);
    this.properties = properties;
  }

  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public MissingRecordsReport reconcile(long batchId) {
    BatchView batch = batchService.findById(batchId);
    ReconciliationOutcome outcome = compute(batchId);
    MissingRecordsReport report =
        new MissingRecordsReport(
            batch.id(),
            batch.name(),
            outcome.totalExpected(),
            outcome.totalProcessed(),
            outcome.missingCount(),
            outcome.missingRecords(),
            outcome.processingRate(),
            outcome.unexpectedCount(),
            outcome.unexpectedRecords());
    for (ReconciliationReporter reporter : reporters) {
      reporter.report(report);
    }
    return report;
  }

  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public ProcessingStatusView processingStatus(long batchId) {
    BatchView batch = batchService.findById(batchId);
    List<Long> expected = recordIdSource.fetchIds(batchId, RecordStatus.EXPECTED);
    List<Long> processed = recordIdSource.fetchIds(batchId, RecordStatus.PROCESSED);
    return new ProcessingStatusView(
        batch.id(),
        batch.name(),
        batch.recordType(),
        List.copyOf(expected),
        List.copyOf(processed),
        expected.size(),
        processed.size());
  }

  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public BatchStatisticsView statistics(long batchId) {
    BatchView batch = batchService.findById(batchId);
    long totalRecords = recordRepository.countByBatchId(batchId);
    long expectedCount = recordRepository.countByBatchIdAndStatus(batchId, RecordStatus.EXPECTED);
    long processedCount =
        recordRepository.countByBatchIdAndStatus(batchId, RecordStatus.PROCESSED);
    ReconciliationOutcome outcome = compute(batchId);
    return new BatchStatisticsView(
        batch.id(),
        batch.name(),
        totalRecords,
        expectedCount,
        processedCount,
        outcome.missingCount(),
        outcome.processingRate());
  }

  private ReconciliationOutcome compute(long batchId) {
    List<Long> expected = recordIdSource.fetchIds(batchId, RecordStatus.EXPECTED);
    List<Long> processed = recordIdSource.fetchIds(batchId, RecordStatus.PROCESSED);
    return RecordReconciler.reconcile(expected, processed, properties.getRateScale());
  }
}
