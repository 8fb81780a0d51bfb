package com.pipelinerecon.reconciliationapi.sample;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipelinerecon.domain.reconciliation.RecordStatus;
import com.pipelinerecon.domain.reconciliation.RecordType;
import com.pipelinerecon.reconciliationapi.batches.BatchService;
import com.pipelinerecon.reconciliationapi.batches.BatchView;
import com.pipelinerecon.reconciliationapi.reconciliation.MissingRecordsReport;
import com.pipelinerecon.reconciliationapi.reconciliation.ReconciliationService;
import com.pipelinerecon.reconciliationapi.records.NewRecord;
import com.pipelinerecon.reconciliationapi.records.RecordService;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Seeds one batch of sample orders at startup and logs its reconciliation. Runs only when {@code
 * reconciliation.sample-data.enabled=true}.
 */
@Component
@ConditionalOnProperty(
    prefix = "reconciliation.sample-data",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false)
public class SampleDataLoader implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(SampleDataLoader.class);

  private final SampleDataProperties properties;
  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;
  private final BatchService batchService;
  private final RecordService recordService;
  private final ReconciliationService reconciliationService;

  public SampleDataLoader(
      SampleDataProperties properties,
      ResourceLoader resourceLoader,
      ObjectMapper objectMapper,
      BatchService batchService,
      RecordService recordService,
      ReconciliationService reconciliationService) {
    this.properties = properties;
    this.resourceLoader = resourceLoader;
    this.objectMapper = objectMapper;
    this.batchService = batchService;
    this.recordService = recordService;
    this.reconciliationService = reconciliationService;
  }

  @Override
  public void run(ApplicationArguments args) {
    load(readDataset());
  }

  public MissingRecordsReport load(SampleDataset dataset) {
    if (dataset == null || dataset.batch() == null) {
      throw new IllegalArgumentException("sample dataset must define a batch");
    }
    String batchName = dataset.batch().batchName();
    List<NewRecord> expectedRecords =
        toNewRecords(dataset.expectedRecords(), RecordStatus.EXPECTED);
    List<NewRecord> processedRecords =
        toNewRecords(dataset.processedRecords(), RecordStatus.PROCESSED);
    if (properties.isClearExisting()) {
      batchService
          .findByName(batchName)
          .ifPresent(
              existing -> {
                batchService.delete(existing.id());
                log.info("Sample batch replaced name={} previous_id={}", batchName, existing.id());
              });
    }

    BatchView batch =
        batchService.create(
            batchName,
            RecordType.parse(dataset.batch().recordType()),
            dataset.batch().description());
    int expected = upload(batch.id(), expectedRecords);
    int processed = upload(batch.id(), processedRecords);
    log.info(
        "Sample data loaded batch_id={} name={} expected_rows={} processed_rows={}",
        batch.id(),
        batch.name(),
        expected,
        processed);
    return reconciliationService.reconcile(batch.id());
  }

  private int upload(long batchId, List<NewRecord> records) {
    if (records.isEmpty()) {
      return 0;
    }
    return recordService.bulkCreate(batchId, records);
  }

  // The list an entry sits in decides its status; an explicit status must agree with it.
  private static List<NewRecord> toNewRecords(
      List<SampleDataset.SampleRecord> records, RecordStatus listStatus) {
    if (records == null) {
      return List.of();
    }
    return records.stream()
        .map(
            r -> {
              if (r.status() != null
                  && !r.status().isBlank()
                  && RecordStatus.parse(r.status()) != listStatus) {
                throw new IllegalArgumentException(
                    "sample record "
                        + r.recordId()
                        + " has status '"
                        + r.status()
                        + "' but is listed under "
                        + listStatus.wireValue()
                        + " records");
              }
              return new NewRecord(r.recordId(), listStatus, r.metadata());
            })
        .toList();
  }

  private SampleDataset readDataset() {
    Resource resource = resourceLoader.getResource(properties.getLocation());
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readValue(in, SampleDataset.class);
    } catch (IOException ex) {
      throw new UncheckedIOException(
          "Failed to read sample data from " + properties.getLocation(), ex);
    }
  }
}
