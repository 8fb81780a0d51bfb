package com.pipelinerecon.reconciliationapi.sample;

import java.util.List;

/** Shape of the bundled sample file. Enum values are kept as text and parsed on load. */
public record SampleDataset(
    SampleBatch batch, List<SampleRecord> expectedRecords, List<SampleRecord> processedRecords) {

  public record SampleBatch(String batchName, String recordType, String description) {}

  public record SampleRecord(long recordId, String status, String metadata) {}
}
