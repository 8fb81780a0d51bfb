package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.domain.reconciliation.RecordStatus;
import com.pipelinerecon.reconciliationapi.records.NewRecord;
import com.pipelinerecon.reconciliationapi.records.RecordService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class RecordController {
  private final RecordService recordService;

  public RecordController(RecordService recordService) {
    this.recordService = recordService;
  }

  @PostMapping("/batches/{batchId}/records")
  public ResponseEntity<RecordResponse> create(
      @PathVariable("batchId") long batchId, @Valid @RequestBody CreateRecordRequest request) {
    RecordResponse response =
        RecordResponse.from(recordService.create(batchId, request.toNewRecord()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @PostMapping("/records/bulk")
  public ResponseEntity<MessageResponse> bulkUpload(
      @Valid @RequestBody BulkRecordUploadRequest request) {
    List<NewRecord> records =
        request.records().stream().map(CreateRecordRequest::toNewRecord).toList();
    int count = recordService.bulkCreate(request.batchId(), records);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new MessageResponse(
                "Successfully uploaded " + count + " records",
                Map.of("count", count, "batchId", request.batchId())));
  }

  @GetMapping("/batches/{batchId}/records")
  public ResponseEntity<List<RecordResponse>> list(
      @PathVariable("batchId") long batchId,
      @RequestParam(name = "status", required = false) String status) {
    RecordStatus parsedStatus =
        status == null || status.isBlank() ? null : RecordStatus.parse(status);
    List<RecordResponse> response =
        recordService.listByBatchAndStatus(batchId, parsedStatus).stream()
            .map(RecordResponse::from)
            .toList();
    return ResponseEntity.ok(response);
  }

  @DeleteMapping("/batches/{batchId}/records")
  public ResponseEntity<MessageResponse> purge(@PathVariable("batchId") long batchId) {
    int deleted = recordService.purge(batchId);
    return ResponseEntity.ok(
        new MessageResponse(
            "Successfully deleted all records for batch " + batchId,
            Map.of("deletedCount", deleted, "batchId", batchId)));
  }
}
