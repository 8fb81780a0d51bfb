package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.domain.reconciliation.RecordType;
import com.pipelinerecon.reconciliationapi.batches.BatchService;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/batches")
public class BatchController {
  private final BatchService batchService;

  public BatchController(BatchService batchService) {
    this.batchService = batchService;
  }

  @PostMapping
  public ResponseEntity<BatchResponse> create(@Valid @RequestBody CreateBatchRequest request) {
    BatchResponse response =
        BatchResponse.from(
            batchService.create(
                request.name(), RecordType.parse(request.recordType()), request.description()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping
  public ResponseEntity<List<BatchResponse>> list() {
    return ResponseEntity.ok(batchService.list().stream().map(BatchResponse::from).toList());
  }

  @GetMapping("/{batchId}")
  public ResponseEntity<BatchResponse> get(@PathVariable("batchId") long batchId) {
    return ResponseEntity.ok(BatchResponse.from(batchService.findById(batchId)));
  }

  @DeleteMapping("/{batchId}")
  public ResponseEntity<MessageResponse> delete(@PathVariable("batchId") long batchId) {
    batchService.delete(batchId);
    return ResponseEntity.ok(
        new MessageResponse(
            "Successfully deleted batch " + batchId, Map.of("batchId", batchId)));
  }
}
