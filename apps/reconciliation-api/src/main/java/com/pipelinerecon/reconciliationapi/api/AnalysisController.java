package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.reconciliationapi.reconciliation.ReconciliationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/analysis")
public class AnalysisController {
  private final ReconciliationService reconciliationService;

  public AnalysisController(ReconciliationService reconciliationService) {
    this.reconciliationService = reconciliationService;
  }

  @GetMapping("/missing/{batchId}")
  public ResponseEntity<MissingRecordsResponse> missing(@PathVariable("batchId") long batchId) {
    return ResponseEntity.ok(MissingRecordsResponse.from(reconciliationService.reconcile(batchId)));
  }

  @GetMapping("/status/{batchId}")
  public ResponseEntity<ProcessingStatusResponse> status(@PathVariable("batchId") long batchId) {
    return ResponseEntity.ok(
        ProcessingStatusResponse.from(reconciliationService.processingStatus(batchId)));
  }

  @GetMapping("/statistics/{batchId}")
  public ResponseEntity<BatchStatisticsResponse> statistics(
      @PathVariable("batchId") long batchId) {
    return ResponseEntity.ok(
        BatchStatisticsResponse.from(reconciliationService.statistics(batchId)));
  }
}
