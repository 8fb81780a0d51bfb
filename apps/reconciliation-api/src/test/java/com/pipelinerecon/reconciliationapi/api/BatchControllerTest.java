package com.pipelinerecon.reconciliationapi.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pipelinerecon.domain.reconciliation.RecordType;
import com.pipelinerecon.reconciliationapi.batches.BatchNameConflictException;
import com.pipelinerecon.reconciliationapi.batches.BatchNotFoundException;
import com.pipelinerecon.reconciliationapi.batches.BatchService;
import com.pipelinerecon.reconciliationapi.batches.BatchView;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = BatchController.class)
class BatchControllerTest {
  @Autowired private MockMvc mockMvc;
  @MockBean private BatchService batchService;

  @Test
  void shouldCreateBatch() throws Exception {
    when(batchService.create("test_batch_orders", RecordType.ORDER, "Test batch"))
        .thenReturn(view(1L, "test_batch_orders"));

    mockMvc
        .perform(
            post("/v1/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"test_batch_orders","recordType":"order","description":"Test batch"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(1))
        .andExpect(jsonPath("$.name").value("test_batch_orders"))
        .andExpect(jsonPath("$.recordType").value("order"));
  }

  @Test
  void shouldReturnConflictForDuplicateName() throws Exception {
    when(batchService.create("dup", RecordType.ORDER, null))
        .thenThrow(new BatchNameConflictException("dup"));

    mockMvc
        .perform(
            post("/v1/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"dup\",\"recordType\":\"ORDER\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.type").value("/problems/batch-name-conflict"));
  }

  @Test
  void shouldRejectMissingName() throws Exception {
    mockMvc
        .perform(
            post("/v1/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"recordType\":\"order\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("/problems/validation-error"))
        .andExpect(jsonPath("$.errors[0].field").value("name"));
    verify(batchService, never()).create(anyString(), any(), any());
  }

  @Test
  void shouldRejectUnknownRecordType() throws Exception {
    mockMvc
        .perform(
            post("/v1/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"b\",\"recordType\":\"invoice\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("/problems/invalid-argument"))
        .andExpect(jsonPath("$.detail").value("Unsupported record type: invoice"));
  }

  @Test
  void shouldListBatches() throws Exception {
    when(batchService.list()).thenReturn(List.of(view(1L, "a"), view(2L, "b")));

    mockMvc
        .perform(get("/v1/batches"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[1].name").value("b"));
  }

  @Test
  void shouldReturnNotFoundForUnknownBatch() throws Exception {
    when(batchService.findById(999L)).thenThrow(new BatchNotFoundException(999L));

    mockMvc
        .perform(get("/v1/batches/999"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("/problems/batch-not-found"))
        .andExpect(jsonPath("$.batchId").value(999));
  }

  @Test
  void shouldRejectNonNumericBatchId() throws Exception {
    mockMvc
        .perform(get("/v1/batches/abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("/problems/type-mismatch"));
  }

  @Test
  void shouldDeleteBatch() throws Exception {
    mockMvc
        .perform(delete("/v1/batches/4"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Successfully deleted batch 4"))
        .andExpect(jsonPath("$.details.batchId").value(4));
    verify(batchService).delete(eq(4L));
  }

  @Test
  void shouldReturnNotFoundWhenDeletingUnknownBatch() throws Exception {
    doThrow(new BatchNotFoundException(5L)).when(batchService).delete(5L);

    mockMvc.perform(delete("/v1/batches/5")).andExpect(status().isNotFound());
  }

  private static BatchView view(long id, String name) {
    return new BatchView(
        id, name, RecordType.ORDER, "Test batch", Instant.parse("2026-10-19T08:00:00Z"), null);
  }
}
