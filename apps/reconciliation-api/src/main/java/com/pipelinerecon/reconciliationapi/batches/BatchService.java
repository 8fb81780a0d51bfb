package com.pipelinerecon.reconciliationapi.batches;

import com.pipelinerecon.domain.reconciliation.RecordType;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BatchService {
  private static final Logger log = LoggerFactory.getLogger(BatchService.class);

  private static final int MAX_NAME_LENGTH = 255;

  private final BatchRepository batchRepository;

  public BatchService(BatchRepository batchRepository) {
    this.batchRepository = batchRepository;
  }

  @Transactional
  public BatchView create(String name, RecordType recordType, String description) {
    String normalizedName = normalizeName(name);
    if (recordType == null) {
      throw new IllegalArgumentException("recordType must not be null");
    }
    if (batchRepository.findByName(normalizedName).isPresent()) {
      throw new BatchNameConflictException(normalizedName);
    }

    long batchId;
    try {
      batchId = batchRepository.insert(normalizedName, recordType, description);
    } catch (DuplicateKeyException ex) {
      // lost a race with a concurrent create of the same name
      throw new BatchNameConflictException(normalizedName);
    }
    log.info(
        "Batch created batch_id={} name={} record_type={}", batchId, normalizedName, recordType);
    return findById(batchId);
  }

  @Transactional(readOnly = true)
  public BatchView findById(long batchId) {
    return batchRepository
        .findById(batchId)
        .orElseThrow(() -> new BatchNotFoundException(batchId));
  }

  @Transactional(readOnly = true)
  public Optional<BatchView> findByName(String name) {
    return batchRepository.findByName(normalizeName(name));
  }

  @Transactional(readOnly = true)
  public List<BatchView> list() {
    return batchRepository.findAll();
  }

  @Transactional(readOnly = true)
  public void requireExists(long batchId) {
    if (!batchRepository.existsById(batchId)) {
      throw new BatchNotFoundException(batchId);
    }
  }

  @Transactional
  public void delete(long batchId) {
    if (!batchRepository.deleteById(batchId)) {
      throw new BatchNotFoundException(batchId);
    }
    log.info("Batch deleted batch_id={}", batchId);
  }

  private static String normalizeName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    String normalized = name.trim();
    if (normalized.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException(
          "name must be at most " + MAX_NAME_LENGTH + " characters");
    }
    return normalized;
  }
}
