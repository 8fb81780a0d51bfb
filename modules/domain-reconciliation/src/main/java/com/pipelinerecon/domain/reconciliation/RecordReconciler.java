package com.pipelinerecon.domain.reconciliation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Set algebra over the expected and processed record identifiers of a batch.
 *
 * <p>{@code missing = expected - processed}, {@code unexpected = processed - expected} and the
 * processing rate is the share of expected identifiers that were also processed, as a percentage.
 * Duplicate identifiers in either input collapse before any comparison.
 */
public final class RecordReconciler {
  public static final int DEFAULT_RATE_SCALE = 2;

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private RecordReconciler() {}

  public static ReconciliationOutcome reconcile(
      Collection<Long> expected, Collection<Long> processed) {
    return reconcile(expected, processed, DEFAULT_RATE_SCALE);
  }

  public static ReconciliationOutcome reconcile(
      Collection<Long> expected, Collection<Long> processed, int rateScale) {
    Set<Long> expectedIds = toIdSet(expected, "expected");
    Set<Long> processedIds = toIdSet(processed, "processed");

    List<Long> missing = sortedDifference(expectedIds, processedIds);
    List<Long> unexpected = sortedDifference(processedIds, expectedIds);
    int successful = expectedIds.size() - missing.size();

    return new ReconciliationOutcome(
        expectedIds.size(),
        processedIds.size(),
        missing,
        unexpected,
        successful,
        processingRate(successful, expectedIds.size(), rateScale));
  }

  /** Returns 0 when nothing was expected. */
  public static BigDecimal processingRate(int successful, int totalExpected, int rateScale) {
    if (rateScale < 0) {
      throw new ReconciliationDomainException("rateScale must be >= 0");
    }
    if (successful < 0 || successful > totalExpected) {
      throw new ReconciliationDomainException("successful must be between 0 and totalExpected");
    }
    if (totalExpected == 0) {
      return BigDecimal.ZERO.setScale(rateScale);
    }
    return BigDecimal.valueOf(successful)
        .multiply(HUNDRED)
        .divide(BigDecimal.valueOf(totalExpected), rateScale, RoundingMode.HALF_UP);
  }

  private static Set<Long> toIdSet(Collection<Long> ids, String name) {
    Objects.requireNonNull(ids, name + " must not be null");
    Set<Long> set = new HashSet<>(ids.size() * 2);
    for (Long id : ids) {
      set.add(Objects.requireNonNull(id, name + " must not contain null ids"));
    }
    return set;
  }

  private static List<Long> sortedDifference(Set<Long> left, Set<Long> right) {
    List<Long> difference = new ArrayList<>();
    for (Long id : left) {
      if (!right.contains(id)) {
        difference.add(id);
      }
    }
    difference.sort(null);
    return difference;
  }
}
