package com.pipelinerecon.reconciliationapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {
  /** Decimal places kept in processing rates. */
  private int rateScale = 2;

  private final Bulk bulk = new Bulk();

  public int getRateScale() {
    return rateScale;
  }

  public void setRateScale(int rateScale) {
    if (rateScale < 0) {
      throw new IllegalArgumentException("reconciliation.rate-scale must be >= 0");
    }
    this.rateScale = rateScale;
  }

  public Bulk getBulk() {
    return bulk;
  }

  public static class Bulk {
    private int maxRecords = 10_000;

    public int getMaxRecords() {
      return maxRecords;
    }

    public void setMaxRecords(int maxRecords) {
      if (maxRecords < 1) {
        throw new IllegalArgumentException("reconciliation.bulk.max-records must be >= 1");
      }
      this.maxRecords = maxRecords;
    }
  }
}
