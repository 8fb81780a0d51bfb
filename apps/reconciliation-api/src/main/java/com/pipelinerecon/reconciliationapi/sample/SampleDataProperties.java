package com.pipelinerecon.reconciliationapi.sample;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "reconciliation.sample-data")
public class SampleDataProperties {
  private boolean enabled;
  private String location = "classpath:sample/sample_orders.json";
  private boolean clearExisting = true;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getLocation() {
    return location;
  }

  public void setLocation(String location) {
    this.location = location;
  }

  public boolean isClearExisting() {
    return clearExisting;
  }

  public void setClearExisting(boolean clearExisting) {
    this.clearExisting = clearExisting;
  }
}
