package com.pipelinerecon.reconciliationapi.config;

import java.time.Instant;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.stereotype.Component;

/**
 * Name and build coordinates of the running service. Falls back to {@code unknown} when the jar
 * was built without {@code META-INF/build-info.properties} (IDE runs, slice tests).
 */
@Component
public class ApplicationInfo {
  static final String UNKNOWN_VERSION = "unknown";

  private final String name;
  private final String version;
  private final Instant buildTime;

  public ApplicationInfo(
      ObjectProvider<BuildProperties> buildProperties,
      @Value("${spring.application.name:reconciliation-api}") String name) {
    BuildProperties build = buildProperties.getIfAvailable();
    this.name = name;
    this.version =
        build == null || isBlank(build.getVersion()) ? UNKNOWN_VERSION : build.getVersion();
    this.buildTime = build == null ? null : build.getTime();
  }

  public String name() {
    return name;
  }

  public String version() {
    return version;
  }

  public Instant buildTime() {
    return buildTime;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
