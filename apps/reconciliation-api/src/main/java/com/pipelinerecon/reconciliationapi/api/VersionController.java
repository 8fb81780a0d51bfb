package com.pipelinerecon.reconciliationapi.api;

import com.pipelinerecon.reconciliationapi.config.ApplicationInfo;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class VersionController {
  private final ApplicationInfo applicationInfo;

  public VersionController(ApplicationInfo applicationInfo) {
    this.applicationInfo = applicationInfo;
  }

  @GetMapping("/v1/version")
  public VersionResponse version() {
    return new VersionResponse(
        applicationInfo.name(), applicationInfo.version(), applicationInfo.buildTime());
  }
}
