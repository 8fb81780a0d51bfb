package com.pipelinerecon.reconciliationapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** OpenAPI metadata plus two doc groups: the batch/record/analysis API and the ops endpoints. */
@Configuration
public class OpenApiConfig {
  private static final String OPS_VERSION_PATH = "/v1/version";

  @Bean
  public OpenAPI reconciliationOpenApi(ApplicationInfo applicationInfo) {
    Info info =
        new Info()
            .title(applicationInfo.name())
            .version(applicationInfo.version())
            .description(
                "Detects missing and unexpected pipeline records by comparing expected and"
                    + " processed record ids per batch");
    return new OpenAPI().info(info);
  }

  @Bean
  public GroupedOpenApi reconciliationGroup() {
    return GroupedOpenApi.builder()
        .group("public")
        .pathsToMatch("/v1/batches/**", "/v1/records/**", "/v1/analysis/**")
        .build();
  }

  @Bean
  public GroupedOpenApi opsGroup() {
    return GroupedOpenApi.builder()
        .group("ops")
        .pathsToMatch(OPS_VERSION_PATH, "/actuator/health", "/actuator/health/**")
        .build();
  }
}
