package com.pipelinerecon.reconciliationapi.api;

import java.time.Instant;

public record VersionResponse(String application, String version, Instant buildTime) {}
