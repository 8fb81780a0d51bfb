package com.pipelinerecon.reconciliationapi.api;

import java.util.Map;

public record MessageResponse(String message, Map<String, Object> details) {}
