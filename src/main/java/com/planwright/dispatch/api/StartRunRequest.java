package com.planwright.dispatch.api;

/**
 * Body of {@code POST /api/v1/plans/{planId}/runs}. Absent fields take the configured defaults.
 */
public record StartRunRequest(Integer batchSize, Boolean autoCommit, Boolean ignoreSequential) {}
