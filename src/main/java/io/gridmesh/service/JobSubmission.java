package io.gridmesh.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridmesh.jobs.JobRequirements;

public record JobSubmission(int priority, JobRequirements requirements, JsonNode payload) {
}
