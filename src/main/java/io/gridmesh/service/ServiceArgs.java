package io.gridmesh.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.util.Jsons;

final class ServiceArgs {
    private ServiceArgs() {
    }

    static <T> Result<T> convert(JsonNode node, Class<T> type, String what) {
        if (node == null || node.isNull()) {
            return Result.fail(ErrorCode.INVALID_JOB, what + " is missing");
        }
        try {
            return Result.ok(Jsons.compact().treeToValue(node, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Result.fail(ErrorCode.INVALID_JOB, what + " is not well formed");
        }
    }

    static Result<String> requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            return Result.fail(ErrorCode.INVALID_JOB, what + " is missing");
        }
        return Result.ok(value);
    }
}
