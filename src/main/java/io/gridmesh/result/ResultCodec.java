package io.gridmesh.result;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridmesh.util.Jsons;

import java.io.IOException;

public final class ResultCodec {
    private ResultCodec() {
    }

    public static ObjectNode toNode(Result<?> result) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        if (result.isOk()) {
            out.put("ok", true);
            out.set("value", Jsons.compact().valueToTree(result.value()));
            return out;
        }
        out.put("ok", false);
        writeFailure(out, result.failure());
        return out;
    }

    public static String encode(Result<?> result) {
        return Jsons.toCompactJson(toNode(result));
    }

    public static Result<JsonNode> decode(String raw) {
        JsonNode root;
        try {
            root = Jsons.compact().readTree(raw == null ? "" : raw);
        } catch (IOException e) {
            return Result.fail(ErrorCode.INTERNAL_ERROR, "undecodable result frame");
        }
        return fromNode(root);
    }

    public static Result<JsonNode> fromNode(JsonNode root) {
        if (root == null || !root.isObject() || !root.path("ok").isBoolean()) {
            return Result.fail(ErrorCode.INTERNAL_ERROR, "result frame has no ok flag");
        }
        if (root.path("ok").booleanValue()) {
            JsonNode value = root.get("value");
            return Result.ok(value == null || value.isNull() ? null : value);
        }
        try {
            return Result.fail(readFailure(root));
        } catch (IllegalArgumentException e) {
            return Result.fail(ErrorCode.INTERNAL_ERROR, "result frame has unknown error code");
        }
    }

    public static <T> Result<T> decode(String raw, Class<T> type) {
        return decode(raw).flatMap(node -> convert(node, Jsons.compact().constructType(type)));
    }

    public static <T> Result<T> decode(String raw, TypeReference<T> type) {
        return decode(raw).flatMap(node -> convert(node, Jsons.compact().getTypeFactory().constructType(type)));
    }

    public static <T> Result<T> convert(JsonNode node, Class<T> type) {
        return convert(node, Jsons.compact().constructType(type));
    }

    private static <T> Result<T> convert(JsonNode node, JavaType type) {
        if (node == null || node.isNull()) {
            return Result.ok(null);
        }
        try {
            T value = Jsons.compact().convertValue(node, type);
            return Result.ok(value);
        } catch (IllegalArgumentException e) {
            return Result.fail(ErrorCode.INTERNAL_ERROR, "result payload does not match " + type.getTypeName());
        }
    }

    private static void writeFailure(ObjectNode out, Failure failure) {
        out.put("code", failure.code().wireName());
        out.put("message", failure.message());
        if (failure.cause() != null) {
            ObjectNode cause = out.putObject("cause");
            writeFailure(cause, failure.cause());
        }
    }

    private static Failure readFailure(JsonNode node) {
        ErrorCode code = ErrorCode.fromString(node.path("code").asText(""));
        String message = node.path("message").asText("");
        JsonNode cause = node.get("cause");
        return new Failure(code, message, cause != null && cause.isObject() ? readFailure(cause) : null);
    }
}
