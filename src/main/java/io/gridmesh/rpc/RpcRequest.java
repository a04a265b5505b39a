package io.gridmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridmesh.util.Jsons;

import java.util.List;
import java.util.Map;

public record RpcRequest(String method, ArrayNode args, ObjectNode kwargs) {
    public RpcRequest {
        method = method == null ? "" : method.trim();
        args = args == null ? JsonNodeFactory.instance.arrayNode() : args;
        kwargs = kwargs == null ? JsonNodeFactory.instance.objectNode() : kwargs;
    }

    public static RpcRequest of(String method, List<?> args, Map<String, ?> kwargs) {
        ArrayNode argNode = JsonNodeFactory.instance.arrayNode();
        if (args != null) {
            for (Object arg : args) {
                argNode.add(Jsons.compact().<JsonNode>valueToTree(arg));
            }
        }
        ObjectNode kwargNode = kwargs == null
                ? JsonNodeFactory.instance.objectNode()
                : Jsons.compact().valueToTree(kwargs);
        return new RpcRequest(method, argNode, kwargNode);
    }

    public static RpcRequest fromNode(JsonNode node) {
        if (node == null || !node.isObject() || !node.path("method").isTextual()) {
            throw new IllegalArgumentException("call frame needs a textual method");
        }
        JsonNode args = node.get("args");
        JsonNode kwargs = node.get("kwargs");
        if (args != null && !args.isNull() && !args.isArray()) {
            throw new IllegalArgumentException("args must be an array");
        }
        if (kwargs != null && !kwargs.isNull() && !kwargs.isObject()) {
            throw new IllegalArgumentException("kwargs must be an object");
        }
        return new RpcRequest(
                node.path("method").asText(),
                args instanceof ArrayNode array ? array : null,
                kwargs instanceof ObjectNode object ? object : null
        );
    }

    public ObjectNode toNode() {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        out.put("method", method);
        out.set("args", args);
        out.set("kwargs", kwargs);
        return out;
    }

    public JsonNode arg(int index, String name) {
        if (index < args.size() && !args.get(index).isNull()) {
            return args.get(index);
        }
        JsonNode named = kwargs.get(name);
        return named == null || named.isNull() ? null : named;
    }

    public String textArg(int index, String name) {
        JsonNode value = arg(index, name);
        if (value == null || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
