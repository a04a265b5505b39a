package io.gridmesh.rpc;

public record MethodKey(String system, String service, String method) {
    public MethodKey {
        system = require(system, "system");
        service = require(service, "service");
        method = require(method, "method");
    }

    public static MethodKey parse(String qualified) {
        String[] parts = qualified == null ? new String[0] : qualified.split("/");
        if (parts.length != 3) {
            throw new IllegalArgumentException("method must be System/Service/method: " + qualified);
        }
        return new MethodKey(parts[0], parts[1], parts[2]);
    }

    public String servicePath() {
        return system + "/" + service;
    }

    @Override
    public String toString() {
        return system + "/" + service + "/" + method;
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank() || value.contains("/")) {
            throw new IllegalArgumentException("invalid " + field + ": " + value);
        }
        return value.trim();
    }
}
