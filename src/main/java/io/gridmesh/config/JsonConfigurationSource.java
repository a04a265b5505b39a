package io.gridmesh.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public final class JsonConfigurationSource implements ConfigurationSource {
    private final JsonNode root;

    public JsonConfigurationSource(JsonNode root) {
        this.root = root == null ? Jsons.mapper().createObjectNode() : root;
    }

    public static JsonConfigurationSource fromString(String json) {
        try {
            return new JsonConfigurationSource(Jsons.mapper().readTree(json));
        } catch (IOException e) {
            throw new ConfigurationException("/", "configuration document is not valid JSON", e);
        }
    }

    public static JsonConfigurationSource fromFile(Path file) throws IOException {
        return new JsonConfigurationSource(Jsons.mapper().readTree(file.toFile()));
    }

    @Override
    public Optional<JsonNode> node(String path) {
        return ConfigurationSource.resolve(root, path);
    }
}
