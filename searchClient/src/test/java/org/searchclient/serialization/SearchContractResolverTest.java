package org.searchclient.serialization;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import org.searchclient.settings.ConnectionSettings;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchContractResolverTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    interface Named {}

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class RepositorySettings implements Named {
        private String displayName;
        @JsonProperty("repository_type")
        private String repositoryType;
        private Map<String, Integer> settingsByNode;
    }

    private static RepositorySettings sample() {
        return new RepositorySettings("Backups", "fs", Map.of("NodeA", 1, "nodeA", 2));
    }

    private static JsonNode writeTree(DefaultSearchSerializer serializer, Object value) throws IOException {
        var out = new ByteArrayOutputStream();
        serializer.serialize(value, out, SerializationFormatting.NONE);
        return JSON.readTree(out.toByteArray());
    }

    private static <T> T read(DefaultSearchSerializer serializer, Class<T> type, JsonNode tree) throws IOException {
        return serializer.deserialize(type, new ByteArrayInputStream(
            JSON.writeValueAsString(tree).getBytes(StandardCharsets.UTF_8)));
    }

    private static String snakeCase(String name) {
        return name.replaceAll("([A-Z])", "_$1").toLowerCase();
    }

    @Test
    void defaultSettingsKeepJavaPropertyNames() throws IOException {
        var serializer = new DefaultSearchSerializer(ConnectionSettings.defaults());

        var tree = writeTree(serializer, sample());

        assertEquals("Backups", tree.get("displayName").textValue());
        assertEquals("fs", tree.get("repository_type").textValue());
        assertTrue(tree.get("settingsByNode").has("NodeA"));
    }

    @Test
    void propertyMappingRenamesImplicitPropertiesBothWays() throws IOException {
        var settings = ConnectionSettings.builder()
            .propertyMappings(Map.of(RepositorySettings.class, Map.of("displayName", "display_name")))
            .build();
        var serializer = new DefaultSearchSerializer(settings);

        var tree = writeTree(serializer, sample());

        assertFalse(tree.has("displayName"));
        assertEquals("Backups", tree.get("display_name").textValue());
        assertEquals(sample(), read(serializer, RepositorySettings.class, tree));
    }

    @Test
    void explicitNamesAreNotRemapped() throws IOException {
        var settings = ConnectionSettings.builder()
            .propertyMappings(Map.of(RepositorySettings.class, Map.of("repositoryType", "kind")))
            .fieldNameInferrer(String::toUpperCase)
            .build();
        var serializer = new DefaultSearchSerializer(settings);

        var tree = writeTree(serializer, sample());

        assertEquals("fs", tree.get("repository_type").textValue());
        assertFalse(tree.has("kind"));
    }

    @Test
    void fieldNameInferrerAppliesToImplicitNamesButNotMapKeys() throws IOException {
        var settings = ConnectionSettings.builder()
            .fieldNameInferrer(SearchContractResolverTest::snakeCase)
            .build();
        var serializer = new DefaultSearchSerializer(settings);

        var tree = writeTree(serializer, sample());

        assertEquals("Backups", tree.get("display_name").textValue());
        var byNode = tree.get("settings_by_node");
        assertEquals(1, byNode.get("NodeA").intValue());
        assertEquals(2, byNode.get("nodeA").intValue());
        assertEquals(sample(), read(serializer, RepositorySettings.class, tree));
    }

    @Test
    void mappingsDeclaredOnSupertypesApply() throws IOException {
        var settings = ConnectionSettings.builder()
            .propertyMappings(Map.of(Named.class, Map.of("displayName", "name")))
            .build();
        var serializer = new DefaultSearchSerializer(settings);

        var tree = writeTree(serializer, sample());

        assertEquals("Backups", tree.get("name").textValue());
    }

    @Test
    void laterChangesToMappingsDoNotReachExistingSerializer() throws IOException {
        var mappings = new HashMap<Class<?>, Map<String, String>>();
        mappings.put(RepositorySettings.class, new HashMap<>(Map.of("displayName", "display_name")));
        var serializer = new DefaultSearchSerializer(ConnectionSettings.builder().propertyMappings(mappings).build());

        mappings.get(RepositorySettings.class).put("displayName", "changed");
        mappings.put(Named.class, Map.of("displayName", "also_changed"));

        var tree = writeTree(serializer, sample());
        assertEquals("Backups", tree.get("display_name").textValue());
        assertFalse(tree.has("changed"));
    }

    @Test
    void nearestMappingWins() {
        var settings = ConnectionSettings.builder()
            .propertyMappings(Map.of(
                Named.class, Map.of("displayName", "name"),
                RepositorySettings.class, Map.of("displayName", "display")))
            .build();
        var resolver = new SearchContractResolver(settings);

        assertEquals("display", resolver.resolvePropertyName(RepositorySettings.class, "displayName"));
        assertEquals("name", resolver.resolvePropertyName(Named.class, "displayName"));
    }

    @Test
    void unmappedPropertiesFallBackToInferrer() {
        var resolver = new SearchContractResolver(ConnectionSettings.builder()
            .fieldNameInferrer(SearchContractResolverTest::snakeCase)
            .build());

        assertEquals("settings_by_node", resolver.resolvePropertyName(RepositorySettings.class, "settingsByNode"));
        assertEquals("shard_count", resolver.resolvePropertyName(null, "shardCount"));
    }

    @Test
    void camelCaseLowersOnlyTheLeadingCharacter() {
        assertEquals("name", ConnectionSettings.camelCase("Name"));
        assertEquals("nodeId", ConnectionSettings.camelCase("NodeId"));
        assertEquals("nodeId", ConnectionSettings.camelCase("nodeId"));
        assertEquals("", ConnectionSettings.camelCase(""));
    }
}
