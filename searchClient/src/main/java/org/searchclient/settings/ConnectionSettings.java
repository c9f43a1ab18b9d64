package org.searchclient.settings;

import java.util.Map;
import java.util.function.UnaryOperator;

import org.searchclient.serialization.AsyncFailurePolicy;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Client-wide settings consulted when the serializer and its contract resolver are built.
 * Use {@link #toBuilder()} to derive a variant. The property mappings map is held as given; the
 * contract resolver takes its own copy when it is created, so later changes to that map do not
 * reach an existing serializer.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ConnectionSettings {
    public static final int DEFAULT_WRITE_BUFFER_SIZE = 1024;

    /**
     * Maps a Java property name to its wire name when the property has no explicit name.
     */
    @Builder.Default
    private final UnaryOperator<String> fieldNameInferrer = ConnectionSettings::camelCase;

    /**
     * Per-type overrides from Java property name to wire name. These win over the field name inferrer.
     */
    @Builder.Default
    private final Map<Class<?>, Map<String, String>> propertyMappings = Map.of();

    @Builder.Default
    private final AsyncFailurePolicy asyncFailurePolicy = AsyncFailurePolicy.DEFAULT_ON_FAILURE;

    /**
     * Size, in characters, of the buffer the serializer writes request bodies through.
     */
    @Builder.Default
    private final int writeBufferSize = DEFAULT_WRITE_BUFFER_SIZE;

    /**
     * Forces indented output even when a caller asks for compact JSON.
     */
    private final boolean prettyJson;

    public static ConnectionSettings defaults() {
        return ConnectionSettings.builder().build();
    }

    public static String camelCase(String name) {
        if (name == null || name.isEmpty() || Character.isLowerCase(name.charAt(0))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
