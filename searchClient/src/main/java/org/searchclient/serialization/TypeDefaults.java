package org.searchclient.serialization;

import java.util.Map;

import com.fasterxml.jackson.databind.JavaType;

/**
 * Zero values for the types a response body can be read into.
 */
public final class TypeDefaults {
    private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS = Map.of(
        boolean.class, false,
        byte.class, (byte) 0,
        short.class, (short) 0,
        int.class, 0,
        long.class, 0L,
        float.class, 0.0f,
        double.class, 0.0d,
        char.class, '\0'
    );

    private TypeDefaults() {
        // Utility class, no instances
    }

    /**
     * @return the boxed zero value for a primitive type, null for any other type
     */
    public static Object defaultValue(Class<?> type) {
        if (type == null || !type.isPrimitive()) {
            return null;
        }
        return PRIMITIVE_DEFAULTS.get(type);
    }

    public static Object defaultValue(JavaType type) {
        return type == null ? null : defaultValue(type.getRawClass());
    }
}
