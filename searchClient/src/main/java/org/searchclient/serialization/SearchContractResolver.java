package org.searchclient.serialization;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import org.searchclient.settings.ConnectionSettings;

import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.introspect.AnnotatedField;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.AnnotatedMethod;
import com.fasterxml.jackson.databind.introspect.AnnotatedParameter;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.Getter;

/**
 * The contract resolver the serializer is built around. It names implicitly named bean properties
 * from the client's {@link ConnectionSettings}: a per-type property mapping when one exists, otherwise
 * the settings' field name inferrer.
 *
 * Properties with an explicit {@code @JsonProperty} name keep that name, and map keys are never
 * rewritten, so node ids and other opaque keys survive verbatim.
 */
public class SearchContractResolver implements ContractResolver {
    private static final String MODULE_NAME = "SearchContractResolver";

    @Getter
    private final ConnectionSettings settings;
    private final UnaryOperator<String> fieldNameInferrer;
    private final Map<Class<?>, Map<String, String>> propertyMappings;
    private final LoadingCache<Class<?>, Map<String, String>> mappingsByType;

    public SearchContractResolver(ConnectionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.fieldNameInferrer = Objects.requireNonNull(settings.getFieldNameInferrer(), "fieldNameInferrer");
        this.propertyMappings = Objects.requireNonNullElse(settings.getPropertyMappings(),
                Map.<Class<?>, Map<String, String>>of())
            .entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> Map.copyOf(e.getValue())));
        this.mappingsByType = Caffeine.newBuilder()
            .weakKeys()
            .build(this::collectMappings);
    }

    @Override
    public Module asModule() {
        return new SimpleModule(MODULE_NAME) {
            @Override
            public void setupModule(SetupContext context) {
                super.setupModule(context);
                ObjectMapper mapper = context.getOwner();
                mapper.setPropertyNamingStrategy(new SettingsNamingStrategy());
            }
        };
    }

    /**
     * Resolves the wire name of an implicitly named property.
     *
     * @param declaringType the type that declares the property's accessor, may be null
     * @param implicitName the name Jackson derived from the accessor
     * @return the name written to and read from the wire
     */
    public String resolvePropertyName(Class<?> declaringType, String implicitName) {
        if (declaringType != null) {
            var mapped = mappingsByType.get(declaringType).get(implicitName);
            if (mapped != null) {
                return mapped;
            }
        }
        return fieldNameInferrer.apply(implicitName);
    }

    /**
     * Nearest declaration wins: the type's own mappings, then its interfaces, then its superclass chain.
     */
    private Map<String, String> collectMappings(Class<?> type) {
        var collected = new HashMap<String, String>();
        collectInto(type, collected);
        return Map.copyOf(collected);
    }

    private void collectInto(Class<?> type, Map<String, String> collected) {
        if (type == null || type == Object.class) {
            return;
        }
        propertyMappings.getOrDefault(type, Map.of()).forEach(collected::putIfAbsent);
        for (Class<?> iface : type.getInterfaces()) {
            collectInto(iface, collected);
        }
        collectInto(type.getSuperclass(), collected);
    }

    private class SettingsNamingStrategy extends PropertyNamingStrategy {
        private static final long serialVersionUID = 1L;

        @Override
        public String nameForField(MapperConfig<?> config, AnnotatedField field, String defaultName) {
            return resolve(field, defaultName);
        }

        @Override
        public String nameForGetterMethod(MapperConfig<?> config, AnnotatedMethod method, String defaultName) {
            return resolve(method, defaultName);
        }

        @Override
        public String nameForSetterMethod(MapperConfig<?> config, AnnotatedMethod method, String defaultName) {
            return resolve(method, defaultName);
        }

        @Override
        public String nameForConstructorParameter(MapperConfig<?> config, AnnotatedParameter ctorParam,
                                                  String defaultName) {
            return resolve(ctorParam, defaultName);
        }

        private String resolve(AnnotatedMember member, String defaultName) {
            return resolvePropertyName(member == null ? null : member.getDeclaringClass(), defaultName);
        }
    }
}
