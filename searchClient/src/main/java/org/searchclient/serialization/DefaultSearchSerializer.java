package org.searchclient.serialization;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.searchclient.settings.ConnectionSettings;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.TreeNode;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * The serializer the client uses for request and response bodies.
 *
 * Two mappers, compact and indented, are built once at construction and never reconfigured, so a
 * single instance can serve any number of concurrent requests. Reads always go through the compact one.
 */
@Slf4j
public class DefaultSearchSerializer implements SearchSerializer {
    private static final int MAX_STRING_LENGTH = 100_000_000; // 100 MB

    @Getter
    private final ConnectionSettings settings;
    @Getter
    private final ContractResolver contractResolver;
    private final ObjectMapper compactMapper;
    private final ObjectMapper indentedMapper;

    public DefaultSearchSerializer(ConnectionSettings settings) {
        this(settings, new SearchContractResolver(settings));
    }

    /**
     * @param settings The client settings
     * @param contractResolver Must be a {@link SearchContractResolver}
     * @throws InvalidContractResolverException if the resolver is of any other type
     */
    public DefaultSearchSerializer(ConnectionSettings settings, ContractResolver contractResolver) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.contractResolver = Objects.requireNonNull(contractResolver, "contractResolver");
        Objects.requireNonNull(settings.getAsyncFailurePolicy(), "asyncFailurePolicy");
        if (settings.getWriteBufferSize() <= 0) {
            throw new IllegalArgumentException("writeBufferSize must be positive, was " + settings.getWriteBufferSize());
        }
        this.compactMapper = createMapper(SerializationFormatting.NONE);
        this.indentedMapper = createMapper(SerializationFormatting.INDENTED);
        log.atDebug().setMessage("Created serializer with resolver {} and a write buffer of {} chars")
            .addArgument(() -> contractResolver.getClass().getSimpleName())
            .addArgument(settings::getWriteBufferSize)
            .log();
    }

    /**
     * Builds the mapper for one output style. Default-valued properties are written, null-valued
     * properties are left out, unknown properties are ignored on read and the caller's streams are
     * never closed.
     */
    protected ObjectMapper createMapper(SerializationFormatting formatting) {
        if (!(contractResolver instanceof SearchContractResolver)) {
            throw new InvalidContractResolverException(contractResolver);
        }
        var jsonFactory = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder()
                .maxStringLength(MAX_STRING_LENGTH)
                .build())
            .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();
        return JsonMapper.builder(jsonFactory)
            .configure(SerializationFeature.INDENT_OUTPUT, formatting == SerializationFormatting.INDENTED)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .addModule(contractResolver.asModule())
            .build();
    }

    private ObjectMapper mapperFor(SerializationFormatting formatting) {
        return formatting == SerializationFormatting.INDENTED || settings.isPrettyJson()
            ? indentedMapper
            : compactMapper;
    }

    @Override
    public <T> void serialize(T value, OutputStream stream, SerializationFormatting formatting) throws IOException {
        Objects.requireNonNull(stream, "stream");
        // Not closed: closing the writer would close the caller's stream.
        Writer writer = new BufferedWriter(
            new OutputStreamWriter(stream, StandardCharsets.UTF_8),
            settings.getWriteBufferSize());
        mapperFor(formatting).writeValue(writer, value);
        writer.flush();
    }

    @Override
    public <T> Mono<Void> serializeAsync(T value, OutputStream stream, SerializationFormatting formatting) {
        return Mono.fromCallable(() -> {
            serialize(value, stream, formatting);
            return null;
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T deserialize(Class<T> type, InputStream stream) throws IOException {
        return (T) deserialize(compactMapper.constructType(type), stream);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T deserialize(TypeReference<T> type, InputStream stream) throws IOException {
        return (T) deserialize(compactMapper.getTypeFactory().constructType(type), stream);
    }

    @Override
    public Object deserialize(JavaType type, InputStream stream) throws IOException {
        if (stream == null) {
            return TypeDefaults.defaultValue(type);
        }
        try (var parser = compactMapper.createParser(stream)) {
            if (parser.nextToken() == null) {
                return TypeDefaults.defaultValue(type);
            }
            return compactMapper.readValue(parser, type);
        }
    }

    @Override
    public <T> Mono<T> deserializeAsync(Class<T> type, InputStream stream) {
        return deserializeAsync(type, stream, settings.getAsyncFailurePolicy());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Mono<T> deserializeAsync(Class<T> type, InputStream stream, AsyncFailurePolicy failurePolicy) {
        return deserializeAsync(compactMapper.constructType(type), stream, failurePolicy).map(v -> (T) v);
    }

    @Override
    public <T> Mono<T> deserializeAsync(TypeReference<T> type, InputStream stream) {
        return deserializeAsync(type, stream, settings.getAsyncFailurePolicy());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Mono<T> deserializeAsync(TypeReference<T> type, InputStream stream, AsyncFailurePolicy failurePolicy) {
        return deserializeAsync(compactMapper.getTypeFactory().constructType(type), stream, failurePolicy)
            .map(v -> (T) v);
    }

    @Override
    public Mono<Object> deserializeAsync(JavaType type, InputStream stream) {
        return deserializeAsync(type, stream, settings.getAsyncFailurePolicy());
    }

    @Override
    public Mono<Object> deserializeAsync(JavaType type, InputStream stream, AsyncFailurePolicy failurePolicy) {
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        var defaultValue = Mono.justOrEmpty(TypeDefaults.defaultValue(type));
        if (stream == null) {
            return defaultValue;
        }
        var converted = readTreeAsync(stream)
            .flatMap(tree -> Mono.fromCallable(() -> compactMapper.treeToValue(tree, type)));
        if (failurePolicy == AsyncFailurePolicy.PROPAGATE) {
            return converted.switchIfEmpty(defaultValue);
        }
        return converted
            .onErrorResume(e -> {
                log.atWarn().setMessage("Unable to read a {} from the response body, using its default value")
                    .addArgument(type)
                    .setCause(e)
                    .log();
                return Mono.empty();
            })
            .switchIfEmpty(defaultValue);
    }

    /**
     * Loads the whole body as a tree off the subscribing thread. Completes empty for a body with no content.
     */
    private Mono<TreeNode> readTreeAsync(InputStream stream) {
        return Mono.<TreeNode>fromCallable(() -> {
            try (var parser = compactMapper.createParser(stream)) {
                return compactMapper.readTree(parser);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Raised while the serializer is being built when it was handed a contract resolver it cannot work with.
     */
    public static class InvalidContractResolverException extends IllegalArgumentException {
        public InvalidContractResolverException(ContractResolver resolver) {
            super("The serializer needs an instance of " + SearchContractResolver.class.getSimpleName()
                + " as its contract resolver but was given " + resolver.getClass().getName());
        }
    }
}
