package org.searchclient.serialization;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import reactor.core.publisher.Mono;

/**
 * Marshals request bodies to, and response bodies from, the byte streams the transport hands over.
 *
 * Streams belong to the caller: implementations read and write through them but never open,
 * close or reposition them. A single stream must not be shared by concurrent calls.
 */
public interface SearchSerializer {

    /**
     * Writes {@code value} as UTF-8 JSON, without a byte-order mark, and flushes before returning.
     *
     * @param value The value to write, null is written as the JSON literal null
     * @param stream The stream to write to
     * @param formatting The output style
     * @throws IOException if the value cannot be written
     */
    <T> void serialize(T value, OutputStream stream, SerializationFormatting formatting) throws IOException;

    default <T> void serialize(T value, OutputStream stream) throws IOException {
        serialize(value, stream, SerializationFormatting.INDENTED);
    }

    /**
     * Same contract as {@link #serialize(Object, OutputStream, SerializationFormatting)}, deferred until
     * subscription. The write itself is blocking and runs on the subscribing thread; a Mono that is
     * cancelled before it runs writes nothing.
     */
    <T> Mono<Void> serializeAsync(T value, OutputStream stream, SerializationFormatting formatting);

    default <T> Mono<Void> serializeAsync(T value, OutputStream stream) {
        return serializeAsync(value, stream, SerializationFormatting.INDENTED);
    }

    /**
     * Reads one JSON value. A null or empty stream is an absent body and yields the type's default
     * value: null, or the zero value of a primitive.
     *
     * @throws IOException if the body is not valid JSON or does not fit the requested type
     */
    <T> T deserialize(Class<T> type, InputStream stream) throws IOException;

    <T> T deserialize(TypeReference<T> type, InputStream stream) throws IOException;

    Object deserialize(JavaType type, InputStream stream) throws IOException;

    /**
     * Reads one JSON value without blocking the subscriber, handling faults as the client's configured
     * {@link AsyncFailurePolicy} says. A default value of null is signalled by an empty Mono.
     */
    <T> Mono<T> deserializeAsync(Class<T> type, InputStream stream);

    <T> Mono<T> deserializeAsync(Class<T> type, InputStream stream, AsyncFailurePolicy failurePolicy);

    <T> Mono<T> deserializeAsync(TypeReference<T> type, InputStream stream);

    <T> Mono<T> deserializeAsync(TypeReference<T> type, InputStream stream, AsyncFailurePolicy failurePolicy);

    Mono<Object> deserializeAsync(JavaType type, InputStream stream);

    Mono<Object> deserializeAsync(JavaType type, InputStream stream, AsyncFailurePolicy failurePolicy);
}
