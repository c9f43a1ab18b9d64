package org.searchclient.snapshot.verify;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.searchclient.cluster.CompactNodeInfo;
import org.searchclient.serialization.SearchSerializer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import reactor.core.publisher.Mono;

/**
 * Result of verifying a snapshot repository: the nodes that were able to use it, keyed by node id.
 *
 * Node ids are opaque and case-sensitive, so keys are kept exactly as the cluster sent them. The map is
 * empty, never null, when no node responded or the field was missing from the body.
 */
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class VerifyRepositoryResponse {

    @JsonProperty("nodes")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, CompactNodeInfo> nodes = new LinkedHashMap<>();

    /**
     * @return node id to node info of the nodes that verified the repository, unmodifiable
     */
    public Map<String, CompactNodeInfo> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public void setNodes(Map<String, CompactNodeInfo> nodes) {
        this.nodes = nodes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(nodes);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Reads a verify-repository response body. An absent body yields an empty response.
     */
    public static VerifyRepositoryResponse parse(SearchSerializer serializer, InputStream body) throws IOException {
        var response = serializer.deserialize(VerifyRepositoryResponse.class, body);
        return response != null ? response : new VerifyRepositoryResponse();
    }

    public static Mono<VerifyRepositoryResponse> parseAsync(SearchSerializer serializer, InputStream body) {
        return serializer.deserializeAsync(VerifyRepositoryResponse.class, body)
            .defaultIfEmpty(new VerifyRepositoryResponse());
    }
}
