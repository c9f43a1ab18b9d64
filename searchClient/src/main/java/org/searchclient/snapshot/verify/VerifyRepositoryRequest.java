package org.searchclient.snapshot.verify;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Asks the cluster to check that every node can read and write a registered snapshot repository.
 * The response body is read with {@link VerifyRepositoryResponse#parse}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class VerifyRepositoryRequest {
    private static final String METHOD = "POST";

    private final String repository;
    private final String masterTimeout;
    private final String timeout;

    /**
     * @param repository Name of the repository to verify
     * @param masterTimeout How long to wait for the cluster manager node, e.g. {@code 30s}, may be null
     * @param timeout How long to wait for the response, may be null
     */
    @Builder
    private VerifyRepositoryRequest(String repository, String masterTimeout, String timeout) {
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("A repository name is required");
        }
        this.repository = repository;
        this.masterTimeout = masterTimeout;
        this.timeout = timeout;
    }

    public static VerifyRepositoryRequest forRepository(String repository) {
        return VerifyRepositoryRequest.builder().repository(repository).build();
    }

    public String method() {
        return METHOD;
    }

    /**
     * @return the request path relative to the cluster root, including any query string
     */
    public String path() {
        var query = new StringJoiner("&", "?", "").setEmptyValue("");
        if (masterTimeout != null) {
            query.add("master_timeout=" + encode(masterTimeout));
        }
        if (timeout != null) {
            query.add("timeout=" + encode(timeout));
        }
        return "_snapshot/" + encode(repository) + "/_verify" + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
