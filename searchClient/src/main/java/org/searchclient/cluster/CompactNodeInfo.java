package org.searchclient.cluster;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Minimal description of a cluster node, as returned by cluster administration calls
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompactNodeInfo(
    @JsonProperty("name") String name
) {}
