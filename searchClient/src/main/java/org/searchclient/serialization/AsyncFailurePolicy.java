package org.searchclient.serialization;

/**
 * Decides what the asynchronous read path does with a fault raised while loading or converting
 * a response body.
 */
public enum AsyncFailurePolicy {
    /**
     * Complete with the target type's default value instead of signalling the fault. A caller
     * cannot tell a body that failed to parse from an empty one under this policy.
     */
    DEFAULT_ON_FAILURE,

    /**
     * Signal the fault as the error of the returned Mono, the same way the synchronous path throws it.
     */
    PROPAGATE
}
