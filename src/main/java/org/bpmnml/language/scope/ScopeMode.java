package org.bpmnml.language.scope;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Visibility rules used when resolving connection endpoints.
 */
public enum ScopeMode {
    /**
     * Sequence flows and associations see every node of their pool, across lanes.
     * Message flows see every node of every pool.
     */
    @JsonProperty("pool-wide")
    POOL_WIDE,

    /**
     * Older rules: a connection only sees the nodes of its nearest pool or lane,
     * whatever its connector.
     *
     * @deprecated lanes are not meant to restrict visibility; use {@link #POOL_WIDE}
     */
    @Deprecated
    @JsonProperty("lane-local")
    LANE_LOCAL
}
