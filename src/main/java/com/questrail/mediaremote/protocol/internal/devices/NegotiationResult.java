package com.questrail.mediaremote.protocol.internal.devices;

import java.util.Objects;

/**
 * Changes one request made to a peer's endpoint and cluster device sets.
 * The two are reported separately and never merged.
 */
public record NegotiationResult(DeviceSetChange endpoint, DeviceSetChange cluster)
{
    public NegotiationResult {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(cluster, "cluster");
    }

    public DeviceSetChange change(DeviceScope scope) {
        return (scope == DeviceScope.ENDPOINT) ? endpoint : cluster;
    }

    public boolean changed() {
        return endpoint.changed() || cluster.changed();
    }
}
