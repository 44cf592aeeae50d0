package com.questrail.mediaremote.protocol.internal.devices;

import com.questrail.mediaremote.protocol.model.ModifyOutputContextRequest;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * DeviceSetNegotiator
 * =============================================================================
 * Applies output-context requests to a peer's two device sets.
 *
 * <h2>Ordering within one request</h2>
 * <ol>
 *   <li>{@code setting} replaces the whole set (if present)</li>
 *   <li>{@code adding} is a set union</li>
 *   <li>{@code removing} is a set difference</li>
 * </ol>
 * So a request can reset the set and adjust it in one go. Repeated identifiers
 * are idempotent.
 *
 * <h2>Scopes</h2>
 * Endpoint operations and their cluster-aware counterparts address two
 * independent sets. A request may touch either or both; the sets are never
 * merged and each is queryable on its own.
 *
 * <h2>Thread Safety</h2>
 * {@link #apply} is atomic with respect to concurrent requests.
 */
public final class DeviceSetNegotiator
{
    private final Set<String> endpointDevices = new LinkedHashSet<>();
    private final Set<String> clusterDevices = new LinkedHashSet<>();

    public synchronized NegotiationResult apply(ModifyOutputContextRequest request) {
        Objects.requireNonNull(request, "request");

        DeviceSetChange endpoint = applyTo(
                DeviceScope.ENDPOINT, endpointDevices,
                request.setting(), request.adding(), request.removing());

        DeviceSetChange cluster = applyTo(
                DeviceScope.CLUSTER, clusterDevices,
                request.clusterAwareSetting(), request.clusterAwareAdding(), request.clusterAwareRemoving());

        return new NegotiationResult(endpoint, cluster);
    }

    private static DeviceSetChange applyTo(DeviceScope scope,
                                           Set<String> devices,
                                           List<String> setting,
                                           List<String> adding,
                                           List<String> removing) {
        if (setting.isEmpty() && adding.isEmpty() && removing.isEmpty()) {
            return DeviceSetChange.unchanged(scope, devices);
        }

        Set<String> before = new LinkedHashSet<>(devices);
        boolean replaced = !setting.isEmpty();

        if (replaced) {
            devices.clear();
            devices.addAll(setting);
        }
        Set<String> baseline = new LinkedHashSet<>(devices);

        devices.addAll(adding);
        removing.forEach(devices::remove);

        Set<String> added = new LinkedHashSet<>(devices);
        added.removeAll(baseline);
        Set<String> removed = new LinkedHashSet<>(baseline);
        removed.removeAll(devices);

        return new DeviceSetChange(scope, before, devices, added, removed, replaced);
    }

    public synchronized Set<String> endpointDevices() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(endpointDevices));
    }

    public synchronized Set<String> clusterDevices() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(clusterDevices));
    }

    public Set<String> devices(DeviceScope scope) {
        return (scope == DeviceScope.ENDPOINT) ? endpointDevices() : clusterDevices();
    }
}
