package com.questrail.mediaremote.protocol.internal.devices;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * DeviceSetChange
 * -----------------------------------------------------------------------------
 * Outcome of one request against one device set.
 *
 * <h2>Deltas</h2>
 * <ul>
 *   <li>{@link #added()} / {@link #removed()}: relative to the set as it stood
 *       after any replace in the same request. When {@link #replaced()} is
 *       {@code true}, callers announce the full {@link #members()} snapshot and
 *       then these deltas.</li>
 *   <li>{@link #netAdded()} / {@link #netRemoved()}: relative to the set before
 *       the request.</li>
 * </ul>
 *
 * All sets keep insertion order and are unmodifiable.
 */
public final class DeviceSetChange
{
    private final DeviceScope scope;
    private final Set<String> before;
    private final Set<String> members;
    private final Set<String> added;
    private final Set<String> removed;
    private final boolean replaced;

    DeviceSetChange(DeviceScope scope,
                    Set<String> before,
                    Set<String> members,
                    Set<String> added,
                    Set<String> removed,
                    boolean replaced) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.before = frozen(before);
        this.members = frozen(members);
        this.added = frozen(added);
        this.removed = frozen(removed);
        this.replaced = replaced;
    }

    static DeviceSetChange unchanged(DeviceScope scope, Set<String> members) {
        return new DeviceSetChange(scope, members, members, Set.of(), Set.of(), false);
    }

    private static Set<String> frozen(Set<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public DeviceScope scope() {
        return scope;
    }

    public Set<String> members() {
        return members;
    }

    public Set<String> added() {
        return added;
    }

    public Set<String> removed() {
        return removed;
    }

    public boolean replaced() {
        return replaced;
    }

    public Set<String> netAdded() {
        Set<String> result = new LinkedHashSet<>(members);
        result.removeAll(before);
        return Collections.unmodifiableSet(result);
    }

    public Set<String> netRemoved() {
        Set<String> result = new LinkedHashSet<>(before);
        result.removeAll(members);
        return Collections.unmodifiableSet(result);
    }

    /**
     * @return {@code true} if membership differs from before the request
     */
    public boolean changed() {
        return !before.equals(members);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceSetChange that)) return false;
        return replaced == that.replaced
                && scope == that.scope
                && before.equals(that.before)
                && members.equals(that.members)
                && added.equals(that.added)
                && removed.equals(that.removed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, before, members, added, removed, replaced);
    }

    @Override
    public String toString() {
        return "DeviceSetChange[" + scope
                + ", members=" + members
                + ", added=" + added
                + ", removed=" + removed
                + (replaced ? ", replaced" : "")
                + "]";
    }
}
