package com.questrail.mediaremote.protocol.internal.interest;

import com.questrail.mediaremote.protocol.model.ClientUpdatesConfig;
import com.questrail.mediaremote.protocol.model.FlagState;
import com.questrail.mediaremote.protocol.model.UpdateCategory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * UpdateInterestSet
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the push-notification categories a peer subscribes to.
 *
 * <h2>Merge semantics</h2>
 * {@link #apply(ClientUpdatesConfig)} distinguishes three states per category:
 * present-true enables it, present-false disables it, and absent leaves the
 * current value alone. Absent is not the same as false.
 */
public final class UpdateInterestSet
{
    private static final UpdateInterestSet NONE = new UpdateInterestSet(EnumSet.noneOf(UpdateCategory.class));

    private final EnumSet<UpdateCategory> enabled;

    private UpdateInterestSet(EnumSet<UpdateCategory> enabled) {
        this.enabled = enabled;
    }

    /**
     * Initial subscription of a new peer: nothing.
     */
    public static UpdateInterestSet none() {
        return NONE;
    }

    public static UpdateInterestSet of(UpdateCategory... categories) {
        EnumSet<UpdateCategory> set = EnumSet.noneOf(UpdateCategory.class);
        for (UpdateCategory category : categories) {
            set.add(Objects.requireNonNull(category, "category"));
        }
        return new UpdateInterestSet(set);
    }

    public UpdateInterestSet apply(ClientUpdatesConfig config) {
        Objects.requireNonNull(config, "config");

        EnumSet<UpdateCategory> next = enabled.clone();
        for (UpdateCategory category : UpdateCategory.values()) {
            FlagState state = config.state(category);
            if (state == FlagState.ENABLED) {
                next.add(category);
            } else if (state == FlagState.DISABLED) {
                next.remove(category);
            }
        }
        return next.equals(enabled) ? this : new UpdateInterestSet(next);
    }

    public boolean isInterested(UpdateCategory category) {
        return enabled.contains(Objects.requireNonNull(category, "category"));
    }

    public boolean artwork()      { return enabled.contains(UpdateCategory.ARTWORK); }
    public boolean nowPlaying()   { return enabled.contains(UpdateCategory.NOW_PLAYING); }
    public boolean volume()       { return enabled.contains(UpdateCategory.VOLUME); }
    public boolean keyboard()     { return enabled.contains(UpdateCategory.KEYBOARD); }
    public boolean outputDevice() { return enabled.contains(UpdateCategory.OUTPUT_DEVICE); }

    public Set<UpdateCategory> enabled() {
        return Collections.unmodifiableSet(enabled);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpdateInterestSet that)) return false;
        return enabled.equals(that.enabled);
    }

    @Override
    public int hashCode() {
        return enabled.hashCode();
    }

    @Override
    public String toString() {
        return "UpdateInterestSet" + enabled;
    }
}
