package com.questrail.mediaremote.protocol.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Client updates configuration.
 *
 * <p>
 * Sent by a peer to declare which push-notification categories it wants to
 * receive. Every category is individually optional: a category the message
 * does not mention is {@link FlagState#UNSPECIFIED} and leaves the peer's
 * current subscription for that category untouched.
 * </p>
 *
 * <p>
 * Instances are immutable. Use {@link #builder()} to construct one.
 * </p>
 */
public final class ClientUpdatesConfig implements ProtocolPayload
{
    private final Map<UpdateCategory, Boolean> present;

    private ClientUpdatesConfig(Map<UpdateCategory, Boolean> present) {
        EnumMap<UpdateCategory, Boolean> copy = new EnumMap<>(UpdateCategory.class);
        copy.putAll(present);
        this.present = copy;
    }

    /**
     * Returns the state of one category in this message.
     */
    public FlagState state(UpdateCategory category) {
        Objects.requireNonNull(category, "category");
        Boolean value = present.get(category);
        return value == null ? FlagState.UNSPECIFIED : FlagState.of(value);
    }

    /**
     * Returns the categories that were present on the wire.
     */
    public Set<UpdateCategory> presentCategories() {
        return Set.copyOf(present.keySet());
    }

    public boolean isEmpty() {
        return present.isEmpty();
    }

    public static ClientUpdatesConfig empty() {
        return new ClientUpdatesConfig(Map.of());
    }

    /**
     * Configuration that subscribes to (or unsubscribes from) every category.
     */
    public static ClientUpdatesConfig all(boolean value) {
        Builder builder = builder();
        for (UpdateCategory category : UpdateCategory.values()) {
            builder.with(category, value);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClientUpdatesConfig that)) return false;
        return present.equals(that.present);
    }

    @Override
    public int hashCode() {
        return present.hashCode();
    }

    @Override
    public String toString() {
        return "ClientUpdatesConfig" + present;
    }

    public static final class Builder {
        private final Map<UpdateCategory, Boolean> present = new EnumMap<>(UpdateCategory.class);

        public Builder with(UpdateCategory category, boolean value) {
            present.put(Objects.requireNonNull(category, "category"), value);
            return this;
        }

        public Builder artwork(boolean value) {
            return with(UpdateCategory.ARTWORK, value);
        }

        public Builder nowPlaying(boolean value) {
            return with(UpdateCategory.NOW_PLAYING, value);
        }

        public Builder volume(boolean value) {
            return with(UpdateCategory.VOLUME, value);
        }

        public Builder keyboard(boolean value) {
            return with(UpdateCategory.KEYBOARD, value);
        }

        public Builder outputDevice(boolean value) {
            return with(UpdateCategory.OUTPUT_DEVICE, value);
        }

        public ClientUpdatesConfig build() {
            return new ClientUpdatesConfig(present);
        }
    }
}
