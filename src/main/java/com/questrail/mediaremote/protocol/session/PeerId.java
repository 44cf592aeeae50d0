package com.questrail.mediaremote.protocol.session;

import java.util.Objects;

/**
 * Identity of one connected peer, unique within a running endpoint.
 */
public record PeerId(String value)
{
    public PeerId {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("PeerId must not be empty");
        }
    }

    public static PeerId of(String value) {
        return new PeerId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
