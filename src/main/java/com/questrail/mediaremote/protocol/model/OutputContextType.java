package com.questrail.mediaremote.protocol.model;

import java.util.Optional;

/**
 * Kind of output context a modify request targets.
 *
 * <p>
 * Only one value is numbered by the protocol. Any other wire value is outside
 * the enumeration's range and makes the carrying message malformed.
 * </p>
 */
public enum OutputContextType
{
    SHARED_AUDIO_PRESENTATION(1);

    private final int wireValue;

    OutputContextType(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static Optional<OutputContextType> fromWireValue(int wireValue) {
        for (OutputContextType type : values()) {
            if (type.wireValue == wireValue) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
