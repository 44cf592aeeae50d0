package com.questrail.mediaremote.protocol.model;

import java.util.Optional;

/**
 * Push-notification categories a peer can subscribe to.
 *
 * <p>
 * Each category corresponds to one boolean field of the client updates
 * configuration message. The field number is the protobuf field number used
 * on the wire.
 * </p>
 */
public enum UpdateCategory
{
    ARTWORK(1),
    NOW_PLAYING(2),
    VOLUME(3),
    KEYBOARD(4),
    OUTPUT_DEVICE(5);

    private final int fieldNumber;

    UpdateCategory(int fieldNumber) {
        this.fieldNumber = fieldNumber;
    }

    public int fieldNumber() {
        return fieldNumber;
    }

    /**
     * Resolves the category carried by a given configuration field number.
     *
     * @param fieldNumber protobuf field number
     * @return the category, or empty if the field is not a known category
     */
    public static Optional<UpdateCategory> fromFieldNumber(int fieldNumber) {
        for (UpdateCategory category : values()) {
            if (category.fieldNumber == fieldNumber) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
