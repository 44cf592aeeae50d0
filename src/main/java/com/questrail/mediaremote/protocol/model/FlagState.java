package com.questrail.mediaremote.protocol.model;

/**
 * FlagState
 * -----------------------------------------------------------------------------
 * State of a single optional boolean field in a configuration message.
 *
 * This enum is TERNARY. A configuration message that omits a
 * field says something different from one that sends the field as
 * {@code false}:
 *
 * <ul>
 *   <li>{@link #ENABLED}     – field present and {@code true}</li>
 *   <li>{@link #DISABLED}    – field present and {@code false}</li>
 *   <li>{@link #UNSPECIFIED} – field absent; must not cause change</li>
 * </ul>
 *
 * {@code UNSPECIFIED} never overwrites a previously materialized value.
 */
public enum FlagState
{
    ENABLED,
    DISABLED,
    UNSPECIFIED;

    /**
     * @return {@code true} if the field was present on the wire
     */
    public boolean isPresent()
    {
        return this != UNSPECIFIED;
    }

    public static FlagState of(boolean value)
    {
        return value ? ENABLED : DISABLED;
    }
}
