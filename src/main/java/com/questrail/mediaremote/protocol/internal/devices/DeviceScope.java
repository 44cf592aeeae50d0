package com.questrail.mediaremote.protocol.internal.devices;

/**
 * Which of a peer's two device sets an operation addresses.
 */
public enum DeviceScope
{
    /** Only the addressed endpoint. */
    ENDPOINT,

    /** Every device in the peer's logical cluster. */
    CLUSTER
}
