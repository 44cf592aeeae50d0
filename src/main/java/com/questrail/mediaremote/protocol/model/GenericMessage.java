package com.questrail.mediaremote.protocol.model;

/**
 * Generic message.
 *
 * <p>
 * Carries no fields. Peers use it as a heartbeat and as a bare
 * acknowledgement when only the envelope identifier matters.
 * </p>
 */
public record GenericMessage() implements ProtocolPayload
{
}
