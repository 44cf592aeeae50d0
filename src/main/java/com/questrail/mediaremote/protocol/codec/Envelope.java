package com.questrail.mediaremote.protocol.codec;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Envelope
 * -----------------------------------------------------------------------------
 * One tagged payload as it crosses the wire.
 *
 * <p>The tag names the payload kind; the payload bytes are the serialized
 * payload. {@code identifier} and {@code errorCode} are request/response
 * correlation fields carried through unchanged; this layer attaches no
 * meaning to them.</p>
 *
 * <p>Envelopes are created on send and consumed on receive. They are never
 * retained.</p>
 */
public final class Envelope
{
    private final int tag;
    private final String identifier;
    private final Integer errorCode;
    private final byte[] payload;

    private Envelope(int tag, String identifier, Integer errorCode, byte[] payload) {
        if (tag < 0) {
            throw new IllegalArgumentException("tag must be >= 0 (was " + tag + ")");
        }
        this.tag = tag;
        this.identifier = identifier;
        this.errorCode = errorCode;
        this.payload = Objects.requireNonNull(payload, "payload").clone();
    }

    public static Envelope of(int tag, byte[] payload) {
        return new Envelope(tag, null, null, payload);
    }

    public static Envelope of(int tag, String identifier, Integer errorCode, byte[] payload) {
        return new Envelope(tag, identifier, errorCode, payload);
    }

    public int tag() {
        return tag;
    }

    public Optional<String> identifier() {
        return Optional.ofNullable(identifier);
    }

    public OptionalInt errorCode() {
        return (errorCode == null) ? OptionalInt.empty() : OptionalInt.of(errorCode);
    }

    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    public Envelope withIdentifier(String identifier) {
        return new Envelope(tag, identifier, errorCode, payload);
    }

    public Envelope withErrorCode(int errorCode) {
        return new Envelope(tag, identifier, errorCode, payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Envelope that)) return false;
        return tag == that.tag
                && Objects.equals(identifier, that.identifier)
                && Objects.equals(errorCode, that.errorCode)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(tag, identifier, errorCode) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Envelope[tag=" + tag
                + (identifier == null ? "" : ", identifier=" + identifier)
                + (errorCode == null ? "" : ", errorCode=" + errorCode)
                + ", payloadLength=" + payload.length + "]";
    }
}
