package com.questrail.mediaremote.protocol.codec;

import com.questrail.mediaremote.protocol.model.ProtocolPayload;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Result of decoding one envelope.
 *
 * <p>
 * {@link Typed} is produced for tags registered in the catalog;
 * {@link Opaque} preserves the raw bytes of every other tag so that a
 * message from a newer peer can be forwarded or ignored without failing.
 * Both keep the envelope's identifier and error code.
 * </p>
 */
public sealed interface DecodedMessage permits DecodedMessage.Typed, DecodedMessage.Opaque
{
    int tag();

    Optional<String> identifier();

    OptionalInt errorCode();

    final class Typed implements DecodedMessage
    {
        private final int tag;
        private final String identifier;
        private final Integer errorCode;
        private final ProtocolPayload payload;

        public Typed(int tag, String identifier, Integer errorCode, ProtocolPayload payload) {
            this.tag = tag;
            this.identifier = identifier;
            this.errorCode = errorCode;
            this.payload = Objects.requireNonNull(payload, "payload");
        }

        @Override
        public int tag() {
            return tag;
        }

        @Override
        public Optional<String> identifier() {
            return Optional.ofNullable(identifier);
        }

        @Override
        public OptionalInt errorCode() {
            return (errorCode == null) ? OptionalInt.empty() : OptionalInt.of(errorCode);
        }

        public ProtocolPayload payload() {
            return payload;
        }

        /**
         * Returns the payload cast to {@code type}.
         *
         * @throws ClassCastException if the payload is of a different type
         */
        public <T extends ProtocolPayload> T payloadAs(Class<T> type) {
            return type.cast(payload);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Typed that)) return false;
            return tag == that.tag
                    && Objects.equals(identifier, that.identifier)
                    && Objects.equals(errorCode, that.errorCode)
                    && payload.equals(that.payload);
        }

        @Override
        public int hashCode() {
            return Objects.hash(tag, identifier, errorCode, payload);
        }

        @Override
        public String toString() {
            return "Typed[tag=" + tag + ", payload=" + payload + "]";
        }
    }

    final class Opaque implements DecodedMessage
    {
        private final int tag;
        private final String identifier;
        private final Integer errorCode;
        private final byte[] bytes;

        public Opaque(int tag, String identifier, Integer errorCode, byte[] bytes) {
            this.tag = tag;
            this.identifier = identifier;
            this.errorCode = errorCode;
            this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        @Override
        public int tag() {
            return tag;
        }

        @Override
        public Optional<String> identifier() {
            return Optional.ofNullable(identifier);
        }

        @Override
        public OptionalInt errorCode() {
            return (errorCode == null) ? OptionalInt.empty() : OptionalInt.of(errorCode);
        }

        public byte[] bytes() {
            return bytes.clone();
        }

        /**
         * Rebuilds the envelope this message was decoded from, header fields included.
         */
        public Envelope toEnvelope() {
            return Envelope.of(tag, identifier, errorCode, bytes);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Opaque that)) return false;
            return tag == that.tag
                    && Objects.equals(identifier, that.identifier)
                    && Objects.equals(errorCode, that.errorCode)
                    && Arrays.equals(bytes, that.bytes);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hash(tag, identifier, errorCode) + Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Opaque[tag=" + tag + ", length=" + bytes.length + "]";
        }
    }
}
