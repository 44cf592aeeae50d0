package com.questrail.mediaremote.protocol.catalog;

import java.util.Optional;

/**
 * Payload kinds the core itself understands, with their extension tags.
 *
 * <p>
 * The transaction kind is special: envelopes carrying it are fed to the
 * reassembler rather than delivered. The other kinds are routed to session
 * state and then delivered like any application payload.
 * </p>
 */
public enum StandardMessageKind
{
    GENERIC(6),
    CLIENT_UPDATES_CONFIG(16),
    TRANSACTION(38),
    MODIFY_OUTPUT_CONTEXT_REQUEST(74);

    private final int tag;

    StandardMessageKind(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    public static Optional<StandardMessageKind> fromTag(int tag) {
        for (StandardMessageKind kind : values()) {
            if (kind.tag == tag) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
