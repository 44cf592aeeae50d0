package com.questrail.mediaremote.protocol.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identity of one logical multi-fragment transfer.
 *
 * <h2>Equality</h2>
 * <p>
 * Equality is structural over both fields: two keys are equal only if the
 * identifier strings are equal <em>and</em> the user data bytes are equal.
 * A plain record would compare the byte array by identity, which is why this
 * is a hand-written value class.
 * </p>
 *
 * <p>
 * Keys are used as map keys for in-flight reassembly state, so the user
 * data is copied on the way in and on the way out.
 * </p>
 */
public final class TransactionKey
{
    private final String identifier;
    private final byte[] userData;

    private TransactionKey(String identifier, byte[] userData) {
        this.identifier = identifier;
        this.userData = userData;
    }

    /**
     * @param identifier transaction identifier, may be empty but not null
     * @param userData   opaque user data, may be empty but not null
     */
    public static TransactionKey of(String identifier, byte[] userData) {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(userData, "userData");
        return new TransactionKey(identifier, userData.clone());
    }

    public static TransactionKey of(String identifier) {
        return new TransactionKey(Objects.requireNonNull(identifier, "identifier"), new byte[0]);
    }

    public String identifier() {
        return identifier;
    }

    public byte[] userData() {
        return userData.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionKey that)) return false;
        return identifier.equals(that.identifier) && Arrays.equals(userData, that.userData);
    }

    @Override
    public int hashCode() {
        return 31 * identifier.hashCode() + Arrays.hashCode(userData);
    }

    @Override
    public String toString() {
        return "TransactionKey[" + identifier
                + (userData.length == 0 ? "" : ", userData=" + HexFormat.of().formatHex(userData))
                + "]";
    }
}
