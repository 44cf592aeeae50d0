package com.questrail.mediaremote.protocol.catalog;

import com.questrail.mediaremote.protocol.model.ProtocolPayload;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * MessageCatalog
 * ============================================================================
 * Immutable registry mapping a numeric tag to a payload type and its
 * decode/encode function pair.
 *
 * <h2>Architectural Role</h2>
 * The catalog replaces runtime type discovery with an explicit table that the
 * application builds once at startup. The envelope codec consults it in both
 * directions:
 *
 * <ul>
 *   <li>inbound: tag → decoder</li>
 *   <li>outbound: payload type → tag and encoder</li>
 * </ul>
 *
 * The catalog makes no assumption about how many kinds exist. Tags that are
 * not registered are not an error here; the codec turns them into opaque
 * payloads.
 *
 * <h2>Tag range</h2>
 * Tags below {@link #MIN_TAG} collide with the envelope header fields, and
 * tags above {@link #MAX_TAG} are not valid protobuf field numbers. Both are
 * rejected at registration time.
 *
 * <h2>Thread Safety</h2>
 * Instances are immutable once built and safe to share across connections.
 */
public final class MessageCatalog
{
    /**
     * Lowest tag a payload kind may use. Field numbers 1–5 belong to the envelope header.
     */
    public static final int MIN_TAG = 6;

    /**
     * Highest protobuf field number, and so the highest usable tag.
     */
    public static final int MAX_TAG = (1 << 29) - 1;

    /**
     * @throws IllegalArgumentException if {@code tag} is outside [{@link #MIN_TAG}, {@link #MAX_TAG}]
     */
    public static void checkTag(int tag) {
        if (tag < MIN_TAG || tag > MAX_TAG) {
            throw new IllegalArgumentException(
                    "Catalog tag must be in [" + MIN_TAG + ", " + MAX_TAG + "] (was " + tag + ")");
        }
    }

    private final Map<Integer, CatalogEntry<?>> byTag;
    private final Map<Class<?>, CatalogEntry<?>> byType;

    private MessageCatalog(Map<Integer, CatalogEntry<?>> byTag,
                           Map<Class<?>, CatalogEntry<?>> byType) {
        this.byTag = Map.copyOf(byTag);
        this.byType = Map.copyOf(byType);
    }

    public Optional<CatalogEntry<?>> lookup(int tag) {
        return Optional.ofNullable(byTag.get(tag));
    }

    /**
     * Resolves the entry registered for a payload's runtime type.
     */
    public Optional<CatalogEntry<?>> lookup(Class<? extends ProtocolPayload> type) {
        Objects.requireNonNull(type, "type");
        return Optional.ofNullable(byType.get(type));
    }

    public boolean contains(int tag) {
        return byTag.containsKey(tag);
    }

    /**
     * Returns the registered tags in ascending order.
     */
    public Set<Integer> tags() {
        return Collections.unmodifiableSet(new TreeSet<>(byTag.keySet()));
    }

    public int size() {
        return byTag.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, CatalogEntry<?>> byTag = new HashMap<>();
        private final Map<Class<?>, CatalogEntry<?>> byType = new HashMap<>();

        /**
         * Registers one payload kind.
         *
         * @throws IllegalArgumentException if the tag is outside [{@link #MIN_TAG},
         *         {@link #MAX_TAG}], or if the tag or the type is already registered
         */
        public <T extends ProtocolPayload> Builder register(int tag,
                                                            Class<T> type,
                                                            PayloadDecoder<T> decoder,
                                                            PayloadEncoder<T> encoder) {
            checkTag(tag);
            if (byTag.containsKey(tag)) {
                throw new IllegalArgumentException("Tag " + tag + " is already registered");
            }
            if (byType.containsKey(type)) {
                throw new IllegalArgumentException(
                        type.getSimpleName() + " is already registered under tag "
                                + byType.get(type).tag());
            }

            CatalogEntry<T> entry = new CatalogEntry<>(tag, type, decoder, encoder);
            byTag.put(tag, entry);
            byType.put(type, entry);
            return this;
        }

        public MessageCatalog build() {
            return new MessageCatalog(byTag, byType);
        }
    }
}
