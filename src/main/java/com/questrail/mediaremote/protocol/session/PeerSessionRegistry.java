package com.questrail.mediaremote.protocol.session;

import com.questrail.mediaremote.protocol.model.UpdateCategory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Live sessions by peer.
 *
 * <p>
 * Sessions are created on connect and closed on disconnect. The registry is
 * also the {@link NotificationGate} for senders: a peer that is not connected
 * is not interested in anything.
 * </p>
 */
public final class PeerSessionRegistry implements NotificationGate
{
    private final Function<PeerId, PeerSession> factory;
    private final Map<PeerId, PeerSession> sessions = new ConcurrentHashMap<>();

    /**
     * @param factory creates a fresh session for a newly connected peer
     */
    public PeerSessionRegistry(Function<PeerId, PeerSession> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Opens a session for {@code peer}.
     *
     * @throws IllegalStateException if the peer already has a session
     */
    public PeerSession open(PeerId peer) {
        Objects.requireNonNull(peer, "peer");
        PeerSession created = factory.apply(peer);
        PeerSession existing = sessions.putIfAbsent(peer, created);
        if (existing != null) {
            created.close();
            throw new IllegalStateException("Session already open for " + peer);
        }
        return created;
    }

    public Optional<PeerSession> get(PeerId peer) {
        return Optional.ofNullable(sessions.get(peer));
    }

    /**
     * Closes and removes the session of {@code peer}, if any.
     */
    public boolean close(PeerId peer) {
        PeerSession session = sessions.remove(peer);
        if (session == null) {
            return false;
        }
        session.close();
        return true;
    }

    public void closeAll() {
        for (PeerId peer : List.copyOf(sessions.keySet())) {
            close(peer);
        }
    }

    public Collection<PeerSession> sessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    @Override
    public boolean isInterested(PeerId peer, UpdateCategory category) {
        PeerSession session = sessions.get(peer);
        return session != null && session.isInterested(category);
    }
}
