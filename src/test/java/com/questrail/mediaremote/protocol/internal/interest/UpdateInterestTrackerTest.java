package com.questrail.mediaremote.protocol.internal.interest;

import com.questrail.mediaremote.protocol.model.ClientUpdatesConfig;
import com.questrail.mediaremote.protocol.model.UpdateCategory;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class UpdateInterestTrackerTest {

    @Test
    void newPeerIsInterestedInNothing() {
        UpdateInterestTracker tracker = new UpdateInterestTracker();

        for (UpdateCategory category : UpdateCategory.values()) {
            assertFalse(tracker.isInterested(category), category::name);
        }
        assertEquals(UpdateInterestSet.none(), tracker.current());
    }

    @Test
    void absentFieldsKeepTheirPreviousValue() {
        UpdateInterestTracker tracker = new UpdateInterestTracker();

        tracker.apply(ClientUpdatesConfig.builder().nowPlaying(true).build());
        UpdateInterestSet after = tracker.apply(ClientUpdatesConfig.builder().volume(true).build());

        assertTrue(after.nowPlaying());
        assertTrue(after.volume());
        assertFalse(after.artwork());
        assertFalse(after.keyboard());
        assertFalse(after.outputDevice());
        assertEquals(EnumSet.of(UpdateCategory.NOW_PLAYING, UpdateCategory.VOLUME), after.enabled());
    }

    @Test
    void explicitFalseUnsubscribes() {
        UpdateInterestTracker tracker = new UpdateInterestTracker();
        tracker.apply(ClientUpdatesConfig.all(true));

        tracker.apply(ClientUpdatesConfig.builder().artwork(false).build());

        assertFalse(tracker.isInterested(UpdateCategory.ARTWORK));
        assertTrue(tracker.isInterested(UpdateCategory.KEYBOARD));
    }

    @Test
    void emptyConfigChangesNothing() {
        UpdateInterestTracker tracker = new UpdateInterestTracker();
        UpdateInterestSet before = tracker.apply(ClientUpdatesConfig.builder().keyboard(true).build());

        UpdateInterestSet after = tracker.apply(ClientUpdatesConfig.empty());

        assertSame(before, after);
    }

    @Test
    void applyingIsIdempotent() {
        ClientUpdatesConfig config = ClientUpdatesConfig.builder().artwork(true).volume(false).build();
        UpdateInterestSet once = UpdateInterestSet.none().apply(config);

        assertEquals(once, once.apply(config));
        assertEquals(UpdateInterestSet.of(UpdateCategory.ARTWORK), once);
    }
}
