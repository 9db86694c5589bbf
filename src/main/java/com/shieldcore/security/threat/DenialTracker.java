package com.shieldcore.security.threat;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.shieldcore.security.access.BlockEntry;

import java.time.Duration;

class DenialTracker {

    private final Cache<String, DenialState> states;

    DenialTracker(Duration inactivityTtl) {
        this.states = Caffeine.newBuilder()
                .expireAfterAccess(inactivityTtl)
                .build();
    }

    /**
     * Returns the number of denials suppressed under the identifier's previous block when this is
     * the first denial under {@code entry}, or a negative value when this denial is a repeat.
     */
    long firstDenial(String identifier, BlockEntry entry) {
        String blockKey = entry.origin() + "@" + entry.createdAt();
        long[] carried = {-1};
        states.asMap().compute(identifier, (id, state) -> {
            if (state == null || !state.blockKey.equals(blockKey)) {
                carried[0] = state == null ? 0 : state.suppressed;
                return new DenialState(blockKey);
            }
            state.suppressed++;
            return state;
        });
        return carried[0];
    }

    long suppressed(String identifier) {
        DenialState state = states.getIfPresent(identifier);
        return state == null ? 0 : state.suppressed;
    }

    private static final class DenialState {
        private final String blockKey;
        private volatile long suppressed;

        private DenialState(String blockKey) {
            this.blockKey = blockKey;
        }
    }
}
