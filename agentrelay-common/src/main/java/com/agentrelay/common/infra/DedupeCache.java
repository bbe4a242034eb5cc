package com.agentrelay.common.infra;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Remembers recently seen keys so that redelivered events can be dropped.
 * Entries expire a fixed window after they were last seen; a window of zero
 * or less turns suppression off.
 */
public class DedupeCache {

    private final Clock clock;
    private final Cache<String, Long> seen;

    public DedupeCache(Duration window, long maxEntries, Clock clock) {
        this.clock = clock;
        if (window == null || window.isZero() || window.isNegative()) {
            this.seen = null;
            return;
        }
        this.seen = Caffeine.newBuilder()
                .expireAfterWrite(window)
                .maximumSize(Math.max(1, maxEntries))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Record {@code key} and report whether it was already recorded inside the window.
     * Null and empty keys are never duplicates.
     */
    public synchronized boolean isDuplicate(String key) {
        if (seen == null || key == null || key.isEmpty()) {
            return false;
        }
        boolean duplicate = seen.getIfPresent(key) != null;
        seen.put(key, clock.millis());
        return duplicate;
    }

    public boolean isEnabled() {
        return seen != null;
    }

    public synchronized void clear() {
        if (seen != null) {
            seen.invalidateAll();
        }
    }

    public synchronized long size() {
        if (seen == null) {
            return 0;
        }
        seen.cleanUp();
        return seen.estimatedSize();
    }
}
