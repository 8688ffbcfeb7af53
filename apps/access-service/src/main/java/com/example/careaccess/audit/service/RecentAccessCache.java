package com.example.careaccess.audit.service;

import com.example.careaccess.config.properties.AuditProperties;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Bounded index of recent emergency requests used for access-pattern alerts.
 *
 * <p>This is a cache over the audit trail, not a record of it: entries older than the configured
 * window, or beyond the entry cap, are dropped oldest first.
 */
@Component
public class RecentAccessCache {

    private final Duration window;
    private final int maxEntries;
    private final Deque<Access> accesses = new ArrayDeque<>();

    public RecentAccessCache(AuditProperties properties) {
        this.window = properties.recentWindow();
        this.maxEntries = properties.recentMaxEntries();
    }

    public synchronized void record(@NonNull String userId, @NonNull String resource, @NonNull Instant at) {
        prune(at);
        accesses.addLast(new Access(userId, resource, at));
        while (accesses.size() > maxEntries) {
            accesses.removeFirst();
        }
    }

    /**
     * Removes the most recent matching request, if still held.
     */
    public synchronized void remove(@NonNull String userId, @NonNull String resource, @NonNull Instant at) {
        Access target = new Access(userId, resource, at);
        Iterator<Access> newestFirst = accesses.descendingIterator();
        while (newestFirst.hasNext()) {
            if (newestFirst.next().equals(target)) {
                newestFirst.remove();
                return;
            }
        }
    }

    /**
     * Counts requests by the user for the resource within {@code lookback} of {@code now},
     * capped at the cache window.
     */
    public synchronized int count(@NonNull String userId, @NonNull String resource,
                                  @NonNull Duration lookback, @NonNull Instant now) {
        Duration effective = lookback.compareTo(window) > 0 ? window : lookback;
        Instant since = now.minus(effective);
        int count = 0;
        for (Access access : accesses) {
            if (access.at().isAfter(since)
                    && access.userId().equals(userId)
                    && access.resource().equals(resource)) {
                count++;
            }
        }
        return count;
    }

    public synchronized int size() {
        return accesses.size();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!accesses.isEmpty() && !accesses.peekFirst().at().isAfter(cutoff)) {
            accesses.removeFirst();
        }
    }

    private record Access(String userId, String resource, Instant at) {
    }
}
