package com.codeassist.bot.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-user sliding window log limiter.
 *
 * Each user key owns a {@link UserWindow}: a deque of admitted request
 * timestamps plus a {@link java.util.concurrent.locks.ReentrantLock}.
 * Evict, count and append happen under that lock, so two callers for the
 * same key are strictly serialized while different keys never contend.
 *
 * Eviction drops an entry once {@code now - entry > window}; an entry that
 * is exactly {@code window} old still counts. Denied attempts are not
 * recorded.
 *
 * Windows are created lazily on the first request and removed by
 * {@link #sweep(Instant)} once they hold no recent entries. State is
 * process-local and is lost on restart.
 *
 * Usage example:
 * <pre>
 * SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(10, Duration.ofSeconds(60));
 * if (!limiter.check("user:42")) {
 *     Duration wait = limiter.resetTime("user:42");
 * }
 * </pre>
 */
public final class SlidingWindowRateLimiter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final int maxRequests;
    private final long windowMillis;
    private final Clock clock;
    private final Map<String, UserWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, Clock.systemUTC());
    }

    /**
     * @param maxRequests admitted requests per window, must be > 0
     * @param window trailing window length, must be positive
     * @param clock time source for the overloads that take no {@code now}
     * @throws IllegalArgumentException if either limit is not positive
     */
    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0");
        }
        if (window == null || window.toMillis() <= 0) {
            throw new IllegalArgumentException("window must be at least 1 millisecond");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        LOGGER.info("Rate limiter initialized: {} requests per {} seconds", maxRequests, window.toSeconds());
    }

    /**
     * Same as {@link #check(String, Instant)} with the time read from the
     * clock after the user's lock is taken.
     */
    public boolean check(String userKey) {
        return admit(userKey, clock::millis);
    }

    /**
     * Admits the request and records it, or denies it without recording.
     *
     * @param userKey opaque user identifier
     * @param now time of the attempt
     * @return true if admitted
     */
    public boolean check(String userKey, Instant now) {
        long nowMillis = now.toEpochMilli();
        return admit(userKey, () -> nowMillis);
    }

    private boolean admit(String userKey, LongSupplier time) {
        requireKey(userKey);
        while (true) {
            UserWindow window = windows.computeIfAbsent(userKey, ignored -> new UserWindow());
            window.lock().lock();
            try {
                if (window.isRetired()) {
                    continue;
                }
                long nowMillis = time.getAsLong();
                window.evictOlderThan(nowMillis, windowMillis);
                if (window.size() >= maxRequests) {
                    LOGGER.warn("Rate limit exceeded for user {}", userKey);
                    return false;
                }
                window.record(nowMillis);
                return true;
            } finally {
                window.lock().unlock();
            }
        }
    }

    public int remaining(String userKey) {
        return remaining(userKey, clock.instant());
    }

    /**
     * Requests still available in the current window; never records anything.
     *
     * @return a value in {@code [0, maxRequests]}
     */
    public int remaining(String userKey, Instant now) {
        requireKey(userKey);
        long nowMillis = now.toEpochMilli();
        int used = readWindow(userKey, window -> {
            window.evictOlderThan(nowMillis, windowMillis);
            return window.size();
        });
        return Math.max(0, maxRequests - used);
    }

    public Duration resetTime(String userKey) {
        return resetTime(userKey, clock.instant());
    }

    /**
     * Time until the oldest entry leaves the window, or zero when the user
     * is not currently saturated.
     */
    public Duration resetTime(String userKey, Instant now) {
        requireKey(userKey);
        long nowMillis = now.toEpochMilli();
        long waitMillis = readWindow(userKey, window -> {
            window.evictOlderThan(nowMillis, windowMillis);
            if (window.size() < maxRequests) {
                return 0L;
            }
            return window.oldest() + windowMillis - nowMillis;
        });
        return Duration.ofMillis(Math.max(0L, waitMillis));
    }

    public int sweep() {
        return sweep(clock.instant());
    }

    /**
     * Drops every user key whose window is empty after eviction.
     *
     * Each window is inspected under its own lock, so a concurrent
     * {@link #check(String, Instant)} for the same key either runs first and
     * keeps the window alive, or finds it retired and starts a fresh one.
     *
     * @return number of keys removed
     */
    public int sweep(Instant now) {
        long nowMillis = now.toEpochMilli();
        int removed = 0;
        for (Map.Entry<String, UserWindow> entry : windows.entrySet()) {
            UserWindow window = entry.getValue();
            window.lock().lock();
            try {
                if (window.isRetired()) {
                    continue;
                }
                window.evictOlderThan(nowMillis, windowMillis);
                if (window.isEmpty()) {
                    window.retire();
                    windows.remove(entry.getKey(), window);
                    removed++;
                }
            } finally {
                window.lock().unlock();
            }
        }
        if (removed > 0) {
            LOGGER.info("Cleaned up rate limit data for {} inactive users", removed);
        }
        return removed;
    }

    public int trackedUsers() {
        return windows.size();
    }

    public int maxRequests() {
        return maxRequests;
    }

    public Duration window() {
        return Duration.ofMillis(windowMillis);
    }

    private <T> T readWindow(String userKey, Function<UserWindow, T> reader) {
        UserWindow window = windows.get(userKey);
        if (window == null) {
            return reader.apply(new UserWindow());
        }
        window.lock().lock();
        try {
            return reader.apply(window);
        } finally {
            window.lock().unlock();
        }
    }

    private static void requireKey(String userKey) {
        if (userKey == null) {
            throw new IllegalArgumentException("userKey cannot be null");
        }
    }
}
