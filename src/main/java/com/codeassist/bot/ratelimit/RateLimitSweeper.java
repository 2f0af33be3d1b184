package com.codeassist.bot.ratelimit;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link SlidingWindowRateLimiter#sweep()} on a fixed schedule so idle
 * users do not accumulate in memory.
 */
public final class RateLimitSweeper implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RateLimitSweeper.class);

    private final SlidingWindowRateLimiter limiter;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public RateLimitSweeper(SlidingWindowRateLimiter limiter, Duration interval) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.limiter = limiter;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limit-sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        long seconds = interval.toSeconds();
        scheduler.scheduleAtFixedRate(this::sweepOnce, seconds, seconds, TimeUnit.SECONDS);
        LOGGER.info("Rate limit sweep scheduled every {} seconds", seconds);
    }

    void sweepOnce() {
        try {
            limiter.sweep();
        } catch (RuntimeException error) {
            // an exception escaping here would cancel every later run
            LOGGER.error("Rate limit sweep failed", error);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
