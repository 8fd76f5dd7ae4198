package com.marketintel.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.marketintel.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Wraps an external call with a time-bounded result cache and a bounded retry loop.
 * <p>
 * Lookups and retries are keyed by a normalized signature. A live cache entry short-circuits the
 * call. Otherwise the thunk runs up to {@code maxAttempts} times with exponential backoff between
 * attempts. Successful non-null results are cached before they are returned. When every attempt
 * fails an {@link ExternalCallException} is thrown and the call site decides whether that is fatal.
 * <p>
 * One instance is shared by all runs of a process; the cache is safe for concurrent callers.
 */
public final class ResilientCaller {
    private static final Logger LOG = LogManager.getLogger(ResilientCaller.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final Cache<String, Object> cache;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public ResilientCaller(Config config) {
        this(
                Duration.ofSeconds(Math.max(1L, config.getLong("cache.ttl_sec", 3600L))),
                Math.max(1, config.getInt("cache.max_entries", 100)),
                Math.max(1, config.getInt("retry.max_attempts", 3)),
                Math.max(0L, config.getLong("retry.base_backoff_ms", 2000L)),
                Math.max(0L, config.getLong("retry.max_backoff_ms", 8000L)),
                Ticker.systemTicker(),
                Thread::sleep
        );
    }

    ResilientCaller(
            Duration ttl,
            int capacity,
            int maxAttempts,
            long baseBackoffMs,
            long maxBackoffMs,
            Ticker ticker,
            Sleeper sleeper
    ) {
        // Same-thread executor keeps size-based eviction synchronous with writes.
        this.cache = Caffeine.newBuilder()
                .maximumSize(capacity)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = baseBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code thunk} unless a live result is cached under {@code signature}.
     * <p>
     * A signature must always be used with the same result type: the cached value is returned as
     * the type of the call that stored it.
     */
    public <T> T call(String signature, Callable<T> thunk) {
        String key = normalize(signature);
        Object cached = cache.getIfPresent(key);
        if (cached != null) {
            LOG.debug("cache hit signature={}", key);
            @SuppressWarnings("unchecked")
            T hit = (T) cached;
            return hit;
        }

        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                T value = thunk.call();
                if (value != null) {
                    cache.put(key, value);
                }
                return value;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExternalCallException(key, attempt, e);
            } catch (Exception e) {
                last = e;
                if (attempt < maxAttempts) {
                    long waitMs = backoffMillis(attempt);
                    LOG.warn("external call failed signature={} attempt={}/{} retry_in_ms={} err={}",
                            key, attempt, maxAttempts, waitMs, e.getMessage());
                    pause(key, attempt, waitMs, e);
                }
            }
        }
        throw new ExternalCallException(key, maxAttempts, last);
    }

    /**
     * Delay before the retry that follows {@code attempt}: base, doubled per attempt, capped.
     */
    long backoffMillis(int attempt) {
        long wait = baseBackoffMs;
        for (int i = 1; i < attempt && wait < maxBackoffMs; i++) {
            wait = wait * 2L;
        }
        return Math.min(wait, maxBackoffMs);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private void pause(String key, int attempt, long waitMs, Exception cause) {
        if (waitMs <= 0L) {
            return;
        }
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            ExternalCallException ex = new ExternalCallException(key, attempt, cause);
            ex.addSuppressed(ie);
            throw ex;
        }
    }
}
