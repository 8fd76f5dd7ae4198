package com.marketintel.core;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResilientCallerTest {

    @Test
    void call_shouldInvokeThunkOnceWithinTtlAndAgainAfterExpiry() {
        FakeTicker ticker = new FakeTicker();
        ResilientCaller caller = newCaller(ticker, new ArrayList<>());
        AtomicInteger invocations = new AtomicInteger();

        String first = caller.call("tavily_search_AI", () -> "result-" + invocations.incrementAndGet());
        ticker.advance(Duration.ofMinutes(30));
        String second = caller.call("tavily_search_AI", () -> "result-" + invocations.incrementAndGet());
        ticker.advance(Duration.ofMinutes(31));
        String third = caller.call("tavily_search_AI", () -> "result-" + invocations.incrementAndGet());

        assertEquals("result-1", first);
        assertEquals("result-1", second);
        assertEquals("result-2", third);
        assertEquals(2, invocations.get());
    }

    @Test
    void call_shouldShareCacheEntryAcrossEquivalentSignatures() {
        ResilientCaller caller = newCaller(new FakeTicker(), new ArrayList<>());
        AtomicInteger invocations = new AtomicInteger();

        caller.call("  NewsAPI   Search  AI ", () -> invocations.incrementAndGet());
        caller.call("newsapi search ai", () -> invocations.incrementAndGet());

        assertEquals(1, invocations.get());
    }

    @Test
    void call_shouldRetryWithExponentialBackoffThenSucceed() {
        List<Long> sleeps = new ArrayList<>();
        ResilientCaller caller = newCaller(new FakeTicker(), sleeps);
        AtomicInteger attempts = new AtomicInteger();

        String value = caller.call("flaky", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("temporary");
            }
            return "ok";
        });

        assertEquals("ok", value);
        assertEquals(3, attempts.get());
        assertEquals(List.of(2000L, 4000L), sleeps);
    }

    @Test
    void call_shouldThrowAfterThreeAttempts() {
        List<Long> sleeps = new ArrayList<>();
        ResilientCaller caller = newCaller(new FakeTicker(), sleeps);
        AtomicInteger attempts = new AtomicInteger();

        ExternalCallException ex = assertThrows(ExternalCallException.class, () -> caller.call("down", () -> {
            attempts.incrementAndGet();
            throw new IOException("service unavailable");
        }));

        assertEquals(3, attempts.get());
        assertEquals(3, ex.attempts());
        assertEquals("down", ex.signature());
        assertTrue(ex.getCause() instanceof IOException);
        assertEquals(0, caller.cachedEntries());
    }

    @Test
    void backoffMillis_shouldDoubleAndCap() {
        ResilientCaller caller = newCaller(new FakeTicker(), new ArrayList<>());

        assertEquals(2000L, caller.backoffMillis(1));
        assertEquals(4000L, caller.backoffMillis(2));
        assertEquals(8000L, caller.backoffMillis(3));
        assertEquals(8000L, caller.backoffMillis(4));
    }

    @Test
    void call_shouldNotCacheNullResults() {
        ResilientCaller caller = newCaller(new FakeTicker(), new ArrayList<>());
        AtomicInteger invocations = new AtomicInteger();

        assertNull(caller.call("empty", () -> {
            invocations.incrementAndGet();
            return null;
        }));
        caller.call("empty", () -> {
            invocations.incrementAndGet();
            return null;
        });

        assertEquals(2, invocations.get());
    }

    @Test
    void invalidateAll_shouldForceTheNextCallToRunAgain() {
        ResilientCaller caller = newCaller(new FakeTicker(), new ArrayList<>());
        AtomicInteger invocations = new AtomicInteger();

        assertEquals(1, caller.call("newsapi_direct_ai", () -> invocations.incrementAndGet()));
        assertEquals(1, caller.cachedEntries());
        caller.invalidateAll();
        assertEquals(0, caller.cachedEntries());

        assertEquals(2, caller.call("newsapi_direct_ai", () -> invocations.incrementAndGet()));
        assertEquals(2, invocations.get());
    }

    @Test
    void call_shouldEvictBeyondCapacity() {
        ResilientCaller caller = new ResilientCaller(
                Duration.ofHours(1), 2, 3, 0L, 0L, new FakeTicker(), millis -> { });

        caller.call("a", () -> "1");
        caller.call("b", () -> "2");
        caller.call("c", () -> "3");

        assertTrue(caller.cachedEntries() <= 2);
    }

    @Test
    void normalize_shouldLowercaseTrimAndCollapseWhitespace() {
        assertEquals("fetch_https://example.com/a b", ResilientCaller.normalize("  FETCH_https://Example.com/A \t B "));
        assertEquals("", ResilientCaller.normalize(null));
    }

    private static ResilientCaller newCaller(FakeTicker ticker, List<Long> sleeps) {
        return new ResilientCaller(Duration.ofHours(1), 100, 3, 2000L, 8000L, ticker, sleeps::add);
    }

    private static final class FakeTicker implements Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(Duration duration) {
            nanos.addAndGet(TimeUnit.NANOSECONDS.convert(duration));
        }
    }
}
