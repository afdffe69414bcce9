package com.example.shortlink.service;

import com.example.shortlink.config.ShortLinkProperties;
import com.example.shortlink.exception.CounterNotInitializedException;
import com.example.shortlink.support.InMemoryCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class UrlCounterAllocatorTest {

    private static final long INITIAL = 1_000_000_000L;

    private InMemoryCacheStore cacheStore;
    private UrlCounterAllocator allocator;

    @BeforeEach
    public void setUp() {
        cacheStore = new InMemoryCacheStore();
        allocator = new UrlCounterAllocator(cacheStore, new ShortLinkProperties());
    }

    @Test
    public void testInitialize_absentCounter_setsInitialValue() {
        assertFalse(cacheStore.exists("url_counter"));

        allocator.initialize();

        assertEquals(INITIAL, allocator.currentValue().getAsLong());
    }

    @Test
    public void testInitialize_existingCounter_doesNotOverwrite() {
        allocator.initialize();
        allocator.incrementAndGet();
        allocator.incrementAndGet();

        allocator.initialize();

        assertEquals(INITIAL + 2, allocator.currentValue().getAsLong());
    }

    @Test
    public void testIncrementAndGet_returnsIncrementedValue() {
        allocator.initialize();

        assertEquals(INITIAL + 1, allocator.incrementAndGet());
        assertEquals(INITIAL + 2, allocator.incrementAndGet());
        assertEquals(INITIAL + 2, allocator.currentValue().getAsLong());
    }

    @Test
    public void testIncrementAndGet_withoutInitialize_throwsException() {
        CounterNotInitializedException e = assertThrows(CounterNotInitializedException.class,
                () -> allocator.incrementAndGet());

        assertEquals("url_counter", e.getCounterKey());
        assertFalse(cacheStore.exists("url_counter"));
    }

    @Test
    public void testIncrementAndGet_afterClear_requiresInitializeAgain() {
        allocator.initialize();
        allocator.incrementAndGet();

        cacheStore.clear();

        assertThrows(CounterNotInitializedException.class, () -> allocator.incrementAndGet());
    }

    @Test
    public void testInitialize_concurrentCalls_writeOnce() throws Exception {
        int threads = 16;
        runConcurrently(threads, () -> {
            allocator.initialize();
            return null;
        });

        assertEquals(1, cacheStore.counterWrites());
        assertEquals(INITIAL, allocator.currentValue().getAsLong());
    }

    @Test
    public void testIncrementAndGet_concurrentCalls_neverReturnSameValue() throws Exception {
        allocator.initialize();
        int threads = 8;
        int perThread = 500;
        Set<Long> values = ConcurrentHashMap.newKeySet();

        runConcurrently(threads, () -> {
            for (int i = 0; i < perThread; i++) {
                assertTrue(values.add(allocator.incrementAndGet()), "duplicate counter value");
            }
            return null;
        });

        assertEquals(threads * perThread, values.size());
        assertEquals(INITIAL + threads * perThread, allocator.currentValue().getAsLong());
    }

    private static void runConcurrently(int threads, Callable<Void> task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Void>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            for (Future<Void> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
