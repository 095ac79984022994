package service;

import model.ByteString;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class StorageServiceTest {

    private final StorageService storage = new StorageService();

    private static ByteString bs(String value) {
        return ByteString.of(value);
    }

    @Test
    public void testSetThenGetReturnsExactBytes() {
        ByteString key = ByteString.copyOf(new byte[]{0, 'k', 0});
        ByteString value = ByteString.copyOf(new byte[]{(byte) 0xFF, 0, '\r', '\n', (byte) 0x80});

        storage.set(key, value);

        assertEquals(value, storage.get(key));
        assertNull(storage.get(ByteString.copyOf(new byte[]{0, 'k'})));
    }

    @Test
    public void testSetOverwrites() {
        storage.set(bs("k"), bs("v1"));
        storage.set(bs("k"), bs("v2"));
        assertEquals(bs("v2"), storage.get(bs("k")));
        assertEquals(1, storage.size());
    }

    @Test
    public void testEmptyValueIsNotAbsent() {
        storage.set(bs("k"), ByteString.EMPTY);
        assertEquals(ByteString.EMPTY, storage.get(bs("k")));
    }

    @Test
    public void testDeleteCountsOnlyPresentKeys() {
        storage.set(bs("a"), bs("1"));
        storage.set(bs("b"), bs("2"));

        assertEquals(0, storage.delete(List.of(bs("missing"))));
        assertEquals(2, storage.delete(Arrays.asList(bs("a"), bs("x"), bs("b"), bs("a"))));
        assertNull(storage.get(bs("a")));
        assertNull(storage.get(bs("b")));
        assertFalse(storage.delete(bs("a")));
    }

    @Test
    public void testClearRemovesEverything() {
        for (int i = 0; i < 100; i++) {
            storage.set(bs("key" + i), bs("value" + i));
        }

        storage.clear();

        assertEquals(0, storage.size());
        for (int i = 0; i < 100; i++) {
            assertNull(storage.get(bs("key" + i)));
        }
    }

    @Test
    public void testConcurrentSetsOnDistinctKeysAreNotLost() throws Exception {
        int threads = 8;
        int keysPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < keysPerThread; i++) {
                        storage.set(bs("t" + thread + ":" + i), bs("v" + thread + ":" + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * keysPerThread, storage.size());
        for (int t = 0; t < threads; t++) {
            for (int i = 0; i < keysPerThread; i++) {
                assertEquals(bs("v" + t + ":" + i), storage.get(bs("t" + t + ":" + i)));
            }
        }
    }

    @Test
    public void testConcurrentSetsOnSharedKeyLeaveOneWrittenValue() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<ByteString> written = new HashSet<>();
        for (int t = 0; t < threads; t++) {
            written.add(bs("value-from-" + t));
        }
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                ByteString value = bs("value-from-" + t);
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 1000; i++) {
                        storage.set(bs("shared"), value);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(written.contains(storage.get(bs("shared"))));
        assertEquals(1, storage.size());
    }

    @Test
    public void testConcurrentDeletesRemoveEachKeyOnce() throws Exception {
        int keys = 1000;
        for (int i = 0; i < keys; i++) {
            storage.set(bs("k" + i), bs("v"));
        }
        List<ByteString> all = new ArrayList<>();
        for (int i = 0; i < keys; i++) {
            all.add(bs("k" + i));
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> storage.delete(all)));
            }
            long total = 0;
            for (Future<Long> future : futures) {
                total += future.get(30, TimeUnit.SECONDS);
            }
            assertEquals(keys, total);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(0, storage.size());
    }
}
