package dev.fumaz.unbox.container;

import dev.fumaz.unbox.function.Injectable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentActivationTest {

    private static final int THREADS = 8;

    static class Connection {
    }

    @Test
    void shouldBuildComponentOnceWhenFirstFetchedConcurrently() throws Exception {
        Container container = new UnboxContainer();
        AtomicInteger built = new AtomicInteger();

        container.register("connection", Injectable.builder().build(arguments -> {
            built.incrementAndGet();
            Thread.sleep(20);
            return new Connection();
        }));

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> results = new ArrayList<>();

        try {
            for (int i = 0; i < THREADS; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return container.get("connection");
                }));
            }

            start.countDown();

            Object first = results.get(0).get(5, TimeUnit.SECONDS);

            for (Future<Object> result : results) {
                assertSame(first, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(1, built.get());
        assertTrue(container.isActive("connection"));
    }
}
