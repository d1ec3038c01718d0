package com.sensorsentinel.core.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorLanes}.
 */
class MonitorLanesTest {

    private MonitorLanes lanes;

    @BeforeEach
    void setUp() {
        lanes = new MonitorLanes(Executors.newFixedThreadPool(4));
    }

    @AfterEach
    void tearDown() {
        lanes.close();
    }

    @Test
    @DisplayName("Should run tasks of one key in submission order, even when they finish asynchronously")
    void shouldSerializePerKey() throws Exception {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            int n = i;
            futures.add(lanes.submit("m1", () -> CompletableFuture.supplyAsync(() -> {
                sleepQuietly(n % 3);
                order.add(n);
                return n;
            })));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            expected.add(i);
        }
        assertThat(order).containsExactlyElementsOf(expected);
    }

    @Test
    @DisplayName("Should let another key proceed while one key is blocked")
    void shouldNotBlockOtherKeys() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        CompletableFuture<String> blocked = lanes.submit("slow", () -> CompletableFuture.supplyAsync(() -> {
            awaitQuietly(gate);
            return "slow";
        }));

        String fast = lanes.submit("fast", () -> CompletableFuture.completedFuture("fast")).get(2, TimeUnit.SECONDS);

        assertThat(fast).isEqualTo("fast");
        assertThat(blocked).isNotDone();
        gate.countDown();
        assertThat(blocked.get(2, TimeUnit.SECONDS)).isEqualTo("slow");
    }

    @Test
    @DisplayName("Should keep the lane running after a failed task")
    void shouldContinueAfterFailure() throws Exception {
        CompletableFuture<String> failed = lanes.submit("m1", () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = lanes.submit("m1", () -> CompletableFuture.completedFuture("ok"));

        assertThatThrownBy(() -> failed.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(next.get(2, TimeUnit.SECONDS)).isEqualTo("ok");
    }

    @Test
    @DisplayName("Should forget a lane once its work has drained")
    void shouldReleaseIdleLanes() throws Exception {
        lanes.submit("m1", () -> CompletableFuture.completedFuture(1)).get(2, TimeUnit.SECONDS);

        assertThat(awaitNoLanes()).isTrue();
    }

    // ---- Helpers

    private boolean awaitNoLanes() throws InterruptedException {
        for (int i = 0; i < 200; i++) {
            if (lanes.activeLanes() == 0) {
                return true;
            }
            Thread.sleep(10);
        }
        return false;
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
