package com.sensorsentinel.core.io;

import com.sensorsentinel.core.error.StorageException;
import com.sensorsentinel.core.model.Reading;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HttpTrendHistoryClient}.
 */
class HttpTrendHistoryClientTest {

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> body = new AtomicReference<>("{\"records\":[]}");
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final AtomicInteger slowAnswersLeft = new AtomicInteger();
    private final AtomicInteger requests = new AtomicInteger();
    private ExecutorService handlers;
    private HttpTrendHistoryClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/history", exchange -> {
            requests.incrementAndGet();
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            if (slowAnswersLeft.getAndDecrement() > 0) {
                sleepQuietly(1_000);
            }
            int code = failuresLeft.getAndDecrement() > 0 ? 503 : status.get();
            byte[] bytes = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(code, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        handlers = Executors.newCachedThreadPool();
        server.setExecutor(handlers);
        server.start();
        client = newClient(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        handlers.shutdownNow();
    }

    @Test
    @DisplayName("Should request history for the monitor and parse the records")
    void shouldFetchHistory() {
        body.set("{\"records\":["
                + "{\"TIMESTAMP\":\"2024-06-01T00:00:00Z\",\"PROCESS_PARAMETER\":{\"temperature\":70.1}},"
                + "{\"TIMESTAMP\":\"2024-06-01T00:01:00Z\",\"PROCESS_PARAMETER\":{\"temperature\":70.4}}]}");

        List<Reading> history = client.fetchHistory("pump 7", 100);

        assertThat(history).hasSize(2);
        assertThat(history).allSatisfy(r -> assertThat(r.getMonitorId()).isEqualTo("pump 7"));
        assertThat(history.get(1).getSensors()).containsEntry("temperature", 70.4);
        assertThat(lastQuery.get()).isEqualTo("monitorId=pump+7&months=6&limit=100");
    }

    @Test
    @DisplayName("Should skip invalid records and honour the limit")
    void shouldSkipInvalidRecords() {
        body.set("{\"records\":["
                + "{\"TIMESTAMP\":1,\"PROCESS_PARAMETER\":{\"a\":\"bad\"}},"
                + "{\"TIMESTAMP\":2,\"PROCESS_PARAMETER\":{\"a\":1}},"
                + "{\"TIMESTAMP\":3,\"PROCESS_PARAMETER\":{\"a\":2}},"
                + "{\"TIMESTAMP\":4,\"PROCESS_PARAMETER\":{\"a\":3}}]}");

        List<Reading> history = client.fetchHistory("m1", 2);

        assertThat(history).extracting(Reading::getTimestampMillis).containsExactly(2L, 3L);
    }

    @Test
    @DisplayName("Should retry a non-200 answer and return the history once the API recovers")
    void shouldRetryUntilApiRecovers() {
        failuresLeft.set(2);
        body.set("{\"records\":[{\"TIMESTAMP\":1,\"PROCESS_PARAMETER\":{\"a\":1}}]}");

        List<Reading> history = client.fetchHistory("m1", 10);

        assertThat(history).hasSize(1);
        assertThat(requests.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should retry a call that times out")
    void shouldRetryTimedOutCall() {
        slowAnswersLeft.set(1);
        HttpTrendHistoryClient impatient = newClient(Duration.ofMillis(300));

        List<Reading> history = impatient.fetchHistory("m1", 10);

        assertThat(history).isEmpty();
        assertThat(requests.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail on a non-200 answer once the attempts are used up")
    void shouldFailOnHttpError() {
        status.set(503);

        assertThatThrownBy(() -> client.fetchHistory("m1", 10))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("HTTP 503");
        assertThat(requests.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should fail when the answer has no records array")
    void shouldFailOnUnexpectedShape() {
        body.set("{\"rows\":[]}");

        assertThatThrownBy(() -> client.fetchHistory("m1", 10))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("records");
    }

    @Test
    @DisplayName("Should fail on malformed JSON")
    void shouldFailOnMalformedJson() {
        body.set("{\"records\":[");

        assertThatThrownBy(() -> client.fetchHistory("m1", 10))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("malformed");
        assertThat(requests.get()).isEqualTo(1);
    }

    // ---- Helpers

    private HttpTrendHistoryClient newClient(Duration timeout) {
        return new HttpTrendHistoryClient("http://127.0.0.1:" + server.getAddress().getPort() + "/api/",
                timeout, 6, 3, 10);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
