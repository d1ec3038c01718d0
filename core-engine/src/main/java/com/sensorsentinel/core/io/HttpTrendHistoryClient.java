package com.sensorsentinel.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorsentinel.core.cache.TrendHistorySource;
import com.sensorsentinel.core.error.StorageException;
import com.sensorsentinel.core.error.ValidationException;
import com.sensorsentinel.core.model.Reading;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fetches trend history over HTTP.
 *
 * <p>
 * {@code GET <baseUrl>/history?monitorId=<id>&months=<m>&limit=<n>} must
 * answer {@code 200} with {@code {"records": [ ... ]}}, each record shaped
 * like an inbound reading. Records that fail validation are skipped.
 * </p>
 *
 * <p>
 * Timeouts, network errors and non-200 answers are retried up to
 * {@code maxAttempts} times, waiting {@code retryWaitMillis * n} before the
 * n-th retry. A body that cannot be read as history is not retried.
 * </p>
 */
public class HttpTrendHistoryClient implements TrendHistorySource {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTrendHistoryClient.class);

    private final HttpClient client;
    private final URI baseUri;
    private final Duration timeout;
    private final int months;
    private final Retry retry;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ReadingParser parser = new ReadingParser(mapper);

    public HttpTrendHistoryClient(String baseUrl, Duration timeout, int months, int maxAttempts, long retryWaitMillis) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, timeout, months,
                maxAttempts, retryWaitMillis);
    }

    HttpTrendHistoryClient(HttpClient client, String baseUrl, Duration timeout, int months,
            int maxAttempts, long retryWaitMillis) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Trend API base URL must not be blank");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl);
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.months = months;
        this.retry = Retry.of("trend-history", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(attempt -> retryWaitMillis * attempt)
                .retryExceptions(StorageException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                LOG.warn("Retrying trend API call: attempt={} wait={}ms reason={}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable().getMessage()));
    }

    @Override
    public List<Reading> fetchHistory(String monitorId, int limit) {
        URI uri = URI.create(baseUri + "/history?monitorId=" + URLEncoder.encode(monitorId, StandardCharsets.UTF_8)
                + "&months=" + months + "&limit=" + limit);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<byte[]> response = Retry.decorateSupplier(retry, () -> send(request, monitorId)).get();

        JsonNode records;
        try {
            records = mapper.readTree(response.body()).get("records");
        } catch (IOException e) {
            throw new StorageException(monitorId, "Trend API returned malformed JSON", e);
        }
        if (records == null || !records.isArray()) {
            throw new StorageException(monitorId, "Trend API response has no 'records' array");
        }

        List<Reading> readings = new ArrayList<>(records.size());
        int skipped = 0;
        for (JsonNode record : records) {
            if (readings.size() >= limit) {
                break;
            }
            try {
                readings.add(parser.parse(record, monitorId));
            } catch (ValidationException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            LOG.warn("Skipped invalid trend records: monitor={} skipped={} kept={}", monitorId, skipped, readings.size());
        }
        LOG.info("Fetched trend history: monitor={} records={}", monitorId, readings.size());
        return readings;
    }

    private HttpResponse<byte[]> send(HttpRequest request, String monitorId) {
        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new StorageException(monitorId, "Trend API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException(monitorId, "Interrupted while calling trend API", e);
        }
        if (response.statusCode() != 200) {
            throw new StorageException(monitorId, "Trend API answered HTTP " + response.statusCode());
        }
        return response;
    }
}
