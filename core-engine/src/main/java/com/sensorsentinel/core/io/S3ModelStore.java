package com.sensorsentinel.core.io;

import com.sensorsentinel.core.cache.ModelStore;
import com.sensorsentinel.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ModelStore} backed by an S3 bucket.
 *
 * <p>
 * Each monitor's artifact is one object at
 * {@code <prefix>/<monitorId>/model.json}.
 * </p>
 */
public class S3ModelStore implements ModelStore, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(S3ModelStore.class);

    static final String OBJECT_NAME = "model.json";

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;

    public S3ModelStore(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = Objects.requireNonNull(s3Client, "s3Client must not be null");
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Model bucket must not be blank");
        }
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix.replaceAll("^/+|/+$", "");
    }

    /**
     * Create a store with its own S3 client.
     *
     * @param region     AWS region, or {@code null}/blank for the SDK default chain
     * @param apiTimeout bound on a single S3 call, retries included
     */
    public static S3ModelStore create(String bucket, String prefix, String region, Duration apiTimeout) {
        S3ClientBuilder builder = S3Client.builder()
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiTimeout)
                        .build());
        if (region != null && !region.isBlank()) {
            builder.region(Region.of(region));
        }
        LOG.info("Creating S3 model store: bucket={} prefix={} region={}", bucket, prefix, region);
        return new S3ModelStore(builder.build(), bucket, prefix);
    }

    @Override
    public Optional<byte[]> get(String monitorId) {
        String key = objectKey(monitorId);
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(request);
            LOG.debug("Fetched model object: monitor={} key={} bytes={}", monitorId, key, bytes.asByteArray().length);
            return Optional.of(bytes.asByteArray());
        } catch (NoSuchKeyException e) {
            LOG.info("No model object: monitor={} key={}", monitorId, key);
            return Optional.empty();
        } catch (SdkException e) {
            throw new StorageException(monitorId, "Failed to read s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void put(String monitorId, byte[] artifact) {
        String key = objectKey(monitorId);
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType("application/json")
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(artifact));
            LOG.info("Stored model object: monitor={} key={} bytes={}", monitorId, key, artifact.length);
        } catch (SdkException e) {
            throw new StorageException(monitorId, "Failed to write s3://" + bucket + "/" + key, e);
        }
    }

    String objectKey(String monitorId) {
        return (prefix.isEmpty() ? "" : prefix + "/") + monitorId + "/" + OBJECT_NAME;
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
