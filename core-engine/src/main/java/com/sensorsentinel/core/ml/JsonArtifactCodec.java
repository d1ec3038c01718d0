package com.sensorsentinel.core.ml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sensorsentinel.core.error.StorageException;
import com.sensorsentinel.core.model.ModelArtifact;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Stores artifacts as a single JSON document:
 *
 * <pre>
 * {
 *   "formatVersion": 1,
 *   "monitorId": "pump-7",
 *   "version": "1718000000000",
 *   "builtAt": "2024-06-10T06:13:20Z",
 *   "valid": true,
 *   "trainingSamples": 4312,
 *   "featureNames": ["pressure", "temperature"],
 *   "scaler": {"type": "robust", ...},
 *   "model": {"type": "isolation-forest", ...}
 * }
 * </pre>
 *
 * Thread-safe once configured.
 */
public class JsonArtifactCodec implements ArtifactCodec {

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper;

    public JsonArtifactCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Register an additional {@link AnomalyModel} or {@link FeatureScaler}
     * implementation under a type name. Call before first use.
     *
     * @return this codec
     */
    public JsonArtifactCodec registerType(Class<?> type, String name) {
        mapper.registerSubtypes(new NamedType(type, name));
        return this;
    }

    @Override
    public byte[] encode(ModelArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        Document doc = new Document();
        doc.formatVersion = FORMAT_VERSION;
        doc.monitorId = artifact.getMonitorId();
        doc.version = artifact.getVersion();
        doc.builtAt = artifact.getBuiltAt();
        doc.valid = artifact.isValid();
        doc.trainingSamples = artifact.getTrainingSamples();
        doc.featureNames = artifact.getFeatureNames();
        doc.scaler = artifact.getScaler();
        doc.model = artifact.getModel();
        try {
            return mapper.writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new StorageException(artifact.getMonitorId(), "Failed to encode model artifact", e);
        }
    }

    @Override
    public ModelArtifact decode(String monitorId, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new StorageException(monitorId, "Stored model artifact is empty");
        }
        Document doc;
        try {
            doc = mapper.readValue(bytes, Document.class);
        } catch (IOException e) {
            throw new StorageException(monitorId, "Stored model artifact is not readable: " + e.getMessage(), e);
        }
        if (doc.formatVersion != FORMAT_VERSION) {
            throw new StorageException(monitorId, "Unsupported artifact format version " + doc.formatVersion);
        }
        if (doc.monitorId == null || doc.builtAt == null || doc.featureNames == null
                || doc.scaler == null || doc.model == null) {
            throw new StorageException(monitorId, "Stored model artifact is incomplete");
        }
        if (doc.scaler.dimension() != doc.featureNames.size()) {
            throw new StorageException(monitorId, "Scaler dimension " + doc.scaler.dimension()
                    + " does not match " + doc.featureNames.size() + " feature names");
        }
        return ModelArtifact.builder()
                .monitorId(doc.monitorId)
                .version(doc.version)
                .builtAt(doc.builtAt)
                .valid(doc.valid)
                .trainingSamples(doc.trainingSamples)
                .featureNames(doc.featureNames)
                .scaler(doc.scaler)
                .model(doc.model)
                .build();
    }

    /** Wire shape of a stored artifact. */
    static class Document {
        public int formatVersion;
        public String monitorId;
        public String version;
        public Instant builtAt;
        public boolean valid;
        public int trainingSamples;
        public List<String> featureNames;
        public FeatureScaler scaler;
        public AnomalyModel model;
    }
}
