package com.sensorsentinel.core.cache;

import com.sensorsentinel.core.model.ModelArtifact;

import java.util.Objects;

/**
 * Result of asking the {@link ModelCache} for a monitor's model.
 *
 * <ul>
 *   <li>{@link Status#FRESH}: a current artifact</li>
 *   <li>{@link Status#DEGRADED}: refresh failed, the previous artifact is served</li>
 *   <li>{@link Status#UNAVAILABLE}: no artifact could be obtained</li>
 * </ul>
 */
public final class Resolution {

    public enum Status {
        FRESH,
        DEGRADED,
        UNAVAILABLE
    }

    private final Status status;
    private final ModelArtifact artifact;
    private final String reason;

    private Resolution(Status status, ModelArtifact artifact, String reason) {
        this.status = status;
        this.artifact = artifact;
        this.reason = reason;
    }

    public static Resolution fresh(ModelArtifact artifact) {
        return new Resolution(Status.FRESH, Objects.requireNonNull(artifact, "artifact must not be null"), null);
    }

    public static Resolution degraded(ModelArtifact artifact, String reason) {
        return new Resolution(Status.DEGRADED, Objects.requireNonNull(artifact, "artifact must not be null"), reason);
    }

    public static Resolution unavailable(String reason) {
        return new Resolution(Status.UNAVAILABLE, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    /** @return the artifact to score with; {@code null} when unavailable */
    public ModelArtifact getArtifact() {
        return artifact;
    }

    /** @return why the resolution is not fresh; {@code null} when fresh */
    public String getReason() {
        return reason;
    }

    public boolean isUsable() {
        return artifact != null;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    @Override
    public String toString() {
        return "Resolution{status=" + status
                + (artifact != null ? ", version=" + artifact.getVersion() : "")
                + (reason != null ? ", reason='" + reason + '\'' : "") + '}';
    }
}
