package com.sensorsentinel.core.engine;

import com.sensorsentinel.core.model.ScoredWindow;
import com.sensorsentinel.core.model.WindowSummary;

import java.util.Objects;

/**
 * Outcome of scoring one window summary.
 */
public final class ScoringResult {

    public enum Status {
        SCORED,
        MODEL_UNAVAILABLE,
        SCHEMA_MISMATCH,
        FAILED
    }

    private final Status status;
    private final WindowSummary summary;
    private final ScoredWindow scored;
    private final String reason;

    private ScoringResult(Status status, WindowSummary summary, ScoredWindow scored, String reason) {
        this.status = status;
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.scored = scored;
        this.reason = reason;
    }

    static ScoringResult scored(ScoredWindow scored) {
        return new ScoringResult(Status.SCORED, scored.getSummary(), scored, null);
    }

    static ScoringResult notScored(Status status, WindowSummary summary, String reason) {
        return new ScoringResult(status, summary, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    public WindowSummary getSummary() {
        return summary;
    }

    /** @return the scored window; {@code null} unless {@link Status#SCORED} */
    public ScoredWindow getScored() {
        return scored;
    }

    public String getReason() {
        return reason;
    }

    public boolean isScored() {
        return status == Status.SCORED;
    }

    @Override
    public String toString() {
        return "ScoringResult{status=" + status + ", monitorId='" + summary.getMonitorId() + '\''
                + (scored != null ? ", score=" + scored.getScore() : "")
                + (reason != null ? ", reason='" + reason + '\'' : "") + '}';
    }
}
