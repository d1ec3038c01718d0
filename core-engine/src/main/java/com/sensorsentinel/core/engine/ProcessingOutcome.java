package com.sensorsentinel.core.engine;

import com.sensorsentinel.core.model.AnomalyVerdict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What happened to one submitted reading.
 *
 * <p>
 * A reading may release several window summaries. The status is then that
 * of the last summary, while verdicts and published alerts accumulate over
 * all of them.
 * </p>
 */
public final class ProcessingOutcome {

    public enum Status {
        /** Message failed parsing or validation. */
        REJECTED,
        /** Reading arrived behind the lateness tolerance. */
        LATE_DROPPED,
        /** Reading accepted, no summary was due or the window is under-populated. */
        NOT_ENOUGH_DATA,
        MODEL_UNAVAILABLE,
        SCHEMA_MISMATCH,
        SCORING_FAILED,
        /** Scored and decided; verdict not anomalous. */
        NORMAL,
        /** Anomalous verdict published. */
        ALERTED,
        /** Anomalous verdict whose alert could not be published. */
        PUBLISH_FAILED
    }

    private final String monitorId;
    private final Status status;
    private final List<AnomalyVerdict> verdicts;
    private final int alertsPublished;
    private final String detail;

    private ProcessingOutcome(String monitorId, Status status, List<AnomalyVerdict> verdicts,
            int alertsPublished, String detail) {
        this.monitorId = monitorId;
        this.status = status;
        this.verdicts = Collections.unmodifiableList(new ArrayList<>(verdicts));
        this.alertsPublished = alertsPublished;
        this.detail = detail;
    }

    static ProcessingOutcome of(String monitorId, Status status, String detail) {
        return new ProcessingOutcome(monitorId, status, List.of(), 0, detail);
    }

    static ProcessingOutcome decided(AnomalyVerdict verdict, boolean published) {
        Status status = !verdict.isAnomaly() ? Status.NORMAL
                : published ? Status.ALERTED : Status.PUBLISH_FAILED;
        return new ProcessingOutcome(verdict.getMonitorId(), status, List.of(verdict), published ? 1 : 0, null);
    }

    /** Fold the outcome of a later summary of the same reading into this one. */
    ProcessingOutcome then(ProcessingOutcome next) {
        List<AnomalyVerdict> all = new ArrayList<>(verdicts);
        all.addAll(next.verdicts);
        return new ProcessingOutcome(monitorId, next.status, all, alertsPublished + next.alertsPublished,
                next.detail);
    }

    public String getMonitorId() {
        return monitorId;
    }

    public Status getStatus() {
        return status;
    }

    public List<AnomalyVerdict> getVerdicts() {
        return verdicts;
    }

    public int getAlertsPublished() {
        return alertsPublished;
    }

    /** @return failure or skip reason; {@code null} for normal outcomes */
    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "ProcessingOutcome{monitorId='" + monitorId + "', status=" + status
                + ", verdicts=" + verdicts.size() + ", alertsPublished=" + alertsPublished
                + (detail != null ? ", detail='" + detail + '\'' : "") + '}';
    }
}
