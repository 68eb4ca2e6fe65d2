package com.telemetryrelay.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Progress of the current (or most recent) replay run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReplayStatus {

    @JsonProperty("isReplaying")
    private final boolean replaying;

    @JsonProperty("processed")
    private final long processed;

    @JsonProperty("errors")
    private final long errors;

    @JsonProperty("interrupted")
    private final boolean interrupted;

    @JsonProperty("started")
    private final Instant started;

    @JsonProperty("completed")
    private final Instant completed;

    public ReplayStatus(boolean replaying, long processed, long errors, boolean interrupted,
                        Instant started, Instant completed) {
        this.replaying = replaying;
        this.processed = processed;
        this.errors = errors;
        this.interrupted = interrupted;
        this.started = started;
        this.completed = completed;
    }

    public boolean isReplaying() {
        return replaying;
    }

    public long getProcessed() {
        return processed;
    }

    public long getErrors() {
        return errors;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public Instant getStarted() {
        return started;
    }

    public Instant getCompleted() {
        return completed;
    }

    @Override
    public String toString() {
        return "ReplayStatus{replaying=" + replaying + ", processed=" + processed + ", errors=" + errors
                + ", interrupted=" + interrupted + ", started=" + started + ", completed=" + completed + "}";
    }
}
