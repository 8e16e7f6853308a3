package com.testament.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Base result: a named unit with a status, a free-form record and timing.
 * <p>
 * A result is started when it is created and sealed by {@link #end()}, which stamps the
 * end time and computes the duration.
 */
public class Result {

    private final String name;
    private Status status;
    private String record;
    private Instant startTime;
    private Instant endTime;
    private Duration duration;

    public Result(String name) {
        this(name, null, "");
    }

    public Result(String name, Status status, String record) {
        this.name = name;
        this.status = status;
        this.record = record != null ? record : "";
        this.startTime = Instant.now();
    }

    public Result end() {
        return end(null);
    }

    public Result end(Status status) {
        this.endTime = Instant.now();
        this.duration = Duration.between(startTime, endTime);
        if (status != null) {
            this.status = status;
        }
        return this;
    }

    public String getName() { return name; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public String getRecord() { return record; }
    public void setRecord(String record) { this.record = record != null ? record : ""; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public Duration getDuration() { return duration; }

    public boolean isSealed() {
        return endTime != null;
    }

    public double getTotalSeconds() {
        return duration == null ? 0.0 : duration.toNanos() / 1_000_000_000.0;
    }

    public boolean passed() { return status == Status.PASSED; }
    public boolean failed() { return status == Status.FAILED; }
    public boolean skipped() { return status == Status.SKIPPED; }

    @Override
    public String toString() {
        return name + " Result: {" + status + " | Duration: " + duration + "}";
    }
}
