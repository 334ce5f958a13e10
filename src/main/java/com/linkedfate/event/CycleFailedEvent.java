package com.linkedfate.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a scheduled cycle is abandoned: retries exhausted, timeout, or an
 * unexpected error. {@code job} is "anomaly-detection" or "risk-evaluation".
 */
public class CycleFailedEvent extends ApplicationEvent {

    private final String job;
    private final String reason;
    private final int attempts;

    public CycleFailedEvent(Object source, String job, String reason, int attempts) {
        super(source);
        this.job = job;
        this.reason = reason;
        this.attempts = attempts;
    }

    public String getJob() {
        return job;
    }

    public String getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }
}
