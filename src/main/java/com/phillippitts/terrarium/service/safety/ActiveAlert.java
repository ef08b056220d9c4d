package com.phillippitts.terrarium.service.safety;

import java.time.Instant;

/**
 * Operator-facing alert derived from a {@link SafetyViolation} at detection time.
 * Only the acknowledged flag ever changes.
 */
public final class ActiveAlert {

    private final SafetyViolation violation;
    private final Instant raisedAt;
    private volatile boolean acknowledged;

    ActiveAlert(SafetyViolation violation, Instant raisedAt) {
        this.violation = violation;
        this.raisedAt = raisedAt;
    }

    public String type() {
        return violation.type();
    }

    public String message() {
        return violation.message();
    }

    public Severity severity() {
        return violation.severity();
    }

    public SafetyViolation violation() {
        return violation;
    }

    public Instant raisedAt() {
        return raisedAt;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    void acknowledge() {
        this.acknowledged = true;
    }

    @Override
    public String toString() {
        return "ActiveAlert{type=" + type() + ", acknowledged=" + acknowledged + ", raisedAt=" + raisedAt + '}';
    }
}
