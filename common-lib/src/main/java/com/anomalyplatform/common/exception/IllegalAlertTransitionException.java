package com.anomalyplatform.common.exception;

import com.anomalyplatform.common.alert.AlertStatus;

public class IllegalAlertTransitionException extends RuntimeException {
    private final AlertStatus from;
    private final AlertStatus to;

    public IllegalAlertTransitionException(String alertId, AlertStatus from, AlertStatus to) {
        super("Alert " + alertId + " cannot move from " + from.key() + " to " + to.key());
        this.from = from;
        this.to = to;
    }

    public AlertStatus getFrom() {
        return from;
    }

    public AlertStatus getTo() {
        return to;
    }
}
