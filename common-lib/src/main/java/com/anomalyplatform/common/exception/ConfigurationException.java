package com.anomalyplatform.common.exception;

import java.util.List;

/**
 * Invalid detection configuration. Fatal: raised at load time, before any run starts.
 */
public class ConfigurationException extends RuntimeException {
    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid detection configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}
