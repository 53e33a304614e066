package com.company.workflowsla.domain.enums;

import java.util.Optional;

public enum BreachSeverity {
    WARNING(1, "Duration reached the warning threshold"),
    CRITICAL(2, "Duration reached the critical threshold");

    private final int level;
    private final String description;

    BreachSeverity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(BreachSeverity other) {
        return other == null || this.level > other.level;
    }

    public String value() {
        return name().toLowerCase();
    }

    /**
     * Critical takes precedence; below the warning threshold there is no breach.
     */
    public static Optional<BreachSeverity> classify(long actualMs, long warningThresholdMs, long criticalThresholdMs) {
        if (actualMs >= criticalThresholdMs) {
            return Optional.of(CRITICAL);
        }
        if (actualMs >= warningThresholdMs) {
            return Optional.of(WARNING);
        }
        return Optional.empty();
    }

    public static BreachSeverity fromString(String severity) {
        if (severity == null) {
            return WARNING;
        }
        try {
            return BreachSeverity.valueOf(severity.toUpperCase());
        } catch (IllegalArgumentException e) {
            return WARNING;
        }
    }
}
