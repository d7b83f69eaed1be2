package de.anton.battery.analyser.cycle_analyzer.model;

/**
 * Classification of a channel's rate (1C) cycle.
 */
public enum RateStatus {
    NORMAL("Normal"),
    LOW_EFFICIENCY("Low efficiency"),
    VERY_LOW_EFFICIENCY("Very low efficiency"),
    OVERCHARGE("Overcharge"),
    NOT_FOUND("No rate cycle");

    private final String displayName;

    RateStatus(String displayName) {
        this.displayName = displayName;
    }

    /** True for statuses that exclude a channel from reference selection. */
    public boolean isSevere() {
        return this == VERY_LOW_EFFICIENCY || this == OVERCHARGE;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
