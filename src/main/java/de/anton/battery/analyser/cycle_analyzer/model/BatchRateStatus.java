package de.anton.battery.analyser.cycle_analyzer.model;

/**
 * Rate-cycle quality of a whole batch, derived from which channels were eligible as reference.
 */
public enum BatchRateStatus {
    NORMAL("Normal"),
    LOW_EFFICIENCY("Low efficiency"),
    VERY_LOW_EFFICIENCY_NO_REFERENCE("Very low efficiency, no reference");

    private final String displayName;

    BatchRateStatus(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
