package de.anton.battery.analyser.cycle_analyzer.model;

/**
 * Capacity, voltage and energy retention (%) of one target cycle relative to the baseline cycle.
 * A component is null when it could not be computed.
 */
public record RetentionPoint(Double capacityRetention, Double voltageRetention, Double energyRetention) {

    public static final RetentionPoint EMPTY = new RetentionPoint(null, null, null);

    public boolean isEmpty() {
        return capacityRetention == null && voltageRetention == null && energyRetention == null;
    }
}
