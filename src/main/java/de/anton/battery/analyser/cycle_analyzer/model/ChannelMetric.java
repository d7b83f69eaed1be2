package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.function.Function;

/**
 * Scalar per-channel values usable as outlier metrics, PCA features or the traditional reference metric.
 */
public enum ChannelMetric {
    FIRST_CHARGE("First charge (mAh/g)", ChannelSummary::getFirstCharge),
    FIRST_DISCHARGE("First discharge (mAh/g)", ChannelSummary::getFirstDischarge),
    FIRST_EFFICIENCY("First efficiency (%)", ChannelSummary::getFirstEfficiency),
    FIRST_VOLTAGE("First voltage (V)", ChannelSummary::getFirstVoltage),
    FIRST_ENERGY("First energy (mWh/g)", ChannelSummary::getFirstEnergy),
    CYCLE2_DISCHARGE("Cycle2 discharge (mAh/g)", c -> c.getCycleDischarge(2)),
    CYCLE3_DISCHARGE("Cycle3 discharge (mAh/g)", c -> c.getCycleDischarge(3)),
    CYCLE4_DISCHARGE("Cycle4 discharge (mAh/g)", c -> c.getCycleDischarge(4)),
    CYCLE5_DISCHARGE("Cycle5 discharge (mAh/g)", c -> c.getCycleDischarge(5)),
    CYCLE6_DISCHARGE("Cycle6 discharge (mAh/g)", c -> c.getCycleDischarge(6)),
    CYCLE7_DISCHARGE("Cycle7 discharge (mAh/g)", c -> c.getCycleDischarge(7)),
    RATE_DISCHARGE("1C discharge (mAh/g)", ChannelSummary::getRateDischarge),
    RATE_EFFICIENCY("1C efficiency (%)", ChannelSummary::getRateEfficiency),
    CURRENT_CAPACITY_RETENTION("Current capacity retention (%)", ChannelSummary::getCurrentCapacityRetention);

    private final String displayName;
    private final Function<ChannelSummary, Double> extractor;

    ChannelMetric(String displayName, Function<ChannelSummary, Double> extractor) {
        this.displayName = displayName;
        this.extractor = extractor;
    }

    /**
     * Reads this metric from a channel.
     *
     * @return the value, or null if the channel has none or it is NaN.
     */
    public Double extract(ChannelSummary channel) {
        if (channel == null) {
            return null;
        }
        Double value = extractor.apply(channel);
        return (value == null || value.isNaN() || value.isInfinite()) ? null : value;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /** Parses an enum name case-insensitively ("first_discharge", "CYCLE4_DISCHARGE"). */
    public static ChannelMetric fromConfigName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Metric name cannot be empty.");
        }
        try {
            return valueOf(name.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown channel metric: '" + name + "'", e);
        }
    }
}
