package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Retention figures of one channel: at the last available cycle ("current") and at fixed
 * offsets from the baseline cycle. Offsets beyond the recorded cycles map to {@link RetentionPoint#EMPTY}.
 */
public final class RetentionMetrics {

    private final int baselineIndex;
    private final RetentionPoint current;
    private final Double voltageDecayRate; // mV per cycle, null if no cycles elapsed
    private final Map<Integer, RetentionPoint> offsetPoints;

    public RetentionMetrics(int baselineIndex, RetentionPoint current, Double voltageDecayRate,
                            Map<Integer, RetentionPoint> offsetPoints) {
        this.baselineIndex = baselineIndex;
        this.current = Objects.requireNonNull(current, "Current retention point cannot be null.");
        this.voltageDecayRate = voltageDecayRate;
        this.offsetPoints = offsetPoints != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(offsetPoints))
                : Collections.emptyMap();
    }

    public int getBaselineIndex() { return baselineIndex; }
    public RetentionPoint getCurrent() { return current; }
    public Double getVoltageDecayRate() { return voltageDecayRate; }
    public Map<Integer, RetentionPoint> getOffsetPoints() { return offsetPoints; }

    /** Retention at {@code baseline + offset}, or {@link RetentionPoint#EMPTY} if that cycle does not exist. */
    public RetentionPoint getAtOffset(int offset) {
        return offsetPoints.getOrDefault(offset, RetentionPoint.EMPTY);
    }

    @Override
    public String toString() {
        return String.format("RetentionMetrics[baseline=%d, current=%s, decay=%s mV/cycle, offsets=%s]",
                baselineIndex, current, voltageDecayRate, offsetPoints);
    }
}
