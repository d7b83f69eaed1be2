package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Objects;

/**
 * The located rate (1C) cycle of a channel together with its derived values.
 * Capacities and efficiency are rounded to one decimal, the ratio to two.
 */
public final class RateCycleResult {

    private final int cycleIndex;       // 0-based
    private final boolean matched;      // false if the deterministic fallback index was used
    private final Double chargeCapacity;
    private final Double dischargeCapacity;
    private final Double efficiency;    // %
    private final Double rateRatio;     // % of the first-cycle discharge
    private final RateStatus status;

    public RateCycleResult(int cycleIndex, boolean matched, Double chargeCapacity, Double dischargeCapacity,
                           Double efficiency, Double rateRatio, RateStatus status) {
        if (cycleIndex < 0) {
            throw new IllegalArgumentException("Rate cycle index cannot be negative. Got: " + cycleIndex);
        }
        this.cycleIndex = cycleIndex;
        this.matched = matched;
        this.chargeCapacity = chargeCapacity;
        this.dischargeCapacity = dischargeCapacity;
        this.efficiency = efficiency;
        this.rateRatio = rateRatio;
        this.status = Objects.requireNonNull(status, "Rate status cannot be null.");
    }

    public int getCycleIndex() { return cycleIndex; }
    public boolean isMatched() { return matched; }
    public Double getChargeCapacity() { return chargeCapacity; }
    public Double getDischargeCapacity() { return dischargeCapacity; }
    public Double getEfficiency() { return efficiency; }
    public Double getRateRatio() { return rateRatio; }
    public RateStatus getStatus() { return status; }

    @Override
    public String toString() {
        return String.format("RateCycleResult[index=%d, matched=%s, Q=%s, D=%s, E=%s, ratio=%s, status=%s]",
                cycleIndex, matched, chargeCapacity, dischargeCapacity, efficiency, rateRatio, status.name());
    }
}
