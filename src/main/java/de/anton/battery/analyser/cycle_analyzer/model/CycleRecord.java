package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Objects;

/**
 * One charge/discharge cycle of a single test channel, as read from the "Cycle" sheet.
 * Capacities are specific values in mAh/g, voltage in V, energy in mWh/g.
 * Missing measurements are stored as {@link Double#NaN}.
 */
public final class CycleRecord {

    private final int cycleIndex;                 // 0-based position in the channel's sequence
    private final double chargeCapacity;
    private final double dischargeCapacity;
    private final double medianDischargeVoltage;
    private final double dischargeEnergy;

    public CycleRecord(int cycleIndex, double chargeCapacity, double dischargeCapacity,
                       double medianDischargeVoltage, double dischargeEnergy) {
        if (cycleIndex < 0) {
            throw new IllegalArgumentException("Cycle index cannot be negative. Got: " + cycleIndex);
        }
        this.cycleIndex = cycleIndex;
        this.chargeCapacity = chargeCapacity;
        this.dischargeCapacity = dischargeCapacity;
        this.medianDischargeVoltage = medianDischargeVoltage;
        this.dischargeEnergy = dischargeEnergy;
    }

    // --- Getters ---
    public int getCycleIndex() { return cycleIndex; }
    public double getChargeCapacity() { return chargeCapacity; }
    public double getDischargeCapacity() { return dischargeCapacity; }
    public double getMedianDischargeVoltage() { return medianDischargeVoltage; }
    public double getDischargeEnergy() { return dischargeEnergy; }

    @Override
    public String toString() {
        return String.format("CycleRecord[#%d, Q=%.2f, D=%.2f, V=%.3f, E=%.2f]",
                cycleIndex, chargeCapacity, dischargeCapacity, medianDischargeVoltage, dischargeEnergy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CycleRecord that = (CycleRecord) o;
        return cycleIndex == that.cycleIndex
                && Double.compare(that.chargeCapacity, chargeCapacity) == 0
                && Double.compare(that.dischargeCapacity, dischargeCapacity) == 0
                && Double.compare(that.medianDischargeVoltage, medianDischargeVoltage) == 0
                && Double.compare(that.dischargeEnergy, dischargeEnergy) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cycleIndex, chargeCapacity, dischargeCapacity, medianDischargeVoltage, dischargeEnergy);
    }
}
