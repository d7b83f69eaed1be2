package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One summary row per batch: channel counts, means of the surviving channels' first-cycle and
 * early-cycle values, and the reference channel's own rate-cycle and retention values.
 */
public final class BatchStatistics {

    private final BatchKey batchKey;
    private final String shelfTime;
    private final int totalCount;
    private final int validCount;

    private final Double meanFirstCharge;
    private final Double meanFirstDischarge;
    private final Double meanFirstEfficiency;
    private final Double meanFirstVoltage;
    private final Double meanFirstEnergy;
    private final Double meanActiveMass;
    private final List<Double> meanCycleDischarge; // Cycle2..Cycle7
    private final List<Double> meanCycleCharge;

    private final ReferenceChannelChoice referenceChoice; // null if the batch has no rate data
    private final String referenceChannel;
    private final Integer rateCycleIndex;
    private final Double rateCharge;
    private final Double rateDischarge;
    private final Double rateEfficiency;
    private final RateStatus rateStatus;
    private final Double rateRatio;
    private final Integer referenceCycleCount;
    private final Double currentCapacityRetention;
    private final Double currentVoltageRetention;
    private final Double currentEnergyRetention;
    private final Double voltageDecayRate;
    private final Map<Integer, RetentionPoint> offsetRetention;

    private BatchStatistics(Builder b) {
        this.batchKey = Objects.requireNonNull(b.batchKey, "Batch key cannot be null.");
        this.shelfTime = b.shelfTime;
        this.totalCount = b.totalCount;
        this.validCount = b.validCount;
        this.meanFirstCharge = b.meanFirstCharge;
        this.meanFirstDischarge = b.meanFirstDischarge;
        this.meanFirstEfficiency = b.meanFirstEfficiency;
        this.meanFirstVoltage = b.meanFirstVoltage;
        this.meanFirstEnergy = b.meanFirstEnergy;
        this.meanActiveMass = b.meanActiveMass;
        this.meanCycleDischarge = Collections.unmodifiableList(Arrays.asList(b.meanCycleDischarge.clone()));
        this.meanCycleCharge = Collections.unmodifiableList(Arrays.asList(b.meanCycleCharge.clone()));
        this.referenceChoice = b.referenceChoice;

        ChannelSummary ref = b.referenceChoice != null ? b.referenceChoice.getChosen() : null;
        this.referenceChannel = ref != null ? ref.getChannelKey() : null;
        this.rateCycleIndex = ref != null ? ref.getRateCycleIndex() : null;
        this.rateCharge = ref != null ? ref.getRateCharge() : null;
        this.rateDischarge = ref != null ? ref.getRateDischarge() : null;
        this.rateEfficiency = ref != null ? ref.getRateEfficiency() : null;
        this.rateStatus = ref != null ? ref.getRateStatus() : null;
        this.rateRatio = ref != null ? ref.getRateRatio() : null;
        this.referenceCycleCount = ref != null ? ref.getCurrentCycleCount() : null;
        this.currentCapacityRetention = ref != null ? ref.getCurrentCapacityRetention() : null;
        this.currentVoltageRetention = ref != null ? ref.getCurrentVoltageRetention() : null;
        this.currentEnergyRetention = ref != null ? ref.getCurrentEnergyRetention() : null;
        this.voltageDecayRate = ref != null ? ref.getVoltageDecayRate() : null;
        this.offsetRetention = ref != null && ref.getRetention() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(ref.getRetention().getOffsetPoints()))
                : Collections.emptyMap();
    }

    public static Builder builder(BatchKey key) {
        return new Builder(key);
    }

    public BatchKey getBatchKey() { return batchKey; }
    public String getSeries() { return batchKey.series(); }
    public String getUnifiedBatchId() { return batchKey.unifiedBatchId(); }
    public String getShelfTime() { return shelfTime; }
    public int getTotalCount() { return totalCount; }
    public int getValidCount() { return validCount; }

    public Double getMeanFirstCharge() { return meanFirstCharge; }
    public Double getMeanFirstDischarge() { return meanFirstDischarge; }
    public Double getMeanFirstEfficiency() { return meanFirstEfficiency; }
    public Double getMeanFirstVoltage() { return meanFirstVoltage; }
    public Double getMeanFirstEnergy() { return meanFirstEnergy; }
    public Double getMeanActiveMass() { return meanActiveMass; }
    public Double getMeanCycleDischarge(int cycleNumber) { return meanCycleDischarge.get(cycleNumber - ChannelSummary.FIRST_EARLY_CYCLE); }
    public Double getMeanCycleCharge(int cycleNumber) { return meanCycleCharge.get(cycleNumber - ChannelSummary.FIRST_EARLY_CYCLE); }

    public ReferenceChannelChoice getReferenceChoice() { return referenceChoice; }
    public BatchRateStatus getBatchRateStatus() { return referenceChoice != null ? referenceChoice.getBatchRateStatus() : null; }
    public ReferenceMethod getReferenceMethod() { return referenceChoice != null ? referenceChoice.getMethod() : null; }
    /** Size of the status-eligible 1C subset, null if the batch has no rate data. */
    public Integer getRateValidCount() { return referenceChoice != null ? referenceChoice.getEligibleCount() : null; }
    public String getReferenceChannel() { return referenceChannel; }
    public Integer getRateCycleIndex() { return rateCycleIndex; }
    public Double getRateCharge() { return rateCharge; }
    public Double getRateDischarge() { return rateDischarge; }
    public Double getRateEfficiency() { return rateEfficiency; }
    public RateStatus getRateStatus() { return rateStatus; }
    public Double getRateRatio() { return rateRatio; }
    public Integer getReferenceCycleCount() { return referenceCycleCount; }
    public Double getCurrentCapacityRetention() { return currentCapacityRetention; }
    public Double getCurrentVoltageRetention() { return currentVoltageRetention; }
    public Double getCurrentEnergyRetention() { return currentEnergyRetention; }
    public Double getVoltageDecayRate() { return voltageDecayRate; }
    public RetentionPoint getRetentionAtOffset(int offset) { return offsetRetention.getOrDefault(offset, RetentionPoint.EMPTY); }

    @Override
    public String toString() {
        return String.format("BatchStatistics[%s, valid=%d/%d, D1=%s, E1=%s, reference=%s]",
                batchKey, validCount, totalCount, meanFirstDischarge, meanFirstEfficiency, referenceChannel);
    }

    public static final class Builder {
        private final BatchKey batchKey;
        private String shelfTime;
        private int totalCount;
        private int validCount;
        private Double meanFirstCharge;
        private Double meanFirstDischarge;
        private Double meanFirstEfficiency;
        private Double meanFirstVoltage;
        private Double meanFirstEnergy;
        private Double meanActiveMass;
        private final Double[] meanCycleDischarge = new Double[ChannelSummary.LAST_EARLY_CYCLE - ChannelSummary.FIRST_EARLY_CYCLE + 1];
        private final Double[] meanCycleCharge = new Double[ChannelSummary.LAST_EARLY_CYCLE - ChannelSummary.FIRST_EARLY_CYCLE + 1];
        private ReferenceChannelChoice referenceChoice;

        private Builder(BatchKey batchKey) {
            this.batchKey = batchKey;
        }

        public Builder shelfTime(String value) { this.shelfTime = value; return this; }
        public Builder totalCount(int value) { this.totalCount = value; return this; }
        public Builder validCount(int value) { this.validCount = value; return this; }
        public Builder meanFirstCharge(Double value) { this.meanFirstCharge = value; return this; }
        public Builder meanFirstDischarge(Double value) { this.meanFirstDischarge = value; return this; }
        public Builder meanFirstEfficiency(Double value) { this.meanFirstEfficiency = value; return this; }
        public Builder meanFirstVoltage(Double value) { this.meanFirstVoltage = value; return this; }
        public Builder meanFirstEnergy(Double value) { this.meanFirstEnergy = value; return this; }
        public Builder meanActiveMass(Double value) { this.meanActiveMass = value; return this; }
        public Builder meanCycleDischarge(int cycleNumber, Double value) { meanCycleDischarge[cycleNumber - ChannelSummary.FIRST_EARLY_CYCLE] = value; return this; }
        public Builder meanCycleCharge(int cycleNumber, Double value) { meanCycleCharge[cycleNumber - ChannelSummary.FIRST_EARLY_CYCLE] = value; return this; }
        public Builder referenceChoice(ReferenceChannelChoice value) { this.referenceChoice = value; return this; }

        public BatchStatistics build() {
            return new BatchStatistics(this);
        }
    }
}
