package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable per-channel summary: identity, first-cycle metrics, early cycle capacities,
 * rate-cycle evaluation and retention metrics, plus the completed cycle sequence they were derived from.
 * Instances are created through {@link Builder}; the only derived copy is {@link #withUnifiedBatchId(String)}.
 */
public final class ChannelSummary {

    /** Early cycles tracked individually (Cycle2 .. Cycle7, 1-based cycle numbers). */
    public static final int FIRST_EARLY_CYCLE = 2;
    public static final int LAST_EARLY_CYCLE = 7;

    private final String hostId;
    private final String channelId;
    private final String series;
    private final String batchId;
    private final String unifiedBatchId;
    private final String shelfTime;
    private final String sourceFile;
    private final TestMode testMode;
    private final Double activeMass;

    private final Double firstCharge;
    private final Double firstDischarge;
    private final Double firstEfficiency;
    private final Double firstVoltage;
    private final Double firstEnergy;
    private final List<Double> earlyDischarge; // index 0 = Cycle2
    private final List<Double> earlyCharge;

    private final int currentCycleCount;
    private final RateCycleResult rateCycle;   // null if not located or not a rate test
    private final RetentionMetrics retention;  // null if too few cycles
    private final List<CycleRecord> cycles;

    private ChannelSummary(Builder b) {
        this.hostId = Objects.requireNonNull(b.hostId, "Host id cannot be null.");
        this.channelId = Objects.requireNonNull(b.channelId, "Channel id cannot be null.");
        this.series = Objects.requireNonNull(b.series, "Series cannot be null for channel " + b.hostId + "-" + b.channelId);
        this.batchId = Objects.requireNonNull(b.batchId, "Batch id cannot be null for channel " + b.hostId + "-" + b.channelId);
        this.unifiedBatchId = b.unifiedBatchId;
        this.shelfTime = b.shelfTime;
        this.sourceFile = b.sourceFile;
        this.testMode = b.testMode != null ? b.testMode : TestMode.RATE_1C;
        this.activeMass = b.activeMass;
        this.firstCharge = b.firstCharge;
        this.firstDischarge = b.firstDischarge;
        this.firstEfficiency = b.firstEfficiency;
        this.firstVoltage = b.firstVoltage;
        this.firstEnergy = b.firstEnergy;
        this.earlyDischarge = Collections.unmodifiableList(Arrays.asList(b.earlyDischarge.clone()));
        this.earlyCharge = Collections.unmodifiableList(Arrays.asList(b.earlyCharge.clone()));
        this.currentCycleCount = b.currentCycleCount;
        this.rateCycle = b.rateCycle;
        this.retention = b.retention;
        this.cycles = b.cycles != null ? Collections.unmodifiableList(new ArrayList<>(b.cycles)) : Collections.emptyList();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a copy carrying the given unified batch id; all other fields are shared. */
    public ChannelSummary withUnifiedBatchId(String unified) {
        Builder b = toBuilder();
        b.unifiedBatchId = unified;
        return new ChannelSummary(b);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.hostId = hostId; b.channelId = channelId; b.series = series; b.batchId = batchId;
        b.unifiedBatchId = unifiedBatchId; b.shelfTime = shelfTime; b.sourceFile = sourceFile;
        b.testMode = testMode; b.activeMass = activeMass;
        b.firstCharge = firstCharge; b.firstDischarge = firstDischarge; b.firstEfficiency = firstEfficiency;
        b.firstVoltage = firstVoltage; b.firstEnergy = firstEnergy;
        b.earlyDischarge = earlyDischarge.toArray(new Double[0]);
        b.earlyCharge = earlyCharge.toArray(new Double[0]);
        b.currentCycleCount = currentCycleCount; b.rateCycle = rateCycle; b.retention = retention; b.cycles = cycles;
        return b;
    }

    // --- Identity ---
    public String getHostId() { return hostId; }
    public String getChannelId() { return channelId; }
    /** "host-channel", the id shown in the statistics table. */
    public String getChannelKey() { return hostId + "-" + channelId; }
    public String getSeries() { return series; }
    public String getBatchId() { return batchId; }
    public String getUnifiedBatchId() { return unifiedBatchId; }
    public String getShelfTime() { return shelfTime; }
    public String getSourceFile() { return sourceFile; }
    public TestMode getTestMode() { return testMode; }
    public Double getActiveMass() { return activeMass; }

    // --- First cycle ---
    public Double getFirstCharge() { return firstCharge; }
    public Double getFirstDischarge() { return firstDischarge; }
    public Double getFirstEfficiency() { return firstEfficiency; }
    public Double getFirstVoltage() { return firstVoltage; }
    public Double getFirstEnergy() { return firstEnergy; }

    /** Discharge capacity of cycle number 2..7 (1-based), null if the channel has not completed it. */
    public Double getCycleDischarge(int cycleNumber) {
        return earlyValue(earlyDischarge, cycleNumber);
    }

    public Double getCycleCharge(int cycleNumber) {
        return earlyValue(earlyCharge, cycleNumber);
    }

    private static Double earlyValue(List<Double> values, int cycleNumber) {
        if (cycleNumber < FIRST_EARLY_CYCLE || cycleNumber > LAST_EARLY_CYCLE) {
            throw new IllegalArgumentException("Early cycle number must be between " + FIRST_EARLY_CYCLE
                    + " and " + LAST_EARLY_CYCLE + ". Got: " + cycleNumber);
        }
        return values.get(cycleNumber - FIRST_EARLY_CYCLE);
    }

    // --- Rate cycle ---
    public int getCurrentCycleCount() { return currentCycleCount; }
    public RateCycleResult getRateCycle() { return rateCycle; }
    public RateStatus getRateStatus() { return rateCycle != null ? rateCycle.getStatus() : RateStatus.NOT_FOUND; }
    public Integer getRateCycleIndex() { return rateCycle != null ? rateCycle.getCycleIndex() : null; }
    public Double getRateCharge() { return rateCycle != null ? rateCycle.getChargeCapacity() : null; }
    public Double getRateDischarge() { return rateCycle != null ? rateCycle.getDischargeCapacity() : null; }
    public Double getRateEfficiency() { return rateCycle != null ? rateCycle.getEfficiency() : null; }
    public Double getRateRatio() { return rateCycle != null ? rateCycle.getRateRatio() : null; }

    // --- Retention ---
    public RetentionMetrics getRetention() { return retention; }
    public Double getCurrentCapacityRetention() { return retention != null ? retention.getCurrent().capacityRetention() : null; }
    public Double getCurrentVoltageRetention() { return retention != null ? retention.getCurrent().voltageRetention() : null; }
    public Double getCurrentEnergyRetention() { return retention != null ? retention.getCurrent().energyRetention() : null; }
    public Double getVoltageDecayRate() { return retention != null ? retention.getVoltageDecayRate() : null; }
    public RetentionPoint getRetentionAtOffset(int offset) {
        return retention != null ? retention.getAtOffset(offset) : RetentionPoint.EMPTY;
    }

    public List<CycleRecord> getCycles() { return cycles; }

    @Override
    public String toString() {
        return String.format("ChannelSummary[%s, series=%s, batch=%s, mode=%s, D1=%s, E1=%s, rate=%s, cycles=%d]",
                getChannelKey(), series, unifiedBatchId != null ? unifiedBatchId : batchId, testMode.name(),
                firstDischarge, firstEfficiency, getRateStatus().name(), currentCycleCount);
    }

    /**
     * Collects the fields of a {@link ChannelSummary}. Host, channel, series and batch id are mandatory.
     */
    public static final class Builder {
        private String hostId;
        private String channelId;
        private String series;
        private String batchId;
        private String unifiedBatchId;
        private String shelfTime;
        private String sourceFile;
        private TestMode testMode;
        private Double activeMass;
        private Double firstCharge;
        private Double firstDischarge;
        private Double firstEfficiency;
        private Double firstVoltage;
        private Double firstEnergy;
        private Double[] earlyDischarge = new Double[LAST_EARLY_CYCLE - FIRST_EARLY_CYCLE + 1];
        private Double[] earlyCharge = new Double[LAST_EARLY_CYCLE - FIRST_EARLY_CYCLE + 1];
        private int currentCycleCount;
        private RateCycleResult rateCycle;
        private RetentionMetrics retention;
        private List<CycleRecord> cycles;

        private Builder() {
        }

        public Builder hostId(String value) { this.hostId = value; return this; }
        public Builder channelId(String value) { this.channelId = value; return this; }
        public Builder series(String value) { this.series = value; return this; }
        public Builder batchId(String value) { this.batchId = value; return this; }
        public Builder unifiedBatchId(String value) { this.unifiedBatchId = value; return this; }
        public Builder shelfTime(String value) { this.shelfTime = value; return this; }
        public Builder sourceFile(String value) { this.sourceFile = value; return this; }
        public Builder testMode(TestMode value) { this.testMode = value; return this; }
        public Builder activeMass(Double value) { this.activeMass = value; return this; }
        public Builder firstCharge(Double value) { this.firstCharge = value; return this; }
        public Builder firstDischarge(Double value) { this.firstDischarge = value; return this; }
        public Builder firstEfficiency(Double value) { this.firstEfficiency = value; return this; }
        public Builder firstVoltage(Double value) { this.firstVoltage = value; return this; }
        public Builder firstEnergy(Double value) { this.firstEnergy = value; return this; }
        public Builder currentCycleCount(int value) { this.currentCycleCount = value; return this; }
        public Builder rateCycle(RateCycleResult value) { this.rateCycle = value; return this; }
        public Builder retention(RetentionMetrics value) { this.retention = value; return this; }
        public Builder cycles(List<CycleRecord> value) { this.cycles = value; return this; }

        public Builder cycleDischarge(int cycleNumber, Double value) {
            checkEarlyCycle(cycleNumber);
            earlyDischarge[cycleNumber - FIRST_EARLY_CYCLE] = value;
            return this;
        }

        public Builder cycleCharge(int cycleNumber, Double value) {
            checkEarlyCycle(cycleNumber);
            earlyCharge[cycleNumber - FIRST_EARLY_CYCLE] = value;
            return this;
        }

        private static void checkEarlyCycle(int cycleNumber) {
            if (cycleNumber < FIRST_EARLY_CYCLE || cycleNumber > LAST_EARLY_CYCLE) {
                throw new IllegalArgumentException("Early cycle number out of range: " + cycleNumber);
            }
        }

        public ChannelSummary build() {
            return new ChannelSummary(this);
        }
    }
}
