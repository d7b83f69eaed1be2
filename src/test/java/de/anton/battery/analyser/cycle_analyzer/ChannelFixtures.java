package de.anton.battery.analyser.cycle_analyzer;

import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.RateCycleResult;
import de.anton.battery.analyser.cycle_analyzer.model.RateStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders for channel summaries and cycle sequences shared by the tests.
 */
public final class ChannelFixtures {

    public static final String SERIES = "Q3";
    public static final String BATCH = "2405-A1";

    private ChannelFixtures() { throw new IllegalStateException("Utility class"); }

    /** Cycles with the given discharge capacities; charge is 5% higher, voltage and energy constant. */
    public static List<CycleRecord> cycles(double... discharges) {
        List<CycleRecord> cycles = new ArrayList<>();
        for (int i = 0; i < discharges.length; i++) {
            cycles.add(new CycleRecord(i, discharges[i] * 1.05, discharges[i], 3.8, discharges[i] * 3.8));
        }
        return cycles;
    }

    /**
     * A steadily fading channel: first cycle at {@code first}, a 1C drop at index 1 and then a
     * linear fade of {@code fadePerCycle} mAh/g per cycle.
     */
    public static List<CycleRecord> fadingCycles(int count, double first, double fadePerCycle) {
        List<CycleRecord> cycles = new ArrayList<>();
        cycles.add(new CycleRecord(0, first * 1.1, first, 3.80, first * 3.8));
        double rate = first - 30.0;
        for (int i = 1; i < count; i++) {
            double discharge = rate - fadePerCycle * (i - 1);
            double voltage = 3.75 - 0.0005 * (i - 1);
            cycles.add(new CycleRecord(i, discharge * 1.01, discharge, voltage, discharge * voltage));
        }
        return cycles;
    }

    public static ChannelSummary.Builder channel(String channelId, double firstDischarge) {
        return ChannelSummary.builder()
                .hostId("240501")
                .channelId(channelId)
                .series(SERIES)
                .batchId(BATCH)
                .unifiedBatchId(BATCH)
                .firstCharge(firstDischarge * 1.1)
                .firstDischarge(firstDischarge)
                .firstEfficiency(90.9)
                .firstVoltage(3.8)
                .firstEnergy(firstDischarge * 3.8);
    }

    /** Channel with a healthy 1C cycle at index 1. */
    public static ChannelSummary.Builder rateChannel(String channelId, double firstDischarge) {
        return channel(channelId, firstDischarge)
                .rateCycle(new RateCycleResult(1, true, 285.0, 280.0, 98.2, 93.3, RateStatus.NORMAL));
    }

    public static RateCycleResult rate(RateStatus status, double efficiency) {
        return new RateCycleResult(1, true, 285.0, 280.0, efficiency, 93.3, status);
    }

    public static List<ChannelSummary> batch(double... firstDischarges) {
        List<ChannelSummary> channels = new ArrayList<>();
        for (int i = 0; i < firstDischarges.length; i++) {
            channels.add(channel(String.format("CH-%02d", i + 1), firstDischarges[i]).build());
        }
        return channels;
    }
}
