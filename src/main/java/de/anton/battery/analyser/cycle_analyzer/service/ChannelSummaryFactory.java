package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.algorithms.RateCycleLocator;
import de.anton.battery.analyser.cycle_analyzer.algorithms.RetentionCalculator;
import de.anton.battery.analyser.cycle_analyzer.algorithms.StatisticsUtils;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelFileInfo;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelFileNameParser;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelRecording;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.RateCycleResult;
import de.anton.battery.analyser.cycle_analyzer.model.RetentionMetrics;
import de.anton.battery.analyser.cycle_analyzer.model.ScreenedChannel;
import de.anton.battery.analyser.cycle_analyzer.model.TestMode;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ScreeningThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Screens a raw channel recording and condenses it into a {@link ChannelSummary}.
 * <p>
 * The last row of the cycle sheet is the cycle still running and is ignored. A recording with a single row
 * has only its first cycle; a first cycle outside the plausibility limits marks the channel as abnormal.
 */
public class ChannelSummaryFactory {

    private static final Logger logger = LoggerFactory.getLogger(ChannelSummaryFactory.class);

    private final ProcessingConfiguration config;
    private final RateCycleLocator rateCycleLocator;
    private final RetentionCalculator retentionCalculator;

    public ChannelSummaryFactory(ProcessingConfiguration config) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null.");
        this.rateCycleLocator = new RateCycleLocator(config.rateThresholds());
        this.retentionCalculator = new RetentionCalculator(config.retention());
    }

    public ScreenedChannel screen(ChannelRecording recording) {
        Objects.requireNonNull(recording, "Recording cannot be null.");
        List<CycleRecord> rows = recording.getRows();
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Recording " + recording.getFileInfo().fileName() + " has no cycle rows.");
        }

        if (rows.size() == 1) {
            ChannelSummary summary = firstCycleOnly(recording.getFileInfo(), rows.get(0), recording.getActiveMass());
            logger.info("Channel {} has only its first cycle.", summary.getChannelKey());
            return new ScreenedChannel(ScreenedChannel.Status.FIRST_CYCLE_ONLY, summary, "Only one cycle recorded");
        }

        List<CycleRecord> completed = config.workbook().excludeRunningCycle()
                ? rows.subList(0, rows.size() - 1)
                : rows;
        ChannelSummary summary = build(recording.getFileInfo(), completed, recording.getActiveMass());

        String abnormality = describeAbnormalFirstCycle(completed.get(0));
        if (abnormality != null) {
            logger.warn("Channel {} has an abnormal first cycle: {}", summary.getChannelKey(), abnormality);
            return new ScreenedChannel(ScreenedChannel.Status.ABNORMAL_FIRST_CYCLE, summary, abnormality);
        }
        return new ScreenedChannel(ScreenedChannel.Status.ACCEPTED, summary, null);
    }

    /**
     * Builds the summary from completed cycles only.
     */
    public ChannelSummary build(ChannelFileInfo info, List<CycleRecord> completed, Double activeMass) {
        Objects.requireNonNull(info, "File info cannot be null.");
        Objects.requireNonNull(completed, "Cycle list cannot be null.");
        if (completed.isEmpty()) {
            throw new IllegalArgumentException("At least one completed cycle is required for " + info.fileName() + ".");
        }

        CycleRecord first = completed.get(0);
        ChannelSummary.Builder builder = baseBuilder(info, first, activeMass)
                .currentCycleCount(completed.size())
                .cycles(completed);

        for (int n = ChannelSummary.FIRST_EARLY_CYCLE; n <= ChannelSummary.LAST_EARLY_CYCLE; n++) {
            if (completed.size() >= n) {
                CycleRecord cycle = completed.get(n - 1);
                builder.cycleDischarge(n, StatisticsUtils.round(cycle.getDischargeCapacity(), 1));
                builder.cycleCharge(n, StatisticsUtils.round(cycle.getChargeCapacity(), 1));
            }
        }

        RateCycleResult rateCycle = null;
        if (info.testMode() == TestMode.RATE_1C) {
            rateCycle = rateCycleLocator.evaluate(completed, first.getDischargeCapacity());
            if (rateCycle == null) {
                logger.debug("No rate cycle for {} ({} completed cycles).", info.fileName(), completed.size());
            }
        }
        builder.rateCycle(rateCycle);

        int baseline = RetentionCalculator.resolveBaselineIndex(info.testMode(),
                rateCycle != null ? rateCycle.getCycleIndex() : null,
                completed.size(), config.rateThresholds().fallbackIndex());
        RetentionMetrics retention = retentionCalculator.compute(completed, baseline);
        builder.retention(retention);

        return builder.build();
    }

    private ChannelSummary firstCycleOnly(ChannelFileInfo info, CycleRecord first, Double activeMass) {
        return baseBuilder(info, first, activeMass)
                .currentCycleCount(0)
                .cycles(List.of(first))
                .build();
    }

    private static ChannelSummary.Builder baseBuilder(ChannelFileInfo info, CycleRecord first, Double activeMass) {
        double charge = first.getChargeCapacity();
        double discharge = first.getDischargeCapacity();
        Double efficiency = StatisticsUtils.round(RateCycleLocator.efficiency(charge, discharge), 1);
        return ChannelSummary.builder()
                .hostId(info.hostId())
                .channelId(info.channelId())
                .series(info.series())
                .batchId(info.batchId())
                .unifiedBatchId(ChannelFileNameParser.unifiedBatchId(info.batchId()))
                .shelfTime(info.shelfTime())
                .sourceFile(info.fileName())
                .testMode(info.testMode())
                .activeMass(activeMass)
                .firstCharge(StatisticsUtils.round(charge, 1))
                .firstDischarge(StatisticsUtils.round(discharge, 1))
                .firstEfficiency(efficiency)
                .firstVoltage(StatisticsUtils.round(first.getMedianDischargeVoltage(), 2))
                .firstEnergy(StatisticsUtils.round(first.getDischargeEnergy(), 1));
    }

    /**
     * @return a description of the violated limit, or null if the first cycle is plausible
     */
    String describeAbnormalFirstCycle(CycleRecord first) {
        ScreeningThresholds limits = config.screening();
        double charge = first.getChargeCapacity();
        double discharge = first.getDischargeCapacity();
        if (charge > limits.highCharge()) {
            return String.format("first charge %.1f > %.0f mAh/g", charge, limits.highCharge());
        }
        if (charge < limits.lowCharge()) {
            return String.format("first charge %.1f < %.0f mAh/g", charge, limits.lowCharge());
        }
        if (discharge < limits.lowDischarge()) {
            return String.format("first discharge %.1f < %.0f mAh/g", discharge, limits.lowDischarge());
        }
        return null;
    }
}
