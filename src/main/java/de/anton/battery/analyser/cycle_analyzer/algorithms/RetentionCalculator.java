package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.RetentionMetrics;
import de.anton.battery.analyser.cycle_analyzer.model.RetentionPoint;
import de.anton.battery.analyser.cycle_analyzer.model.TestMode;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RetentionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes capacity, voltage and energy retention of a channel relative to a baseline cycle,
 * at the last recorded cycle and at fixed offsets after the baseline, plus the mean voltage decay.
 * All percentages are rounded to one decimal. A non-positive or missing baseline value leaves
 * the affected metric null.
 */
public class RetentionCalculator {

    private static final Logger logger = LoggerFactory.getLogger(RetentionCalculator.class);

    private final RetentionSettings settings;

    public RetentionCalculator(RetentionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Retention settings cannot be null.");
    }

    /**
     * Baseline cycle for retention: the rate cycle for 1C tests (or the fallback 4th cycle when it was not
     * located), the first cycle for every other test mode.
     */
    public static int resolveBaselineIndex(TestMode mode, Integer rateCycleIndex, int cycleCount, int fallbackIndex) {
        if (mode != TestMode.RATE_1C) {
            return 0;
        }
        if (rateCycleIndex != null) {
            return rateCycleIndex;
        }
        return Math.max(0, Math.min(fallbackIndex, cycleCount - 1));
    }

    /**
     * Computes the full retention record.
     *
     * @return the metrics, or null if the channel has too few cycles or the baseline is its last cycle
     */
    public RetentionMetrics compute(List<CycleRecord> cycles, int baselineIndex) {
        Objects.requireNonNull(cycles, "Cycle list cannot be null.");
        if (cycles.size() <= settings.minCycleCountExclusive()) {
            logger.trace("Retention skipped: only {} cycles.", cycles.size());
            return null;
        }
        if (baselineIndex < 0 || baselineIndex >= cycles.size() - 1) {
            logger.debug("Retention skipped: baseline index {} leaves no later cycle (cycles={}).", baselineIndex, cycles.size());
            return null;
        }

        RetentionPoint current = computePoint(cycles, baselineIndex, null);
        Map<Integer, RetentionPoint> offsets = new LinkedHashMap<>();
        for (int offset : settings.offsets()) {
            offsets.put(offset, computePoint(cycles, baselineIndex, offset));
        }
        return new RetentionMetrics(baselineIndex, current, voltageDecayRate(cycles, baselineIndex), offsets);
    }

    /**
     * Convenience entry taking the test mode; resolves the baseline as in {@link #resolveBaselineIndex}.
     *
     * @param targetOffset null for the "current" (last) cycle, otherwise the offset from the baseline
     * @return the retention point, or null if retention is not computed for this channel
     */
    public RetentionPoint compute(List<CycleRecord> cycles, int baselineIndex, TestMode mode, Integer targetOffset) {
        Objects.requireNonNull(cycles, "Cycle list cannot be null.");
        int baseline = mode == TestMode.RATE_1C ? baselineIndex : 0;
        if (cycles.size() <= settings.minCycleCountExclusive() || baseline < 0 || baseline >= cycles.size() - 1) {
            return null;
        }
        return computePoint(cycles, baseline, targetOffset);
    }

    private RetentionPoint computePoint(List<CycleRecord> cycles, int baselineIndex, Integer targetOffset) {
        int target;
        if (targetOffset == null) {
            target = cycles.size() - 1;
        } else {
            target = baselineIndex + targetOffset;
            if (target >= cycles.size()) {
                return RetentionPoint.EMPTY; // not reached yet
            }
        }
        CycleRecord base = cycles.get(baselineIndex);
        CycleRecord tgt = cycles.get(target);
        return new RetentionPoint(
                percentage(tgt.getDischargeCapacity(), base.getDischargeCapacity()),
                percentage(tgt.getMedianDischargeVoltage(), base.getMedianDischargeVoltage()),
                percentage(tgt.getDischargeEnergy(), base.getDischargeEnergy()));
    }

    /** mV per cycle between the baseline and the last cycle. */
    private Double voltageDecayRate(List<CycleRecord> cycles, int baselineIndex) {
        int elapsed = (cycles.size() - 1) - baselineIndex;
        if (elapsed <= 0) {
            return null;
        }
        double baseVoltage = cycles.get(baselineIndex).getMedianDischargeVoltage();
        double lastVoltage = cycles.get(cycles.size() - 1).getMedianDischargeVoltage();
        if (Double.isNaN(baseVoltage) || Double.isNaN(lastVoltage)) {
            return null;
        }
        return StatisticsUtils.round((baseVoltage - lastVoltage) * 1000.0 / elapsed, 1);
    }

    private static Double percentage(double value, double reference) {
        if (Double.isNaN(value) || Double.isNaN(reference) || reference <= 0) {
            return null;
        }
        return StatisticsUtils.round(100.0 * value / reference, 1);
    }
}
