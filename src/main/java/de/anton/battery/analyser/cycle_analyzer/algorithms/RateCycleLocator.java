package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.RateCycleResult;
import de.anton.battery.analyser.cycle_analyzer.model.RateStatus;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.RateThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Finds the first full-rate (1C) cycle after the low-rate formation cycles.
 * <p>
 * A candidate cycle qualifies when its discharge capacity has dropped both relatively
 * (below {@code ratioThreshold} of the first cycle) and absolutely (by more than
 * {@code dischargeDiffThreshold} mAh/g). Candidates are the 2nd up to the 4th cycle; the first
 * qualifying one wins. Channels with enough cycles but no qualifying candidate fall back to the 4th cycle.
 * Stateless; instances can be shared.
 */
public class RateCycleLocator {

    private static final Logger logger = LoggerFactory.getLogger(RateCycleLocator.class);

    private final RateThresholds thresholds;

    public RateCycleLocator(RateThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "Rate thresholds cannot be null.");
    }

    /**
     * Locates the rate cycle.
     *
     * @param cycles            completed cycles, index 0 is the first cycle
     * @param baselineDischarge discharge capacity of the first cycle
     * @return the 0-based index of the rate cycle, or empty if none was found and no fallback applies
     */
    public OptionalInt locate(List<CycleRecord> cycles, double baselineDischarge) {
        Objects.requireNonNull(cycles, "Cycle list cannot be null.");
        if (cycles.size() < 2) {
            return OptionalInt.empty();
        }

        int lastCandidate = Math.min(thresholds.maxCandidateIndex(), cycles.size() - 1);
        if (baselineDischarge > 0 && !Double.isNaN(baselineDischarge)) {
            for (int idx = 1; idx <= lastCandidate; idx++) {
                double discharge = cycles.get(idx).getDischargeCapacity();
                if (Double.isNaN(discharge)) {
                    logger.trace("Rate cycle candidate {}: discharge missing, skipped.", idx);
                    continue;
                }
                double ratio = discharge / baselineDischarge;
                double diff = baselineDischarge - discharge;
                logger.trace("Rate cycle candidate {}: ratio={}, diff={}", idx, ratio, diff);
                if (ratio < thresholds.ratioThreshold() && diff > thresholds.dischargeDiffThreshold()) {
                    logger.debug("Rate cycle matched at index {} (ratio={}, diff={}).", idx, ratio, diff);
                    return OptionalInt.of(idx);
                }
            }
        } else {
            logger.debug("Baseline discharge {} is not positive, rate cycle cannot be matched.", baselineDischarge);
        }

        if (cycles.size() > thresholds.fallbackIndex()) {
            logger.debug("No rate cycle matched, using fallback index {}.", thresholds.fallbackIndex());
            return OptionalInt.of(thresholds.fallbackIndex());
        }
        return OptionalInt.empty();
    }

    /**
     * Locates the rate cycle and derives its rounded capacities, efficiency, status and the rate ratio.
     *
     * @return the evaluation, or null if no rate cycle could be located
     */
    public RateCycleResult evaluate(List<CycleRecord> cycles, double baselineDischarge) {
        OptionalInt located = locate(cycles, baselineDischarge);
        if (located.isEmpty()) {
            return null;
        }
        int index = located.getAsInt();
        CycleRecord rateCycle = cycles.get(index);
        double charge = rateCycle.getChargeCapacity();
        double discharge = rateCycle.getDischargeCapacity();

        Double rawEfficiency = efficiency(charge, discharge);
        Double rateRatio = baselineDischarge > 0 && !Double.isNaN(discharge)
                ? StatisticsUtils.round(100.0 * discharge / baselineDischarge, 2)
                : null;
        // thresholds apply to the unrounded efficiency
        RateStatus status = classify(charge, rawEfficiency);
        Double efficiency = rawEfficiency != null ? StatisticsUtils.round(rawEfficiency, 1) : null;
        boolean matched = isMatch(discharge, baselineDischarge);

        return new RateCycleResult(index, matched, StatisticsUtils.round(charge, 1),
                StatisticsUtils.round(discharge, 1), efficiency, rateRatio, status);
    }

    /**
     * Status of a rate cycle. Overcharge is checked before efficiency; a missing efficiency counts as very low.
     */
    public RateStatus classify(double chargeCapacity, Double efficiency) {
        if (chargeCapacity > thresholds.overchargeThreshold()) {
            return RateStatus.OVERCHARGE;
        }
        if (efficiency == null || efficiency < thresholds.veryLowEfficiencyThreshold()) {
            return RateStatus.VERY_LOW_EFFICIENCY;
        }
        if (efficiency < thresholds.lowEfficiencyThreshold()) {
            return RateStatus.LOW_EFFICIENCY;
        }
        return RateStatus.NORMAL;
    }

    /** Coulombic efficiency in percent, or null if the charge is not positive or the discharge is missing. */
    public static Double efficiency(double chargeCapacity, double dischargeCapacity) {
        if (!(chargeCapacity > 0) || Double.isNaN(dischargeCapacity)) {
            return null;
        }
        return 100.0 * dischargeCapacity / chargeCapacity;
    }

    private boolean isMatch(double discharge, double baselineDischarge) {
        if (!(baselineDischarge > 0) || Double.isNaN(discharge)) return false;
        return discharge / baselineDischarge < thresholds.ratioThreshold()
                && baselineDischarge - discharge > thresholds.dischargeDiffThreshold();
    }
}
