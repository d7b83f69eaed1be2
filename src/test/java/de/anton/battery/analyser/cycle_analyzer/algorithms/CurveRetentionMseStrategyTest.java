package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.algorithms.CurveRetentionMseStrategy.CurveComparison;
import de.anton.battery.analyser.cycle_analyzer.algorithms.CurveRetentionMseStrategy.RawCurve;
import de.anton.battery.analyser.cycle_analyzer.algorithms.CycleWeights.CurveMetric;
import de.anton.battery.analyser.cycle_analyzer.algorithms.ReferenceSelectionStrategy.Selection;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.CycleRecord;
import de.anton.battery.analyser.cycle_analyzer.model.RateStatus;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.CurveSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.channel;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.cycles;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.fadingCycles;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.rate;
import static org.junit.jupiter.api.Assertions.*;

class CurveRetentionMseStrategyTest {

    private final CurveRetentionMseStrategy strategy = new CurveRetentionMseStrategy(CurveSettings.defaults());

    private static ChannelSummary fading(String channelId, int count, double fadePerCycle) {
        return channel(channelId, 300)
                .rateCycle(rate(RateStatus.NORMAL, 98.0))
                .cycles(fadingCycles(count, 300, fadePerCycle))
                .build();
    }

    @Test
    void picks_the_channel_matching_the_mean_curve() {
        List<ChannelSummary> channels = List.of(
                fading("CH-01", 30, 0.5), fading("CH-02", 30, 1.0), fading("CH-03", 30, 1.5));

        Selection selection = strategy.select(channels).orElseThrow();

        assertEquals(ReferenceMethod.CURVE_RETENTION_MSE, selection.method());
        assertSame(channels.get(1), selection.chosen());
        assertEquals(0.0, selection.scores().get(channels.get(1).getChannelKey()), 1e-9);
        assertTrue(selection.scores().get(channels.get(0).getChannelKey()) > 0);
    }

    @Test
    void comparison_covers_the_common_range_only() {
        List<ChannelSummary> channels = List.of(
                fading("CH-01", 30, 0.5), fading("CH-02", 20, 1.0), fading("CH-03", 30, 1.5));

        CurveComparison comparison = strategy.select(channels).orElseThrow().curves();

        // shortest channel: 20 cycles, baseline at index 1
        assertEquals(19, comparison.grid().length);
        assertEquals(3, comparison.curves().size());
        assertEquals(100.0, comparison.meanCurves().get(CurveMetric.CAPACITY)[0], 1e-9);
        assertEquals(1.0, comparison.metricWeights().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-12);
    }

    @Test
    void voltage_and_energy_can_be_switched_off() {
        CurveSettings d = CurveSettings.defaults();
        CurveRetentionMseStrategy capacityOnly = new CurveRetentionMseStrategy(new CurveSettings(d.minChannels(),
                d.minCycles(), d.interpolation(), false, false, d.capacityWeight(), d.voltageWeight(), d.energyWeight(),
                d.useWeightedMse(), d.weighting(), d.weightFactor(), d.lateEmphasis(), d.lateFraction()));
        List<ChannelSummary> channels = List.of(fading("CH-01", 15, 0.5), fading("CH-02", 15, 1.5));

        CurveComparison comparison = capacityOnly.select(channels).orElseThrow().curves();

        assertEquals(List.of(CurveMetric.CAPACITY), List.copyOf(comparison.metricWeights().keySet()));
    }

    @Test
    void channels_without_cycles_do_not_count() {
        ChannelSummary empty = channel("CH-02", 300).rateCycle(rate(RateStatus.NORMAL, 98.0)).build();

        assertTrue(strategy.select(List.of(fading("CH-01", 30, 0.5), empty)).isEmpty());
    }

    @Test
    void short_common_range_gives_no_selection() {
        assertTrue(strategy.select(List.of(fading("CH-01", 4, 0.5), fading("CH-02", 30, 1.0))).isEmpty());
    }

    @Test
    void curve_starts_at_the_rate_cycle_and_skips_missing_values() {
        List<CycleRecord> records = List.of(
                new CycleRecord(0, 330, 300, 3.8, 1140),
                new CycleRecord(1, 260, 250, 3.7, 925),
                new CycleRecord(2, 250, Double.NaN, 3.7, 920),
                new CycleRecord(3, 250, 240, 3.7, 888));
        ChannelSummary summary = channel("CH-01", 300).rateCycle(rate(RateStatus.NORMAL, 98.0)).cycles(records).build();

        RawCurve curve = strategy.buildCurve(summary, CycleRecord::getDischargeCapacity);

        assertArrayEquals(new double[]{0, 2}, curve.positions(), 1e-12);
        assertArrayEquals(new double[]{100.0, 96.0}, curve.values(), 1e-9);
    }

    @Test
    void channel_without_rate_cycle_uses_first_cycle_as_baseline() {
        ChannelSummary summary = channel("CH-01", 300).cycles(cycles(300, 270, 240)).build();

        RawCurve curve = strategy.buildCurve(summary, CycleRecord::getDischargeCapacity);

        assertArrayEquals(new double[]{100.0, 90.0, 80.0}, curve.values(), 1e-9);
    }
}
