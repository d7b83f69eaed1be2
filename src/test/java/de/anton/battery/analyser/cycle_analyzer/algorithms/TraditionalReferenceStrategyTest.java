package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.algorithms.ReferenceSelectionStrategy.Selection;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.batch;
import static de.anton.battery.analyser.cycle_analyzer.ChannelFixtures.channel;
import static org.junit.jupiter.api.Assertions.*;

class TraditionalReferenceStrategyTest {

    private final TraditionalReferenceStrategy strategy = new TraditionalReferenceStrategy(ChannelMetric.FIRST_DISCHARGE);

    @Test
    void picks_channel_nearest_to_the_mean() {
        List<ChannelSummary> channels = batch(290, 300, 320);

        Selection selection = strategy.select(channels).orElseThrow();

        assertEquals(ReferenceMethod.TRADITIONAL, selection.method());
        assertSame(channels.get(1), selection.chosen());
        assertEquals(3, selection.scores().size());
        assertNull(selection.curves());
    }

    @Test
    void tie_goes_to_the_earlier_channel() {
        List<ChannelSummary> channels = batch(290, 310);

        assertSame(channels.get(0), strategy.select(channels).orElseThrow().chosen());
    }

    @Test
    void channels_without_value_are_skipped() {
        ChannelSummary missing = channel("CH-09", 300).firstDischarge(null).build();
        List<ChannelSummary> channels = List.of(missing, batch(280).get(0));

        Selection selection = strategy.select(channels).orElseThrow();

        assertNotSame(missing, selection.chosen());
        assertFalse(selection.scores().containsKey(missing.getChannelKey()));
    }

    @Test
    void no_values_at_all_gives_no_selection() {
        ChannelSummary missing = channel("CH-09", 300).firstDischarge(null).build();

        assertEquals(Optional.empty(), strategy.select(List.of(missing)));
    }
}
