package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One way of picking the channel that best represents a batch.
 * An empty result means the method had too little data; the caller moves on to the next method.
 */
public interface ReferenceSelectionStrategy {

    ReferenceMethod method();

    Optional<Selection> select(List<ChannelSummary> candidates);

    /**
     * A method's pick and the score it gave every candidate (lower is better), keyed by channel key.
     * {@code curves} is only set by the curve comparison.
     */
    record Selection(ReferenceMethod method, ChannelSummary chosen, Map<String, Double> scores,
                     CurveRetentionMseStrategy.CurveComparison curves) {
        public Selection {
            Objects.requireNonNull(method, "Method cannot be null.");
            Objects.requireNonNull(chosen, "Chosen channel cannot be null.");
            scores = scores != null ? Collections.unmodifiableMap(new LinkedHashMap<>(scores)) : Collections.emptyMap();
        }
    }
}
