package de.anton.battery.analyser.cycle_analyzer.algorithms;

import de.anton.battery.analyser.cycle_analyzer.model.ChannelMetric;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the candidate whose metric (first discharge by default) is closest to the candidates' mean.
 * Ties go to the earlier candidate.
 */
public class TraditionalReferenceStrategy implements ReferenceSelectionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(TraditionalReferenceStrategy.class);

    private final ChannelMetric metric;

    public TraditionalReferenceStrategy(ChannelMetric metric) {
        this.metric = Objects.requireNonNull(metric, "Metric cannot be null.");
    }

    @Override
    public ReferenceMethod method() {
        return ReferenceMethod.TRADITIONAL;
    }

    @Override
    public Optional<Selection> select(List<ChannelSummary> candidates) {
        Objects.requireNonNull(candidates, "Candidates cannot be null.");
        double sum = 0;
        int count = 0;
        for (ChannelSummary c : candidates) {
            Double v = metric.extract(c);
            if (v != null) { sum += v; count++; }
        }
        if (count == 0) {
            logger.debug("Traditional selection: no candidate has a value for {}.", metric.name());
            return Optional.empty();
        }
        double mean = sum / count;

        ChannelSummary best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        Map<String, Double> scores = new LinkedHashMap<>();
        for (ChannelSummary c : candidates) {
            Double v = metric.extract(c);
            if (v == null) continue;
            double distance = Math.abs(v - mean);
            scores.put(c.getChannelKey(), distance);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        logger.debug("Traditional selection on {}: mean={}, chosen={}", metric.name(), mean, best.getChannelKey());
        return Optional.of(new Selection(method(), best, scores, null));
    }
}
