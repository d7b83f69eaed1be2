package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.algorithms.CurveRetentionMseStrategy;
import de.anton.battery.analyser.cycle_analyzer.algorithms.PcaReferenceStrategy;
import de.anton.battery.analyser.cycle_analyzer.algorithms.ReferenceSelectionStrategy;
import de.anton.battery.analyser.cycle_analyzer.algorithms.ReferenceSelectionStrategy.Selection;
import de.anton.battery.analyser.cycle_analyzer.algorithms.TraditionalReferenceStrategy;
import de.anton.battery.analyser.cycle_analyzer.model.BatchKey;
import de.anton.battery.analyser.cycle_analyzer.model.BatchRateStatus;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelSummary;
import de.anton.battery.analyser.cycle_analyzer.model.RateStatus;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceChannelChoice;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceMethod;
import de.anton.battery.analyser.cycle_analyzer.model.ReferenceSelectionDiagnostics;
import de.anton.battery.analyser.cycle_analyzer.model.TestMode;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.ReferenceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Chooses one reference channel per batch.
 * <p>
 * Only 1C channels with a located rate cycle take part. NORMAL channels are preferred, LOW_EFFICIENCY
 * channels are used when no NORMAL one exists, and a batch with neither gets no reference.
 * Every configured method is evaluated; the first one in priority order with a result wins and
 * disagreements between methods are logged. If no method produces a result, the first candidate is used.
 */
public class ReferenceChannelSelector {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceChannelSelector.class);

    /** Decision for one batch with its diagnostics; diagnostics are null when no method had to run. */
    public record Decision(ReferenceChannelChoice choice, ReferenceSelectionDiagnostics diagnostics) {
        public Decision {
            Objects.requireNonNull(choice, "Choice cannot be null.");
        }
    }

    private final List<ReferenceSelectionStrategy> strategies;

    public ReferenceChannelSelector(ReferenceSettings settings) {
        this(createStrategies(Objects.requireNonNull(settings, "Reference settings cannot be null.")));
    }

    /** @param strategies methods in priority order */
    public ReferenceChannelSelector(List<ReferenceSelectionStrategy> strategies) {
        Objects.requireNonNull(strategies, "Strategies cannot be null.");
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one reference selection strategy is required.");
        }
        this.strategies = List.copyOf(strategies);
    }

    private static List<ReferenceSelectionStrategy> createStrategies(ReferenceSettings settings) {
        List<ReferenceSelectionStrategy> list = new ArrayList<>();
        for (ReferenceMethod method : settings.priority()) {
            switch (method) {
                case CURVE_RETENTION_MSE:
                    list.add(new CurveRetentionMseStrategy(settings.curve()));
                    break;
                case PCA:
                    list.add(new PcaReferenceStrategy(settings.pca()));
                    break;
                case TRADITIONAL:
                    list.add(new TraditionalReferenceStrategy(settings.traditionalMetric()));
                    break;
                default:
                    throw new IllegalArgumentException("Not a scoring method: " + method);
            }
        }
        return list;
    }

    public List<ReferenceMethod> getPriority() {
        return strategies.stream().map(ReferenceSelectionStrategy::method).collect(Collectors.toList());
    }

    /** 1C channels of the batch that have a rate-cycle evaluation. */
    public static List<ChannelSummary> rateChannels(List<ChannelSummary> batch) {
        return batch.stream()
                .filter(c -> c.getTestMode() == TestMode.RATE_1C && c.getRateCycle() != null)
                .collect(Collectors.toList());
    }

    /**
     * Status-eligible subset: NORMAL channels, or LOW_EFFICIENCY channels if there is no NORMAL one.
     */
    public static List<ChannelSummary> eligibleCandidates(List<ChannelSummary> rateChannels) {
        List<ChannelSummary> normal = withStatus(rateChannels, RateStatus.NORMAL);
        if (!normal.isEmpty()) {
            return normal;
        }
        return withStatus(rateChannels, RateStatus.LOW_EFFICIENCY);
    }

    /**
     * Decides the reference of one batch.
     *
     * @param batch surviving channels of the batch after outlier filtering
     * @return the decision, or empty if the batch has no 1C channel with a rate cycle
     */
    public Optional<Decision> decide(BatchKey key, List<ChannelSummary> batch) {
        Objects.requireNonNull(key, "Batch key cannot be null.");
        Objects.requireNonNull(batch, "Batch channels cannot be null.");
        List<ChannelSummary> rateChannels = rateChannels(batch);
        if (rateChannels.isEmpty()) {
            logger.debug("Batch {} has no 1C channel with a rate cycle, no reference.", key);
            return Optional.empty();
        }

        List<ChannelSummary> candidates = eligibleCandidates(rateChannels);
        if (candidates.isEmpty()) {
            logger.warn("Batch {}: all {} rate channels are very-low-efficiency or overcharged, no reference channel.",
                    key, rateChannels.size());
            return Optional.of(new Decision(ReferenceChannelChoice.noReference(0), null));
        }
        BatchRateStatus status = candidates.get(0).getRateStatus() == RateStatus.NORMAL
                ? BatchRateStatus.NORMAL : BatchRateStatus.LOW_EFFICIENCY;

        if (candidates.size() == 1) {
            return Optional.of(new Decision(
                    new ReferenceChannelChoice(candidates.get(0), ReferenceMethod.SINGLE_CANDIDATE, status, 1), null));
        }

        Decision decision = runMethods(key, candidates, status);
        logger.info("Batch {}: reference {} chosen by {} from {} candidates.", key,
                decision.choice().getChosen().getChannelKey(), decision.choice().getMethod(), candidates.size());
        return Optional.of(decision);
    }

    /**
     * Picks one of the candidates without status filtering.
     * Zero candidates give empty, a single candidate is returned as is.
     */
    public Optional<ChannelSummary> select(List<ChannelSummary> candidates) {
        Objects.requireNonNull(candidates, "Candidates cannot be null.");
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        ChannelSummary first = candidates.get(0);
        BatchKey key = new BatchKey(first.getSeries(),
                first.getUnifiedBatchId() != null ? first.getUnifiedBatchId() : first.getBatchId());
        return Optional.of(runMethods(key, candidates, BatchRateStatus.NORMAL).choice().getChosen());
    }

    private Decision runMethods(BatchKey key, List<ChannelSummary> candidates, BatchRateStatus status) {
        Map<ReferenceMethod, Selection> selections = new EnumMap<>(ReferenceMethod.class);
        Map<ReferenceMethod, String> failures = new EnumMap<>(ReferenceMethod.class);
        ReferenceMethod winner = null;
        ChannelSummary chosen = null;

        for (ReferenceSelectionStrategy strategy : strategies) {
            Optional<Selection> result;
            try {
                result = strategy.select(candidates);
            } catch (RuntimeException e) {
                logger.error("Batch {}: reference method {} failed.", key, strategy.method(), e);
                failures.put(strategy.method(), e.getClass().getSimpleName() + ": " + e.getMessage());
                continue;
            }
            if (result.isEmpty()) {
                logger.debug("Batch {}: method {} had insufficient data.", key, strategy.method());
                continue;
            }
            selections.put(strategy.method(), result.get());
            if (winner == null) {
                winner = strategy.method();
                chosen = result.get().chosen();
            }
        }

        if (winner == null) {
            logger.warn("Batch {}: no reference method produced a result, falling back to the first candidate.", key);
            winner = ReferenceMethod.FIRST_CANDIDATE_FALLBACK;
            chosen = candidates.get(0);
        }

        ReferenceSelectionDiagnostics diagnostics =
                new ReferenceSelectionDiagnostics(key, candidates.size(), selections, failures, winner);
        if (diagnostics.hasDisagreement()) {
            logger.warn("Batch {}: reference methods disagree {}; keeping {} from {}.",
                    key, diagnostics.getChosenByMethod(), chosen.getChannelKey(), winner);
        }
        return new Decision(new ReferenceChannelChoice(chosen, winner, status, candidates.size()), diagnostics);
    }

    private static List<ChannelSummary> withStatus(List<ChannelSummary> channels, RateStatus status) {
        List<ChannelSummary> result = new ArrayList<>();
        for (ChannelSummary channel : channels) {
            if (channel.getRateStatus() == status) {
                result.add(channel);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
