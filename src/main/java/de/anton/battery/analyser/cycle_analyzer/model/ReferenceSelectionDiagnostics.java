package de.anton.battery.analyser.cycle_analyzer.model;

import de.anton.battery.analyser.cycle_analyzer.algorithms.ReferenceSelectionStrategy.Selection;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Troubleshooting record of one reference decision: what every configured method picked,
 * which method won and whether the methods disagreed.
 */
public final class ReferenceSelectionDiagnostics {

    private final BatchKey batchKey;
    private final int candidateCount;
    private final Map<ReferenceMethod, Selection> selections;
    private final Map<ReferenceMethod, String> failures;
    private final ReferenceMethod winner;

    public ReferenceSelectionDiagnostics(BatchKey batchKey, int candidateCount, Map<ReferenceMethod, Selection> selections,
                                         Map<ReferenceMethod, String> failures, ReferenceMethod winner) {
        this.batchKey = Objects.requireNonNull(batchKey, "Batch key cannot be null.");
        this.candidateCount = candidateCount;
        this.selections = selections != null && !selections.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(selections)) : Collections.emptyMap();
        this.failures = failures != null && !failures.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(failures)) : Collections.emptyMap();
        this.winner = winner;
    }

    public BatchKey getBatchKey() { return batchKey; }
    public int getCandidateCount() { return candidateCount; }
    public Map<ReferenceMethod, Selection> getSelections() { return selections; }
    /** Methods that threw, with the error message. */
    public Map<ReferenceMethod, String> getFailures() { return failures; }
    public ReferenceMethod getWinner() { return winner; }

    /** Channel key picked by each method that produced a result. */
    public Map<ReferenceMethod, String> getChosenByMethod() {
        Map<ReferenceMethod, String> chosen = new LinkedHashMap<>();
        selections.forEach((method, selection) -> chosen.put(method, selection.chosen().getChannelKey()));
        return chosen;
    }

    /** True if at least two methods produced results naming different channels. */
    public boolean hasDisagreement() {
        return getChosenByMethod().values().stream().distinct().count() > 1;
    }

    @Override
    public String toString() {
        return String.format("ReferenceSelectionDiagnostics[%s, candidates=%d, winner=%s, picks=%s, failures=%s]",
                batchKey, candidateCount, winner, getChosenByMethod(), failures.keySet());
    }
}
