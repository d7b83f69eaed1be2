package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Objects;

/**
 * The reference channel decided for one batch. {@code chosen} and {@code method} are null when the batch
 * only had very-low-efficiency or overcharged rate cycles.
 */
public final class ReferenceChannelChoice {

    private final ChannelSummary chosen;
    private final ReferenceMethod method;
    private final BatchRateStatus batchRateStatus;
    private final int eligibleCount;

    public ReferenceChannelChoice(ChannelSummary chosen, ReferenceMethod method, BatchRateStatus batchRateStatus, int eligibleCount) {
        this.batchRateStatus = Objects.requireNonNull(batchRateStatus, "Batch rate status cannot be null.");
        if ((chosen == null) != (method == null)) {
            throw new IllegalArgumentException("Chosen channel and method must both be set or both be null.");
        }
        this.chosen = chosen;
        this.method = method;
        this.eligibleCount = eligibleCount;
    }

    public static ReferenceChannelChoice noReference(int eligibleCount) {
        return new ReferenceChannelChoice(null, null, BatchRateStatus.VERY_LOW_EFFICIENCY_NO_REFERENCE, eligibleCount);
    }

    public ChannelSummary getChosen() { return chosen; }
    public ReferenceMethod getMethod() { return method; }
    public BatchRateStatus getBatchRateStatus() { return batchRateStatus; }
    /** Size of the status-eligible subset the reference was chosen from. */
    public int getEligibleCount() { return eligibleCount; }
    public boolean hasReference() { return chosen != null; }

    @Override
    public String toString() {
        return String.format("ReferenceChannelChoice[chosen=%s, method=%s, status=%s, eligible=%d]",
                chosen != null ? chosen.getChannelKey() : "none", method, batchRateStatus.name(), eligibleCount);
    }
}
