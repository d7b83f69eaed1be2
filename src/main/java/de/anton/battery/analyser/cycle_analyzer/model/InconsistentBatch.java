package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A batch that lost every channel in outlier filtering, with all its original channels, flagged for retest.
 */
public final class InconsistentBatch {

    public enum Cause {
        LIKELY_TRUE_DEFECT("Likely true defect"),
        HIGH_NATURAL_VARIANCE("High natural variance");

        private final String displayName;

        Cause(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    private final BatchKey batchKey;
    private final List<ChannelSummary> channels;
    private final Cause cause;
    private final int severeCount;

    public InconsistentBatch(BatchKey batchKey, List<ChannelSummary> channels, Cause cause, int severeCount) {
        this.batchKey = Objects.requireNonNull(batchKey, "Batch key cannot be null.");
        this.channels = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(channels, "Channels cannot be null.")));
        this.cause = Objects.requireNonNull(cause, "Cause cannot be null.");
        this.severeCount = severeCount;
    }

    public BatchKey getBatchKey() { return batchKey; }
    public List<ChannelSummary> getChannels() { return channels; }
    public Cause getCause() { return cause; }
    /** Channels that were overcharged or had very low efficiency. */
    public int getSevereCount() { return severeCount; }

    @Override
    public String toString() {
        return String.format("InconsistentBatch[%s, channels=%d, severe=%d, cause=%s]", batchKey, channels.size(), severeCount, cause.name());
    }
}
