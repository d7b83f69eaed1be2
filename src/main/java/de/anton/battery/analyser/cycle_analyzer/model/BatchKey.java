package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies a batch: channels of one series sharing a unified batch id.
 */
public record BatchKey(String series, String unifiedBatchId) implements Comparable<BatchKey> {

    private static final Comparator<BatchKey> ORDER = Comparator
            .comparing(BatchKey::series, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(BatchKey::unifiedBatchId, String.CASE_INSENSITIVE_ORDER);

    public BatchKey {
        Objects.requireNonNull(series, "Series cannot be null.");
        Objects.requireNonNull(unifiedBatchId, "Unified batch id cannot be null.");
    }

    public static BatchKey of(ChannelSummary channel) {
        return new BatchKey(channel.getSeries(), channel.getUnifiedBatchId());
    }

    @Override
    public int compareTo(BatchKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return series + "/" + unifiedBatchId;
    }
}
