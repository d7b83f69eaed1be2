package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of filtering a set of batches: the surviving channels per batch and the batches
 * that lost every channel. Batches in {@code fullyRemoved} never appear in {@code filtered}.
 */
public final class OutlierFilterResult {

    private final Map<BatchKey, List<ChannelSummary>> filtered;
    private final Set<BatchKey> fullyRemoved;
    private final List<ChannelSummary> removedChannels;

    public OutlierFilterResult(Map<BatchKey, List<ChannelSummary>> filtered, Set<BatchKey> fullyRemoved,
                               List<ChannelSummary> removedChannels) {
        Map<BatchKey, List<ChannelSummary>> copy = new LinkedHashMap<>();
        if (filtered != null) {
            filtered.forEach((key, channels) -> copy.put(key, Collections.unmodifiableList(new ArrayList<>(channels))));
        }
        this.filtered = Collections.unmodifiableMap(copy);
        this.fullyRemoved = fullyRemoved != null ? Collections.unmodifiableSet(new LinkedHashSet<>(fullyRemoved)) : Collections.emptySet();
        this.removedChannels = removedChannels != null ? Collections.unmodifiableList(new ArrayList<>(removedChannels)) : Collections.emptyList();
    }

    public Map<BatchKey, List<ChannelSummary>> getFiltered() { return filtered; }
    public Set<BatchKey> getFullyRemoved() { return fullyRemoved; }
    public List<ChannelSummary> getRemovedChannels() { return removedChannels; }

    /** Surviving channels of all batches in batch order. */
    public List<ChannelSummary> getFilteredChannels() {
        List<ChannelSummary> all = new ArrayList<>();
        filtered.values().forEach(all::addAll);
        return all;
    }

    @Override
    public String toString() {
        return String.format("OutlierFilterResult[batches=%d, fullyRemoved=%d, removedChannels=%d]",
                filtered.size(), fullyRemoved.size(), removedChannels.size());
    }
}
