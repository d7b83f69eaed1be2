package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Objects;

/**
 * Metadata derived from a channel workbook's file name.
 */
public record ChannelFileInfo(String fileName, String hostId, String channelId, String batchId,
                              String shelfTime, TestMode testMode, String series) {
    public ChannelFileInfo {
        Objects.requireNonNull(fileName, "File name cannot be null.");
        Objects.requireNonNull(hostId, "Host id cannot be null.");
        Objects.requireNonNull(channelId, "Channel id cannot be null.");
        Objects.requireNonNull(batchId, "Batch id cannot be null.");
        Objects.requireNonNull(testMode, "Test mode cannot be null.");
        Objects.requireNonNull(series, "Series cannot be null.");
    }
}
