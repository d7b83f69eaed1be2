package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Objects;

/**
 * A channel after first-cycle screening. Only {@link Status#ACCEPTED} channels take part in batch statistics;
 * the others are reported in their own tables.
 */
public record ScreenedChannel(Status status, ChannelSummary summary, String reason) {

    public enum Status {
        ACCEPTED("Accepted"),
        ABNORMAL_FIRST_CYCLE("Abnormal first cycle"),
        FIRST_CYCLE_ONLY("First cycle only");

        private final String displayName;

        Status(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    public ScreenedChannel {
        Objects.requireNonNull(status, "Status cannot be null.");
        Objects.requireNonNull(summary, "Summary cannot be null.");
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
