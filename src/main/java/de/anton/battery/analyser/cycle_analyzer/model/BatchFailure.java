package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Objects;

/**
 * A batch whose processing failed unexpectedly; the other batches were still processed.
 */
public record BatchFailure(BatchKey batchKey, String stage, String message) {
    public BatchFailure {
        Objects.requireNonNull(batchKey, "Batch key cannot be null.");
        Objects.requireNonNull(stage, "Stage cannot be null.");
    }
}
