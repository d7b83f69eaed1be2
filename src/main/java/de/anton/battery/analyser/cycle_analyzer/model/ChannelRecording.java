package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw content of one channel workbook: every row of the cycle sheet (the last one may still be running)
 * plus the active material mass, if the workbook states it.
 */
public final class ChannelRecording {

    private final ChannelFileInfo fileInfo;
    private final List<CycleRecord> rows;
    private final Double activeMass;

    public ChannelRecording(ChannelFileInfo fileInfo, List<CycleRecord> rows, Double activeMass) {
        this.fileInfo = Objects.requireNonNull(fileInfo, "File info cannot be null.");
        this.rows = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rows, "Rows cannot be null.")));
        this.activeMass = activeMass;
    }

    public ChannelFileInfo getFileInfo() { return fileInfo; }
    public List<CycleRecord> getRows() { return rows; }
    public Double getActiveMass() { return activeMass; }

    @Override
    public String toString() {
        return String.format("ChannelRecording[%s, rows=%d, mass=%s]", fileInfo.fileName(), rows.size(), activeMass);
    }
}
