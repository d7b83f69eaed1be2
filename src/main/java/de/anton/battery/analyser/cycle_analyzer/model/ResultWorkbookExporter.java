package de.anton.battery.analyser.cycle_analyzer.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Writes the result workbook of a run (.xlsx): batch statistics, the channels behind them, inconsistent batches,
 * screened-out channels and the reference decisions.
 */
public class ResultWorkbookExporter {

    private static final Logger logger = LoggerFactory.getLogger(ResultWorkbookExporter.class);

    static final String SHEET_STATISTICS = "Statistics";
    static final String SHEET_CHANNELS = "Channels";
    static final String SHEET_INCONSISTENT = "Inconsistent";
    static final String SHEET_ABNORMAL = "Abnormal first cycle";
    static final String SHEET_FIRST_CYCLE_ONLY = "First cycle only";
    static final String SHEET_DECISIONS = "Reference decisions";
    static final String SHEET_SKIPPED = "Skipped files";

    /** Header plus the value a row object contributes to that column. */
    private record Column<T>(String header, Function<T, Object> value) {
    }

    private final List<Integer> retentionOffsets;

    public ResultWorkbookExporter(List<Integer> retentionOffsets) {
        this.retentionOffsets = List.copyOf(Objects.requireNonNull(retentionOffsets, "Retention offsets cannot be null."));
    }

    public void exportResults(AnalysisReport report, Path output) throws IOException {
        Objects.requireNonNull(report, "Report cannot be null.");
        Objects.requireNonNull(output, "Output path cannot be null.");
        logger.info("Starting Excel export to: {}", output.toAbsolutePath());

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(output)) {
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(headerFont);

            writeSheet(workbook, headerStyle, SHEET_STATISTICS, statisticsColumns(), report.statistics());
            writeSheet(workbook, headerStyle, SHEET_CHANNELS, channelColumns(), report.filteredChannels());
            writeSheet(workbook, headerStyle, SHEET_INCONSISTENT, inconsistentColumns(), inconsistentRows(report.inconsistentBatches()));
            writeSheet(workbook, headerStyle, SHEET_ABNORMAL, screenedColumns(true), report.abnormalChannels());
            writeSheet(workbook, headerStyle, SHEET_FIRST_CYCLE_ONLY, screenedColumns(false), report.firstCycleOnlyChannels());
            writeSheet(workbook, headerStyle, SHEET_DECISIONS, decisionColumns(), report.diagnostics());
            if (!report.skippedFiles().isEmpty()) {
                writeSheet(workbook, headerStyle, SHEET_SKIPPED, skippedColumns(), report.skippedFiles());
            }

            workbook.write(out);
            logger.info("Excel export completed: {} batches, {} channels written to {}",
                    report.statistics().size(), report.filteredChannels().size(), output.toAbsolutePath());
        } catch (IOException e) {
            logger.error("IOException during Excel export to {}", output, e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during Excel export to {}", output, e);
            throw new IOException("Unexpected error during Excel export: " + e.getMessage(), e);
        }
    }

    private <T> void writeSheet(Workbook workbook, CellStyle headerStyle, String name, List<Column<T>> columns, List<T> rows) {
        Sheet sheet = workbook.createSheet(name);
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < columns.size(); i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(columns.get(i).header());
            cell.setCellStyle(headerStyle);
        }
        int rowNum = 1;
        for (T item : rows) {
            Row row = sheet.createRow(rowNum++);
            for (int i = 0; i < columns.size(); i++) {
                writeCell(row, i, columns.get(i).value().apply(item));
            }
        }
        for (int i = 0; i < columns.size(); i++) {
            sheet.autoSizeColumn(i);
        }
        logger.debug("Sheet '{}': {} rows.", name, rows.size());
    }

    private static void writeCell(Row row, int colIndex, Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (!Double.isNaN(d) && !Double.isInfinite(d)) {
                row.createCell(colIndex).setCellValue(d);
            } else {
                row.createCell(colIndex, CellType.BLANK);
            }
        } else if (value != null) {
            row.createCell(colIndex).setCellValue(value.toString());
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }

    // --- Column layouts ---

    private List<Column<BatchStatistics>> statisticsColumns() {
        List<Column<BatchStatistics>> c = new ArrayList<>();
        c.add(new Column<>("Series", BatchStatistics::getSeries));
        c.add(new Column<>("Batch", BatchStatistics::getUnifiedBatchId));
        c.add(new Column<>("Shelf time", BatchStatistics::getShelfTime));
        c.add(new Column<>("Channels", BatchStatistics::getTotalCount));
        c.add(new Column<>("Valid channels", BatchStatistics::getValidCount));
        c.add(new Column<>("Active mass", BatchStatistics::getMeanActiveMass));
        c.add(new Column<>("First charge (mAh/g)", BatchStatistics::getMeanFirstCharge));
        c.add(new Column<>("First discharge (mAh/g)", BatchStatistics::getMeanFirstDischarge));
        c.add(new Column<>("First efficiency (%)", BatchStatistics::getMeanFirstEfficiency));
        c.add(new Column<>("First voltage (V)", BatchStatistics::getMeanFirstVoltage));
        c.add(new Column<>("First energy (mWh/g)", BatchStatistics::getMeanFirstEnergy));
        for (int n = ChannelSummary.FIRST_EARLY_CYCLE; n <= ChannelSummary.LAST_EARLY_CYCLE; n++) {
            final int cycle = n;
            c.add(new Column<>("Cycle" + cycle + " discharge", s -> s.getMeanCycleDischarge(cycle)));
        }
        for (int n = ChannelSummary.FIRST_EARLY_CYCLE; n <= ChannelSummary.LAST_EARLY_CYCLE; n++) {
            final int cycle = n;
            c.add(new Column<>("Cycle" + cycle + " charge", s -> s.getMeanCycleCharge(cycle)));
        }
        c.add(new Column<>("Batch rate status", BatchStatistics::getBatchRateStatus));
        c.add(new Column<>("Reference method", BatchStatistics::getReferenceMethod));
        c.add(new Column<>("Rate valid channels", BatchStatistics::getRateValidCount));
        c.add(new Column<>("Reference channel", BatchStatistics::getReferenceChannel));
        c.add(new Column<>("Rate cycle", s -> cycleNumber(s.getRateCycleIndex())));
        c.add(new Column<>("Rate charge (mAh/g)", BatchStatistics::getRateCharge));
        c.add(new Column<>("Rate discharge (mAh/g)", BatchStatistics::getRateDischarge));
        c.add(new Column<>("Rate efficiency (%)", BatchStatistics::getRateEfficiency));
        c.add(new Column<>("Rate status", BatchStatistics::getRateStatus));
        c.add(new Column<>("Rate ratio (%)", BatchStatistics::getRateRatio));
        c.add(new Column<>("Reference cycles", BatchStatistics::getReferenceCycleCount));
        c.add(new Column<>("Capacity retention (%)", BatchStatistics::getCurrentCapacityRetention));
        c.add(new Column<>("Voltage retention (%)", BatchStatistics::getCurrentVoltageRetention));
        c.add(new Column<>("Energy retention (%)", BatchStatistics::getCurrentEnergyRetention));
        c.add(new Column<>("Voltage decay (mV/cycle)", BatchStatistics::getVoltageDecayRate));
        for (int offset : retentionOffsets) {
            c.add(new Column<>("+" + offset + " capacity retention (%)", s -> s.getRetentionAtOffset(offset).capacityRetention()));
            c.add(new Column<>("+" + offset + " voltage retention (%)", s -> s.getRetentionAtOffset(offset).voltageRetention()));
            c.add(new Column<>("+" + offset + " energy retention (%)", s -> s.getRetentionAtOffset(offset).energyRetention()));
        }
        return c;
    }

    private List<Column<ChannelSummary>> channelColumns() {
        List<Column<ChannelSummary>> c = new ArrayList<>();
        c.add(new Column<>("Series", ChannelSummary::getSeries));
        c.add(new Column<>("Batch", ChannelSummary::getUnifiedBatchId));
        c.add(new Column<>("Sub-batch", ChannelSummary::getBatchId));
        c.add(new Column<>("Channel", ChannelSummary::getChannelKey));
        c.add(new Column<>("Shelf time", ChannelSummary::getShelfTime));
        c.add(new Column<>("Test mode", ChannelSummary::getTestMode));
        c.add(new Column<>("Active mass", ChannelSummary::getActiveMass));
        c.add(new Column<>("First charge (mAh/g)", ChannelSummary::getFirstCharge));
        c.add(new Column<>("First discharge (mAh/g)", ChannelSummary::getFirstDischarge));
        c.add(new Column<>("First efficiency (%)", ChannelSummary::getFirstEfficiency));
        c.add(new Column<>("First voltage (V)", ChannelSummary::getFirstVoltage));
        c.add(new Column<>("First energy (mWh/g)", ChannelSummary::getFirstEnergy));
        for (int n = ChannelSummary.FIRST_EARLY_CYCLE; n <= ChannelSummary.LAST_EARLY_CYCLE; n++) {
            final int cycle = n;
            c.add(new Column<>("Cycle" + cycle + " discharge", s -> s.getCycleDischarge(cycle)));
        }
        c.add(new Column<>("Cycles", ChannelSummary::getCurrentCycleCount));
        c.add(new Column<>("Rate cycle", s -> cycleNumber(s.getRateCycleIndex())));
        c.add(new Column<>("Rate charge (mAh/g)", ChannelSummary::getRateCharge));
        c.add(new Column<>("Rate discharge (mAh/g)", ChannelSummary::getRateDischarge));
        c.add(new Column<>("Rate efficiency (%)", ChannelSummary::getRateEfficiency));
        c.add(new Column<>("Rate ratio (%)", ChannelSummary::getRateRatio));
        c.add(new Column<>("Rate status", ChannelSummary::getRateStatus));
        c.add(new Column<>("Capacity retention (%)", ChannelSummary::getCurrentCapacityRetention));
        c.add(new Column<>("Voltage retention (%)", ChannelSummary::getCurrentVoltageRetention));
        c.add(new Column<>("Energy retention (%)", ChannelSummary::getCurrentEnergyRetention));
        c.add(new Column<>("Voltage decay (mV/cycle)", ChannelSummary::getVoltageDecayRate));
        for (int offset : retentionOffsets) {
            c.add(new Column<>("+" + offset + " capacity retention (%)", s -> s.getRetentionAtOffset(offset).capacityRetention()));
        }
        c.add(new Column<>("Source file", ChannelSummary::getSourceFile));
        return c;
    }

    /** One row per channel of an inconsistent batch. */
    private record InconsistentRow(InconsistentBatch batch, ChannelSummary channel) {
    }

    private static List<InconsistentRow> inconsistentRows(List<InconsistentBatch> batches) {
        List<InconsistentRow> rows = new ArrayList<>();
        for (InconsistentBatch batch : batches) {
            for (ChannelSummary channel : batch.getChannels()) {
                rows.add(new InconsistentRow(batch, channel));
            }
        }
        return rows;
    }

    private static List<Column<InconsistentRow>> inconsistentColumns() {
        List<Column<InconsistentRow>> c = new ArrayList<>();
        c.add(new Column<>("Series", r -> r.batch().getBatchKey().series()));
        c.add(new Column<>("Batch", r -> r.batch().getBatchKey().unifiedBatchId()));
        c.add(new Column<>("Cause", r -> r.batch().getCause()));
        c.add(new Column<>("Severe channels", r -> r.batch().getSevereCount()));
        c.add(new Column<>("Channel", r -> r.channel().getChannelKey()));
        c.add(new Column<>("First charge (mAh/g)", r -> r.channel().getFirstCharge()));
        c.add(new Column<>("First discharge (mAh/g)", r -> r.channel().getFirstDischarge()));
        c.add(new Column<>("First efficiency (%)", r -> r.channel().getFirstEfficiency()));
        c.add(new Column<>("Rate efficiency (%)", r -> r.channel().getRateEfficiency()));
        c.add(new Column<>("Rate status", r -> r.channel().getRateStatus()));
        c.add(new Column<>("Source file", r -> r.channel().getSourceFile()));
        return c;
    }

    private static List<Column<ScreenedChannel>> screenedColumns(boolean withReason) {
        List<Column<ScreenedChannel>> c = new ArrayList<>();
        c.add(new Column<>("Series", s -> s.summary().getSeries()));
        c.add(new Column<>("Batch", s -> s.summary().getBatchId()));
        c.add(new Column<>("Channel", s -> s.summary().getChannelKey()));
        c.add(new Column<>("Shelf time", s -> s.summary().getShelfTime()));
        c.add(new Column<>("First charge (mAh/g)", s -> s.summary().getFirstCharge()));
        c.add(new Column<>("First discharge (mAh/g)", s -> s.summary().getFirstDischarge()));
        c.add(new Column<>("First efficiency (%)", s -> s.summary().getFirstEfficiency()));
        c.add(new Column<>("First voltage (V)", s -> s.summary().getFirstVoltage()));
        if (withReason) {
            c.add(new Column<>("Reason", ScreenedChannel::reason));
        }
        c.add(new Column<>("Source file", s -> s.summary().getSourceFile()));
        return c;
    }

    private static List<Column<ReferenceSelectionDiagnostics>> decisionColumns() {
        List<Column<ReferenceSelectionDiagnostics>> c = new ArrayList<>();
        c.add(new Column<>("Series", d -> d.getBatchKey().series()));
        c.add(new Column<>("Batch", d -> d.getBatchKey().unifiedBatchId()));
        c.add(new Column<>("Candidates", ReferenceSelectionDiagnostics::getCandidateCount));
        c.add(new Column<>("Winner", ReferenceSelectionDiagnostics::getWinner));
        for (ReferenceMethod method : ReferenceMethod.values()) {
            if (method.isScoringMethod()) {
                c.add(new Column<>(method.toString(), d -> d.getChosenByMethod().get(method)));
            }
        }
        c.add(new Column<>("Disagreement", d -> d.hasDisagreement() ? "Yes" : "No"));
        c.add(new Column<>("Failures", d -> formatFailures(d.getFailures())));
        return c;
    }

    private static List<Column<SkippedFile>> skippedColumns() {
        List<Column<SkippedFile>> c = new ArrayList<>();
        c.add(new Column<>("File", SkippedFile::fileName));
        c.add(new Column<>("Reason", SkippedFile::reason));
        return c;
    }

    private static String formatFailures(Map<ReferenceMethod, String> failures) {
        if (failures.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        failures.forEach((method, message) -> {
            if (sb.length() > 0) sb.append("; ");
            sb.append(method).append(": ").append(message);
        });
        return sb.toString();
    }

    /** 1-based cycle number for display. */
    private static Integer cycleNumber(Integer index) {
        return index != null ? index + 1 : null;
    }
}
