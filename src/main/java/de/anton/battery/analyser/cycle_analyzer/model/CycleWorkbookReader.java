package de.anton.battery.analyser.cycle_analyzer.model;

import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.WorkbookSettings;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads one channel workbook exported by the cycler.
 * <ul>
 *   <li>Cycle sheet (mandatory): one row per cycle with specific charge/discharge capacity,
 *       median discharge voltage and specific discharge energy, located by header text.</li>
 *   <li>Test sheet (optional): active material mass in the row labelled {@value #ACTIVE_MASS_LABEL}.</li>
 * </ul>
 */
public class CycleWorkbookReader {

    private static final Logger logger = LoggerFactory.getLogger(CycleWorkbookReader.class);

    static final String HEADER_CHARGE = "充电比容量(mAh/g)";
    static final String HEADER_DISCHARGE = "放电比容量(mAh/g)";
    static final String HEADER_VOLTAGE = "放电中值电压(V)";
    static final String HEADER_ENERGY = "放电比能量(mWh/g)";
    static final String ACTIVE_MASS_LABEL = "活性物质";

    private final WorkbookSettings settings;

    public CycleWorkbookReader(WorkbookSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Workbook settings cannot be null.");
    }

    /**
     * @throws IOException if the file cannot be read, the cycle sheet or one of its columns is missing,
     *                     or the sheet holds no cycle rows
     */
    public ChannelRecording read(File file, ChannelFileInfo fileInfo) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        Objects.requireNonNull(fileInfo, "File info cannot be null.");
        logger.debug("Reading channel workbook: {}", file.getAbsolutePath());

        try (InputStream fis = new FileInputStream(file);
             Workbook workbook = WorkbookFactory.create(fis)) {

            Sheet cycleSheet = workbook.getSheet(settings.cycleSheetName());
            if (cycleSheet == null) {
                throw new IOException("Required sheet '" + settings.cycleSheetName() + "' not found in " + file.getName() + ".");
            }
            List<CycleRecord> rows = readCycles(cycleSheet);
            if (rows.isEmpty()) {
                throw new IOException("No cycle rows found in sheet '" + settings.cycleSheetName() + "' of " + file.getName() + ".");
            }

            Double activeMass = null;
            Sheet testSheet = workbook.getSheet(settings.testSheetName());
            if (testSheet != null) {
                activeMass = readActiveMass(testSheet);
                if (activeMass == null) {
                    logger.debug("No active material mass in sheet '{}' of {}.", settings.testSheetName(), file.getName());
                }
            } else {
                logger.debug("Optional sheet '{}' not found in {}.", settings.testSheetName(), file.getName());
            }

            logger.debug("Read {} cycle rows from {}.", rows.size(), file.getName());
            return new ChannelRecording(fileInfo, rows, activeMass);

        } catch (IOException ioe) {
            throw ioe;
        } catch (Exception e) {
            throw new IOException("Error processing channel workbook " + file.getName() + ": " + e.getMessage(), e);
        }
    }

    private List<CycleRecord> readCycles(Sheet sheet) throws IOException {
        DataFormatter formatter = new DataFormatter();
        FormulaEvaluator evaluator = sheet.getWorkbook().getCreationHelper().createFormulaEvaluator();

        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            throw new IOException("Sheet '" + sheet.getSheetName() + "' is missing its header row.");
        }

        int chargeCol = -1, dischargeCol = -1, voltageCol = -1, energyCol = -1;
        for (Cell cell : headerRow) {
            String headerText = getCellValueAsString(cell, formatter, evaluator);
            int index = cell.getColumnIndex();
            if (HEADER_CHARGE.equals(headerText)) chargeCol = index;
            else if (HEADER_DISCHARGE.equals(headerText)) dischargeCol = index;
            else if (HEADER_VOLTAGE.equals(headerText)) voltageCol = index;
            else if (HEADER_ENERGY.equals(headerText)) energyCol = index;
        }
        if (chargeCol == -1 || dischargeCol == -1 || voltageCol == -1 || energyCol == -1) {
            throw new IOException("Sheet '" + sheet.getSheetName() + "' is missing required columns: "
                    + (chargeCol == -1 ? "'" + HEADER_CHARGE + "' " : "")
                    + (dischargeCol == -1 ? "'" + HEADER_DISCHARGE + "' " : "")
                    + (voltageCol == -1 ? "'" + HEADER_VOLTAGE + "' " : "")
                    + (energyCol == -1 ? "'" + HEADER_ENERGY + "'" : ""));
        }

        List<CycleRecord> cycles = new ArrayList<>();
        for (int i = headerRow.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (row == null) {
                continue;
            }
            double charge = getCellValueAsDouble(row.getCell(chargeCol), formatter, evaluator);
            double discharge = getCellValueAsDouble(row.getCell(dischargeCol), formatter, evaluator);
            if (Double.isNaN(charge) && Double.isNaN(discharge)) {
                logger.trace("Skipping row {} of '{}' without capacities.", i + 1, sheet.getSheetName());
                continue;
            }
            double voltage = getCellValueAsDouble(row.getCell(voltageCol), formatter, evaluator);
            double energy = getCellValueAsDouble(row.getCell(energyCol), formatter, evaluator);
            cycles.add(new CycleRecord(cycles.size(), charge, discharge, voltage, energy));
        }
        return cycles;
    }

    private Double readActiveMass(Sheet sheet) {
        DataFormatter formatter = new DataFormatter();
        FormulaEvaluator evaluator = sheet.getWorkbook().getCreationHelper().createFormulaEvaluator();
        for (Row row : sheet) {
            Cell label = row.getCell(0, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            if (label != null && ACTIVE_MASS_LABEL.equals(getCellValueAsString(label, formatter, evaluator))) {
                double mass = getCellValueAsDouble(row.getCell(1), formatter, evaluator);
                if (Double.isNaN(mass)) {
                    logger.warn("Active material mass in '{}' row {} is not numeric: '{}'",
                            sheet.getSheetName(), row.getRowNum() + 1, getCellValueAsString(row.getCell(1), formatter, evaluator));
                    return null;
                }
                return mass;
            }
        }
        return null;
    }

    // --- Cell value getters ---

    /** Gets cell value as String, evaluating formulas. Returns empty string for null/blank. */
    static String getCellValueAsString(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null || cell.getCellType() == CellType.BLANK) {
            return "";
        }
        try {
            return formatter.formatCellValue(cell, evaluator).trim();
        } catch (RuntimeException e) {
            logger.warn("Error formatting cell {}: {}. Returning empty string.", cell.getAddress(), e.getMessage());
            return "";
        }
    }

    /** Gets cell value as double, evaluating formulas and parsing strings. Returns NaN for errors and blanks. */
    static double getCellValueAsDouble(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null || cell.getCellType() == CellType.BLANK) {
            return Double.NaN;
        }
        CellType cellType = cell.getCellType();

        if (evaluator != null && cellType == CellType.FORMULA) {
            try {
                CellValue evaluated = evaluator.evaluate(cell);
                cellType = evaluated.getCellType();
                if (cellType == CellType.NUMERIC) return evaluated.getNumberValue();
                if (cellType == CellType.STRING) return parseDouble(evaluated.getStringValue());
                if (cellType == CellType.ERROR) {
                    logger.warn("Formula in cell {} resulted in an error: {}", cell.getAddress(),
                            FormulaError.forInt(evaluated.getErrorValue()).getString());
                }
                return Double.NaN;
            } catch (RuntimeException e) {
                logger.warn("Could not evaluate formula in cell {}: {}. Returning NaN.", cell.getAddress(), e.getMessage());
                return Double.NaN;
            }
        }

        switch (cellType) {
            case NUMERIC:
                return cell.getNumericCellValue();
            case STRING:
                return parseDouble(cell.getStringCellValue());
            case ERROR:
                logger.warn("Cell {} contains an error code: {}", cell.getAddress(),
                        FormulaError.forInt(cell.getErrorCellValue()).getString());
                return Double.NaN;
            default:
                logger.trace("Unhandled cell type {} in cell {}. Returning NaN.", cell.getCellType(), cell.getAddress());
                return Double.NaN;
        }
    }

    /**
     * Parses numbers that may use a decimal comma or carry a unit suffix.
     *
     * @return the parsed value, or NaN for null, empty, "-" or unparsable input
     */
    static double parseDouble(String valueStr) {
        if (valueStr == null || valueStr.trim().isEmpty() || valueStr.trim().equals("-")) {
            return Double.NaN;
        }
        String cleaned = valueStr.trim().replace(',', '.').replaceAll("[^\\d.eE-]", "");
        if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("-")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            logger.trace("Could not parse double from '{}' (original: '{}').", cleaned, valueStr);
            return Double.NaN;
        }
    }
}
