package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.model.ScreenedChannel;
import de.anton.battery.analyser.cycle_analyzer.model.TestMode;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookDataServiceTest {

    private static final String GOOD = "M2-PC2-036-8-1-Q3-2405-A_12-1C-0620-1011.xlsx";
    private static final String[] HEADERS = {"充电比容量(mAh/g)", "放电比容量(mAh/g)", "放电中值电压(V)", "放电比能量(mWh/g)"};

    @TempDir
    Path tempDir;

    private final WorkbookDataService service = new WorkbookDataService(ProcessingConfiguration.defaults());

    private void writeChannel(String name, double firstCharge, int rows) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(tempDir.resolve(name))) {
            Sheet sheet = workbook.createSheet("Cycle");
            Row header = sheet.createRow(0);
            for (int i = 0; i < HEADERS.length; i++) {
                header.createCell(i).setCellValue(HEADERS[i]);
            }
            for (int r = 1; r <= rows; r++) {
                double discharge = r == 1 ? 300 : 250 - r;
                Row row = sheet.createRow(r);
                row.createCell(0).setCellValue(r == 1 ? firstCharge : discharge + 3);
                row.createCell(1).setCellValue(discharge);
                row.createCell(2).setCellValue(3.8);
                row.createCell(3).setCellValue(discharge * 3.8);
            }
            workbook.write(out);
        }
    }

    @Test
    void loads_single_workbook() throws IOException {
        writeChannel(GOOD, 330, 6);

        ScreenedChannel screened = service.loadDataFromFile(tempDir.resolve(GOOD).toFile());

        assertTrue(screened.isAccepted());
        assertEquals("M2-PC2-036-8-1", screened.summary().getChannelKey());
        assertEquals("Q3", screened.summary().getSeries());
        assertEquals(TestMode.RATE_1C, screened.summary().getTestMode());
        assertEquals(5, screened.summary().getCurrentCycleCount());
        assertEquals(GOOD, screened.summary().getSourceFile());
    }

    @Test
    void folder_load_skips_broken_files_and_keeps_the_rest() throws IOException {
        writeChannel(GOOD, 330, 6);
        writeChannel("M2-PC2-036-8-2-Q3-2405-A_12-1C-0620-1011.xlsx", 400, 6);
        Files.writeString(tempDir.resolve("M2-PC2-036-8-3-Q3-2405-A_12-1C-0620-1011.xlsx"), "not a workbook");
        Files.writeString(tempDir.resolve("~$" + GOOD), "lock");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        WorkbookDataService.LoadResult result = service.loadFolder(tempDir.toFile());

        assertEquals(2, result.channels.size());
        assertEquals(ScreenedChannel.Status.ACCEPTED, result.channels.get(0).status());
        assertEquals(ScreenedChannel.Status.ABNORMAL_FIRST_CYCLE, result.channels.get(1).status());
        assertEquals(1, result.skippedFiles.size());
        assertEquals("M2-PC2-036-8-3-Q3-2405-A_12-1C-0620-1011.xlsx", result.skippedFiles.get(0).fileName());
        assertNotNull(result.skippedFiles.get(0).reason());
    }

    @Test
    void missing_folder_is_an_error() {
        File missing = tempDir.resolve("missing").toFile();

        assertThrows(IOException.class, () -> service.loadFolder(missing));
    }

    @Test
    void channel_workbook_detection() throws IOException {
        Path xlsx = Files.writeString(tempDir.resolve("a.XLSX"), "");
        Path xls = Files.writeString(tempDir.resolve("b.xls"), "");
        Path lock = Files.writeString(tempDir.resolve("~$a.xlsx"), "");
        Path csv = Files.writeString(tempDir.resolve("c.csv"), "");

        assertTrue(WorkbookDataService.isChannelWorkbook(xlsx.toFile()));
        assertTrue(WorkbookDataService.isChannelWorkbook(xls.toFile()));
        assertFalse(WorkbookDataService.isChannelWorkbook(lock.toFile()));
        assertFalse(WorkbookDataService.isChannelWorkbook(csv.toFile()));
        assertFalse(WorkbookDataService.isChannelWorkbook(tempDir.toFile()));
    }
}
