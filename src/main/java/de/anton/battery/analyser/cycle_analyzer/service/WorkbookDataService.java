package de.anton.battery.analyser.cycle_analyzer.service;

import de.anton.battery.analyser.cycle_analyzer.model.ChannelFileInfo;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelFileNameParser;
import de.anton.battery.analyser.cycle_analyzer.model.ChannelRecording;
import de.anton.battery.analyser.cycle_analyzer.model.CycleWorkbookReader;
import de.anton.battery.analyser.cycle_analyzer.model.ScreenedChannel;
import de.anton.battery.analyser.cycle_analyzer.model.SkippedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Service responsible for loading channel workbooks and screening them.
 */
public class WorkbookDataService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookDataService.class);
    static final String LOCK_FILE_PREFIX = "~$";

    /** Screened channels of a folder plus the files that could not be read. */
    public static class LoadResult {
        public final List<ScreenedChannel> channels;
        public final List<SkippedFile> skippedFiles;

        LoadResult(List<ScreenedChannel> channels, List<SkippedFile> skippedFiles) {
            this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
            this.skippedFiles = Collections.unmodifiableList(new ArrayList<>(skippedFiles));
        }
    }

    private final ChannelFileNameParser fileNameParser;
    private final CycleWorkbookReader workbookReader;
    private final ChannelSummaryFactory summaryFactory;

    public WorkbookDataService(ProcessingConfiguration config) {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        this.fileNameParser = new ChannelFileNameParser(config.workbook().seriesRules(), config.workbook().defaultSeries());
        this.workbookReader = new CycleWorkbookReader(config.workbook());
        this.summaryFactory = new ChannelSummaryFactory(config);
    }

    /**
     * Loads and screens every workbook in the folder, in file name order. Files that fail are recorded and skipped.
     *
     * @throws IOException if the folder cannot be listed
     */
    public LoadResult loadFolder(File folder) throws IOException {
        Objects.requireNonNull(folder, "Input folder cannot be null.");
        if (!folder.isDirectory()) {
            throw new IOException("Input folder does not exist or is not a directory: " + folder.getAbsolutePath());
        }
        File[] files = folder.listFiles(WorkbookDataService::isChannelWorkbook);
        if (files == null) {
            throw new IOException("Could not list input folder: " + folder.getAbsolutePath());
        }
        Arrays.sort(files, Comparator.comparing(File::getName));
        logger.info("Data Service: Found {} channel workbooks in {}", files.length, folder.getAbsolutePath());

        List<ScreenedChannel> channels = new ArrayList<>();
        List<SkippedFile> skipped = new ArrayList<>();
        for (File file : files) {
            try {
                channels.add(loadDataFromFile(file));
            } catch (IOException | RuntimeException e) {
                logger.error("Data Service: Skipping {}: {}", file.getName(), e.getMessage());
                skipped.add(new SkippedFile(file.getName(), e.getMessage()));
            }
        }
        logger.info("Data Service: Loaded {} channels, skipped {} files.", channels.size(), skipped.size());
        return new LoadResult(channels, skipped);
    }

    /**
     * Loads and screens a single workbook.
     *
     * @throws IOException if the workbook cannot be read or parsed
     */
    public ScreenedChannel loadDataFromFile(File file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        ChannelFileInfo info = fileNameParser.parse(file.getName());
        MDC.put("channel", info.hostId() + "-" + info.channelId());
        try {
            ChannelRecording recording = workbookReader.read(file, info);
            ScreenedChannel screened = summaryFactory.screen(recording);
            logger.debug("Data Service: {} -> {}", file.getName(), screened.status());
            return screened;
        } finally {
            MDC.remove("channel");
        }
    }

    static boolean isChannelWorkbook(File file) {
        String name = file.getName();
        String lower = name.toLowerCase(Locale.ROOT);
        return file.isFile() && !name.startsWith(LOCK_FILE_PREFIX) && (lower.endsWith(".xlsx") || lower.endsWith(".xls"));
    }
}
