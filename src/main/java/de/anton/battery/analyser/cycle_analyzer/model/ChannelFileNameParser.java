package de.anton.battery.analyser.cycle_analyzer.model;

import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration.SeriesRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives host, channel, batch, shelf time, test mode and series from a channel workbook name such as
 * {@code M2-PC2-036-8-1-Q3-2405-A_12 0614-1-1C-0620-1011 (1).xlsx}.
 * <p>
 * Names are split on '-'. A first segment containing '.' (an IP address) means the host is two segments
 * long, otherwise three; the channel is the next two segments.
 */
public class ChannelFileNameParser {

    private static final Logger logger = LoggerFactory.getLogger(ChannelFileNameParser.class);

    static final int MAX_FALLBACK_HOST_LENGTH = 20;
    static final String DEFAULT_CHANNEL = "CH-01";
    private static final Pattern CHANNEL_PATTERN = Pattern.compile("CH[-_]?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_PATTERN = Pattern.compile("(\\d{4}[-/]?\\d{2}[-/]?\\d{2}|\\d{6}|\\d{4})");
    private static final Pattern LETTERS = Pattern.compile("([A-Za-z]+)");
    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final int SERIES_SEGMENT = 5;
    private static final int BATCH_FIRST_SEGMENT = 5;

    private final List<SeriesRule> seriesRules;
    private final String defaultSeries;

    public ChannelFileNameParser(List<SeriesRule> seriesRules, String defaultSeries) {
        this.seriesRules = List.copyOf(Objects.requireNonNull(seriesRules, "Series rules cannot be null."));
        this.defaultSeries = Objects.requireNonNull(defaultSeries, "Default series cannot be null.");
    }

    public ChannelFileInfo parse(String fileName) {
        Objects.requireNonNull(fileName, "File name cannot be null.");
        String stem = stripExtension(fileName);
        String[] hostAndChannel = extractHostAndChannel(fileName);
        String host = hostAndChannel[0];
        String channel = hostAndChannel[1];
        if (host.isEmpty() || channel.isEmpty()) {
            logger.debug("Host/channel not found in '{}', using fallback identifiers.", fileName);
            host = stem.length() > MAX_FALLBACK_HOST_LENGTH ? stem.substring(0, MAX_FALLBACK_HOST_LENGTH) : stem;
            Matcher m = CHANNEL_PATTERN.matcher(fileName);
            channel = m.find() ? "CH-" + m.group(1) : DEFAULT_CHANNEL;
        }
        ChannelFileInfo info = new ChannelFileInfo(fileName, host, channel, extractBatchId(fileName),
                extractShelfTime(fileName), TestMode.fromFileName(fileName), identifySeries(fileName));
        logger.debug("Parsed file name '{}': {}", fileName, info);
        return info;
    }

    /** Returns {host, channel}; both empty if the name has too few segments. */
    static String[] extractHostAndChannel(String name) {
        String[] parts = name.split("-");
        if (parts[0].contains(".") && parts.length >= 4) {
            return new String[]{join(parts, 0, 2), join(parts, 2, 4)};
        }
        if (parts.length >= 5) {
            return new String[]{join(parts, 0, 3), join(parts, 3, 5)};
        }
        return new String[]{"", ""};
    }

    /**
     * Segments from index 5 of the part before the first '_', joined with the part between the first and second '_'.
     */
    static String extractBatchId(String fileName) {
        String[] underscore = fileName.split("_", -1);
        if (underscore.length >= 2) {
            String[] dash = underscore[0].split("-");
            String first = dash.length > BATCH_FIRST_SEGMENT ? join(dash, BATCH_FIRST_SEGMENT, dash.length) : "";
            return first + "-" + underscore[1];
        }
        String[] dash = fileName.split("-");
        if (dash.length > BATCH_FIRST_SEGMENT) {
            return stripExtension(join(dash, BATCH_FIRST_SEGMENT, dash.length));
        }
        return stripExtension(fileName);
    }

    /** The last two dash segments before the first space, else a date-like token, else the stem's last two segments. */
    static String extractShelfTime(String fileName) {
        if (fileName.contains(" ")) {
            String[] dash = fileName.substring(0, fileName.indexOf(' ')).split("-");
            return dash.length >= 2 ? join(dash, dash.length - 2, dash.length) : dash[dash.length - 1];
        }
        Matcher m = DATE_PATTERN.matcher(fileName);
        if (m.find()) {
            return m.group(1);
        }
        String[] dash = stripExtension(fileName).split("-");
        return dash.length >= 2 ? join(dash, dash.length - 2, dash.length) : dash[0];
    }

    /**
     * Groups sibling sub-batches: ids with more than three '-' segments lose their last three.
     */
    public static String unifiedBatchId(String batchId) {
        if (batchId == null) {
            return null;
        }
        String[] parts = batchId.split("-", -1);
        if (parts.length > 3) {
            return join(parts, 0, parts.length - 3);
        }
        return batchId;
    }

    String identifySeries(String fileName) {
        for (SeriesRule rule : seriesRules) {
            if (rule.matches(fileName)) {
                return rule.name();
            }
        }
        String[] parts = fileName.split("-");
        if (parts.length > SERIES_SEGMENT && !parts[SERIES_SEGMENT].isEmpty()) {
            String segment = parts[SERIES_SEGMENT];
            Matcher letters = LETTERS.matcher(segment);
            if (letters.find()) {
                return letters.group(1).toUpperCase();
            }
            Matcher digits = DIGITS.matcher(segment);
            if (digits.find()) {
                return "N" + digits.group(1);
            }
            return segment.toUpperCase();
        }
        return defaultSeries;
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        // keep dots inside an IP-style host
        if (dot > 0 && fileName.length() - dot <= 5 && fileName.substring(dot + 1).matches("[A-Za-z]+")) {
            return fileName.substring(0, dot);
        }
        return fileName;
    }

    private static String join(String[] parts, int from, int to) {
        return String.join("-", Arrays.copyOfRange(parts, from, to));
    }
}
