package de.anton.battery.analyser.cycle_analyzer;

import de.anton.battery.analyser.cycle_analyzer.controller.AnalysisController;
import de.anton.battery.analyser.cycle_analyzer.model.AnalysisReport;
import de.anton.battery.analyser.cycle_analyzer.service.ConfigurationLoader;
import de.anton.battery.analyser.cycle_analyzer.service.ProcessingConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point:
 * {@code App <input-folder> [output.xlsx] [config.properties] [--charts]}.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final String DEFAULT_OUTPUT = "cycle-analysis.xlsx";
    static final String CHARTS_FLAG = "--charts";
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        int code = run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        boolean charts = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if (CHARTS_FLAG.equals(arg)) {
                charts = true;
            } else {
                positional.add(arg);
            }
        }
        if (positional.isEmpty() || positional.size() > 3) {
            System.err.println("Usage: App <input-folder> [output.xlsx] [config.properties] [--charts]");
            return EXIT_USAGE;
        }

        File inputFolder = new File(positional.get(0));
        Path output = Path.of(positional.size() > 1 ? positional.get(1) : DEFAULT_OUTPUT);
        try {
            ProcessingConfiguration config = positional.size() > 2
                    ? ConfigurationLoader.load(Path.of(positional.get(2)))
                    : ConfigurationLoader.loadDefaults();

            logger.info("Analysing channel workbooks in {}", inputFolder.getAbsolutePath());
            AnalysisController controller = new AnalysisController(config);
            AnalysisReport report = controller.analyzeFolder(inputFolder);
            controller.exportReport(report, output);
            if (charts) {
                controller.renderCharts(report, output);
            }
            logger.info("Finished: {} batches written to {}", report.statistics().size(), output.toAbsolutePath());
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("Analysis failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
