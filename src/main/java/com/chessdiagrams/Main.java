package com.chessdiagrams;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nu.pattern.OpenCV;

/**
 * Command line entry point: {@code Main <config.json>}.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIGURATION = 2;

    static {
        OpenCV.loadLocally();
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length != 1) {
            log.error("Usage: java -jar chess-diagram-extractor.jar <config.json>");
            return EXIT_CONFIGURATION;
        }
        try {
            ExtractorConfig config = ExtractorConfig.load(Path.of(args[0]));
            if (config.pdfPath == null || !Files.isRegularFile(Path.of(config.pdfPath))) {
                throw new ConfigurationException("pdfPath does not point to a file: " + config.pdfPath);
            }
            extract(config);
            return EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (IOException e) {
            log.error("Extraction failed", e);
            return EXIT_FAILURE;
        }
    }

    static void extract(ExtractorConfig config) throws IOException {
        log.info("Extracting {} (layout {}, preset {})", config.pdfPath, config.layout, config.preset);
        List<?> records;
        ExtractionSummary summary;
        try (PdfDocumentSource source = new PdfDocumentSource(Path.of(config.pdfPath), config.renderDpi)) {
            if (config.layout == Layout.GRID) {
                ExtractionResult<GridSection> result = new GridExtractor(config).extract(source);
                records = result.getRecords();
                summary = result.getSummary();
            } else {
                ExtractionResult<Diagram> result = new DiagramExtractor(config).extract(source);
                records = result.getRecords();
                summary = result.getSummary();
            }
        }
        new JsonResultWriter().write(records, JsonResultWriter.outputFile(config));
        summary.logTo(log);
    }
}
