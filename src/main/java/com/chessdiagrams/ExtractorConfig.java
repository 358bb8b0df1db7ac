package com.chessdiagrams;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Run configuration, read from a JSON file. Fields left out of the file keep the
 * defaults below.
 */
public class ExtractorConfig {

    public static final String DEFAULT_RECOGNITION_URL = "http://app.chessvision.ai/predict";

    public String pdfPath;
    public String outputFolder = "data_output";
    public Layout layout = Layout.DIAGRAMS;
    public BookPreset preset = BookPreset.WOODPECKER_METHOD;

    // 1-based, inclusive; null means open
    public Integer pageStart;
    public Integer pageEnd;
    public Integer maxDiagrams;

    public int maxSearchDistance = 20;
    public DiagramStructure diagramStructure;
    public String headerPattern;
    public String solutionPattern;
    public int fullMoveMaxLength = SolutionParser.DEFAULT_FULL_MOVE_MAX_LENGTH;

    public boolean useRecognitionApi = false;
    public String recognitionUrl = DEFAULT_RECOGNITION_URL;
    public double minDelaySeconds = 1.0;
    public double maxDelaySeconds = 5.0;
    public double apiTimeoutSeconds = 10.0;

    public boolean saveChessboardImages = true;
    public boolean saveNonChessboardImages = false;
    public boolean saveSectionImages = false;
    public boolean inspectBlocks = false;

    public int renderDpi = 144;
    public String tessDataPath;
    public String ocrLanguage = "eng";

    public GridSettings grid = new GridSettings();
    public BubbleSettings bubbles = new BubbleSettings();
    public ChessboardSettings chessboard = new ChessboardSettings();

    /** Layout of grid books. */
    public static class GridSettings {
        public int rows = 3;
        public int columns = 2;
        public double bubbleAreaFraction = 0.35;
        public int bodyPadding = 10;
        public int firstGridPage = 1;
        public double diagramNumberFraction = 0.25;
    }

    /** Bubble marker detection thresholds. */
    public static class BubbleSettings {
        public double minArea = 30;
        public double maxArea = 2000;
        public double minCircularity = 0.6;
        public double minAspect = 0.6;
        public double maxAspect = 1.6;
        public int minSpacing = 25;
        public int maxBubbles = 2;
        public double fillThreshold = 128;
        public float ocrConfidenceFloor = 60f;
    }

    /** Contour heuristics of the chessboard validator. */
    public static class ChessboardSettings {
        public double cannyLow = 10;
        public double cannyHigh = 50;
        public int edgeDilation = 1;
        public double approxEpsilon = 0.03;
        public double minAspect = 0.4;
        public double maxAspect = 1.8;
        public int minSide = 5;
        public int minSquareContours = 4;
        public int maxSquareContours = 1000;
        public double uniformAreaRatio = 2.0;
        public double minUniformFraction = 0.3;
        // median square area relative to the largest quadrilateral
        public double maxCellFraction = 0.1;
    }

    public static ExtractorConfig load(Path file) {
        Gson gson = new GsonBuilder().create();
        ExtractorConfig config;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            config = gson.fromJson(reader, ExtractorConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + file, e);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed configuration " + file + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Empty configuration " + file);
        }
        config.validate();
        return config;
    }

    public DiagramStructure structure() {
        return diagramStructure != null ? diagramStructure : preset().getStructure();
    }

    public BlockPattern headerBlockPattern() {
        return BlockPattern.header(headerPattern != null ? headerPattern : preset().getHeaderPattern());
    }

    public BlockPattern solutionBlockPattern() {
        return BlockPattern.solution(solutionPattern != null ? solutionPattern : preset().getSolutionPattern());
    }

    private BookPreset preset() {
        return preset != null ? preset : BookPreset.WOODPECKER_METHOD;
    }

    /**
     * Rejects settings that would make the run meaningless.
     *
     * @throws ConfigurationException on the first invalid setting
     */
    public void validate() {
        if (layout == null) {
            throw new ConfigurationException("layout must be 'diagrams' or 'grid'");
        }
        headerBlockPattern();
        solutionBlockPattern();

        if (maxSearchDistance < 0) {
            throw new ConfigurationException("maxSearchDistance must not be negative: " + maxSearchDistance);
        }
        if (fullMoveMaxLength <= 0) {
            throw new ConfigurationException("fullMoveMaxLength must be positive: " + fullMoveMaxLength);
        }
        if (maxDiagrams != null && maxDiagrams < 0) {
            throw new ConfigurationException("maxDiagrams must not be negative: " + maxDiagrams);
        }
        if (pageStart != null && pageStart < 1) {
            throw new ConfigurationException("pageStart is 1-based: " + pageStart);
        }
        if (pageStart != null && pageEnd != null && pageStart > pageEnd) {
            throw new ConfigurationException("pageStart " + pageStart + " is after pageEnd " + pageEnd);
        }
        if (minDelaySeconds < 0 || maxDelaySeconds < 0) {
            throw new ConfigurationException("Delays must not be negative");
        }
        if (minDelaySeconds > maxDelaySeconds) {
            throw new ConfigurationException(
                    "minDelaySeconds " + minDelaySeconds + " exceeds maxDelaySeconds " + maxDelaySeconds);
        }
        if (apiTimeoutSeconds <= 0) {
            throw new ConfigurationException("apiTimeoutSeconds must be positive: " + apiTimeoutSeconds);
        }
        if (renderDpi <= 0) {
            throw new ConfigurationException("renderDpi must be positive: " + renderDpi);
        }
        if (grid == null || bubbles == null || chessboard == null) {
            throw new ConfigurationException("grid, bubbles and chessboard sections must not be null");
        }
        if (grid.rows <= 0 || grid.columns <= 0) {
            throw new ConfigurationException("Grid must have positive dimensions: " + grid.rows + "x" + grid.columns);
        }
        if (grid.bubbleAreaFraction <= 0 || grid.bubbleAreaFraction >= 1) {
            throw new ConfigurationException("bubbleAreaFraction must lie in (0,1): " + grid.bubbleAreaFraction);
        }
        if (grid.diagramNumberFraction < 0 || grid.diagramNumberFraction >= 1) {
            throw new ConfigurationException("diagramNumberFraction must lie in [0,1): " + grid.diagramNumberFraction);
        }
        if (grid.bodyPadding < 0) {
            throw new ConfigurationException("bodyPadding must not be negative: " + grid.bodyPadding);
        }
        if (bubbles.minArea < 0 || bubbles.minArea > bubbles.maxArea) {
            throw new ConfigurationException("Invalid bubble area band " + bubbles.minArea + ".." + bubbles.maxArea);
        }
        if (bubbles.maxBubbles < 0 || bubbles.minSpacing < 0) {
            throw new ConfigurationException("Bubble count and spacing must not be negative");
        }
        if (chessboard.minSquareContours > chessboard.maxSquareContours) {
            throw new ConfigurationException("minSquareContours exceeds maxSquareContours");
        }
        if (chessboard.minAspect > chessboard.maxAspect) {
            throw new ConfigurationException("Chessboard aspect band is inverted");
        }
    }
}
