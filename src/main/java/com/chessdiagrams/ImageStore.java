package com.chessdiagrams;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes board, rejected and grid section images below the output folder.
 * Each kind has its own switch; a disabled kind is never written.
 */
public class ImageStore {

    private static final Logger log = LoggerFactory.getLogger(ImageStore.class);

    public static final String CHESSBOARDS = "chessboards";
    public static final String NON_CHESSBOARDS = "non_chessboards";
    public static final String SECTIONS = "sections";

    private final Path root;
    private final boolean saveChessboards;
    private final boolean saveNonChessboards;
    private final boolean saveSections;

    public ImageStore(Path root, boolean saveChessboards, boolean saveNonChessboards, boolean saveSections) {
        this.root = root;
        this.saveChessboards = saveChessboards;
        this.saveNonChessboards = saveNonChessboards;
        this.saveSections = saveSections;
    }

    /** A store that writes nothing. */
    public static ImageStore disabled() {
        return new ImageStore(null, false, false, false);
    }

    public static ImageStore from(ExtractorConfig config) {
        return new ImageStore(Path.of(config.outputFolder), config.saveChessboardImages,
                config.saveNonChessboardImages, config.saveSectionImages);
    }

    /** @return the written path, or null when disabled or failed */
    public String saveChessboard(Mat image, int diagramCount, int page) {
        if (!saveChessboards) {
            return null;
        }
        return write(root.resolve(CHESSBOARDS), String.format("diagram_%03d_page_%d.png", diagramCount, page), image);
    }

    public String saveNonChessboard(Mat image, int page, int globalIndex) {
        if (!saveNonChessboards) {
            return null;
        }
        return write(root.resolve(NON_CHESSBOARDS), "page_" + page + "_block_" + globalIndex + ".png", image);
    }

    public String saveSection(Mat image, int page, int sectionNumber) {
        if (!saveSections) {
            return null;
        }
        return write(root.resolve(SECTIONS).resolve("page_" + page), "section_" + sectionNumber + ".png", image);
    }

    private String write(Path folder, String fileName, Mat image) {
        if (image == null || image.empty()) {
            return null;
        }
        Path file = folder.resolve(fileName);
        try {
            Files.createDirectories(folder);
            if (!Imgcodecs.imwrite(file.toString(), image)) {
                log.warn("Could not write image {}", file);
                return null;
            }
            return file.toString();
        } catch (IOException e) {
            log.warn("Could not create folder {}: {}", folder, e.getMessage());
            return null;
        }
    }
}
