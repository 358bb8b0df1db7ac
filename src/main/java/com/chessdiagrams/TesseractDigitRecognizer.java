package com.chessdiagrams;

import java.awt.image.BufferedImage;
import java.util.List;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;

/**
 * Tesseract restricted to digits on a single text line.
 */
public class TesseractDigitRecognizer implements DigitRecognizer {

    private static final Logger log = LoggerFactory.getLogger(TesseractDigitRecognizer.class);

    private static final int PSM_SINGLE_LINE = 7;

    private final Tesseract tesseract;
    private final float confidenceFloor;

    /**
     * @param tessDataPath folder holding the traineddata files, or null for the Tess4J default
     * @param confidenceFloor words below this confidence (0-100) are discarded
     */
    public TesseractDigitRecognizer(String tessDataPath, String language, float confidenceFloor) {
        this.confidenceFloor = confidenceFloor;
        this.tesseract = new Tesseract();
        if (tessDataPath != null) {
            tesseract.setDatapath(tessDataPath);
        }
        tesseract.setLanguage(language == null ? "eng" : language);
        tesseract.setPageSegMode(PSM_SINGLE_LINE);
        tesseract.setOcrEngineMode(1);
        tesseract.setVariable("tessedit_char_whitelist", "0123456789");
        log.info("Tesseract digit recognizer ready (data: {}, floor {})",
                tessDataPath == null ? "default" : tessDataPath, confidenceFloor);
    }

    @Override
    public String recognizeDigits(Mat image) {
        try {
            BufferedImage bi = MatConversions.toBufferedImage(image);
            List<Word> words = tesseract.getWords(bi, ITessAPI.TessPageIteratorLevel.RIL_WORD);

            StringBuilder digits = new StringBuilder();
            for (Word word : words) {
                if (word.getConfidence() < confidenceFloor) {
                    log.debug("Discarding '{}' at confidence {}", word.getText(), word.getConfidence());
                    continue;
                }
                for (char c : word.getText().toCharArray()) {
                    if (Character.isDigit(c)) {
                        digits.append(c);
                    }
                }
            }
            return digits.length() == 0 ? null : digits.toString();
        } catch (Exception | UnsatisfiedLinkError e) {
            log.warn("OCR failed: {}", e.toString());
            return null;
        }
    }
}
