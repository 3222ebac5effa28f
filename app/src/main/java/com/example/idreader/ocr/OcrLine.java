package com.example.idreader.ocr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One line of recognized text with the recognizer's confidence.
 */
public class OcrLine {
    public final String text;
    public final float confidence;

    public OcrLine(String text, float confidence) {
        this.text = Objects.requireNonNull(text, "text");
        this.confidence = confidence;
    }

    /**
     * Texts of the lines at or above the confidence floor, in input order.
     */
    public static List<String> texts(Collection<OcrLine> lines, float confidenceFloor) {
        List<String> texts = new ArrayList<>();
        if (lines == null) {
            return texts;
        }
        for (OcrLine line : lines) {
            if (line != null && line.confidence >= confidenceFloor) {
                texts.add(line.text);
            }
        }
        return texts;
    }

    @Override
    public String toString() {
        return "OcrLine{'" + text + "', conf=" + confidence + "}";
    }
}
