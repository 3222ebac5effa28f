package com.example.idreader.ocr;

import java.util.List;

/**
 * The OCR engine, seen as a black box.
 *
 * @param <F> the frame type supplied by the camera
 */
@FunctionalInterface
public interface TextRecognizer<F> {

    /**
     * Recognize all text lines in a frame. Order is not significant.
     */
    List<OcrLine> recognize(F frame) throws Exception;
}
