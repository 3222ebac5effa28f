package com.example.idreader.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.idreader.Configuration;
import com.example.idreader.ocr.OcrLine;
import com.example.idreader.ocr.TextRecognizer;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MrzDetectionHandlerTest {

    private static final List<OcrLine> PASSPORT_FRAME = Arrays.asList(
            new OcrLine("PASSPORT", 0.95f),
            new OcrLine("P<UTOERIKSSON<<ANNA<MARIA<<<<<<<<<<<<<<<<<<<", 0.9f),
            new OcrLine("L898902C36UTO7408122F1204159ZE184226B<<<<<10", 0.9f));

    @Mock
    private TextRecognizer<String> recognizer;

    private final AtomicLong now = new AtomicLong(0);
    private MrzDetectionHandler<String> handler;

    @AfterEach
    void tearDown() {
        if (handler != null) {
            handler.close();
        }
    }

    private MrzDetectionHandler<String> newHandler(TextRecognizer<String> recognizer, Configuration config) {
        handler = new MrzDetectionHandler<>(recognizer, new MrzProcessor(), config, now::get);
        return handler;
    }

    private static void awaitIdle(MrzDetectionHandler<?> handler) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (handler.isProcessing()) {
            if (System.nanoTime() > deadline) {
                fail("Recognition did not finish in time");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void recognizedPassportIsPublished() throws Exception {
        when(recognizer.recognize(anyString())).thenReturn(PASSPORT_FRAME);
        newHandler(recognizer, Configuration.defaults());

        assertTrue(handler.analyzeFrame("frame-1"));

        ScanResult result = handler.results().await(5, TimeUnit.SECONDS).get();
        assertEquals("L898902C3", result.getMrzResult().getDocumentNumber());
        assertTrue(handler.hasScanned());
    }

    @Test
    void frameArrivingDuringRecognitionIsDropped() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        TextRecognizer<String> blocking = frame -> {
            release.await();
            return PASSPORT_FRAME;
        };
        newHandler(blocking, Configuration.defaults());

        assertTrue(handler.analyzeFrame("frame-1"));
        assertTrue(handler.isProcessing());
        assertFalse(handler.analyzeFrame("frame-2"));

        release.countDown();
        awaitIdle(handler);

        assertTrue(handler.analyzeFrame("frame-3"));
    }

    @Test
    void onlyAdmittedFramesAreCounted() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        TextRecognizer<String> blocking = frame -> {
            release.await();
            return PASSPORT_FRAME;
        };
        newHandler(blocking, Configuration.defaults());

        handler.analyzeFrame("frame-1");
        handler.analyzeFrame("frame-2");
        release.countDown();
        awaitIdle(handler);
        handler.analyzeFrame("frame-3");
        awaitIdle(handler);

        assertEquals(2, handler.getFrameCount());
    }

    @Test
    void repeatedScanIsPublishedOnce() throws Exception {
        when(recognizer.recognize(anyString())).thenReturn(PASSPORT_FRAME);
        newHandler(recognizer, Configuration.defaults());

        handler.analyzeFrame("frame-1");
        assertTrue(handler.results().await(5, TimeUnit.SECONDS).isPresent());

        awaitIdle(handler);
        assertTrue(handler.analyzeFrame("frame-2"));
        awaitIdle(handler);

        assertFalse(handler.results().poll().isPresent());
        verify(recognizer, times(2)).recognize(anyString());
    }

    @Test
    void resetAllowsTheSameScanAgain() throws Exception {
        when(recognizer.recognize(anyString())).thenReturn(PASSPORT_FRAME);
        newHandler(recognizer, Configuration.defaults());

        handler.analyzeFrame("frame-1");
        handler.results().await(5, TimeUnit.SECONDS);
        awaitIdle(handler);

        handler.reset();
        assertFalse(handler.hasScanned());

        handler.analyzeFrame("frame-2");
        assertTrue(handler.results().await(5, TimeUnit.SECONDS).isPresent());
    }

    @Test
    void recognizerFailureReleasesTheGate() throws Exception {
        when(recognizer.recognize(anyString())).thenThrow(new IllegalStateException("engine down"));
        newHandler(recognizer, Configuration.defaults());

        assertTrue(handler.analyzeFrame("frame-1"));
        awaitIdle(handler);

        assertTrue(handler.analyzeFrame("frame-2"));
        awaitIdle(handler);

        assertFalse(handler.results().poll().isPresent());
        verify(recognizer, times(2)).recognize(anyString());
    }

    @Test
    void linesBelowConfidenceFloorAreIgnored() throws Exception {
        when(recognizer.recognize(anyString())).thenReturn(Arrays.asList(
                new OcrLine("P<UTOERIKSSON<<ANNA<MARIA<<<<<<<<<<<<<<<<<<<", 0.9f),
                new OcrLine("L898902C36UTO7408122F1204159ZE184226B<<<<<10", 0.2f)));
        newHandler(recognizer, Configuration.defaults());

        handler.analyzeFrame("frame-1");
        awaitIdle(handler);

        assertFalse(handler.results().poll().isPresent());
        assertFalse(handler.hasScanned());
    }

    @Test
    void framesWithinIntervalAreDropped() throws Exception {
        when(recognizer.recognize(anyString())).thenReturn(PASSPORT_FRAME);
        newHandler(recognizer, new Configuration.Builder().setProcessIntervalMs(1000).build());

        assertTrue(handler.analyzeFrame("frame-1"));
        awaitIdle(handler);

        now.set(500);
        assertFalse(handler.analyzeFrame("frame-2"));

        now.set(1000);
        assertTrue(handler.analyzeFrame("frame-3"));
    }

    @Test
    void stopsAfterFirstResultWhenConfigured() throws Exception {
        when(recognizer.recognize(anyString())).thenReturn(PASSPORT_FRAME);
        newHandler(recognizer, new Configuration.Builder().setStopAfterFirstResult(true).build());

        handler.analyzeFrame("frame-1");
        handler.results().await(5, TimeUnit.SECONDS);
        awaitIdle(handler);

        assertFalse(handler.analyzeFrame("frame-2"));

        handler.reset();
        assertTrue(handler.analyzeFrame("frame-3"));
    }

    @Test
    void closedHandlerRejectsFrames() {
        newHandler(recognizer, Configuration.defaults());
        handler.close();

        assertFalse(handler.analyzeFrame("frame-1"));
        assertFalse(handler.isProcessing());
    }
}
