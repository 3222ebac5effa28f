package com.example.idreader.detection;

import com.example.idreader.Configuration;
import com.example.idreader.ocr.OcrLine;
import com.example.idreader.ocr.TextRecognizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Frame pump between the camera and MRZ extraction.
 *
 * <p>Frames are recognized one at a time on a dedicated worker thread. A frame that arrives
 * while another is still being recognized is dropped, never queued. Accepted results go to
 * {@link #results()}, and a result identical to the previous one is not published again.</p>
 *
 * @param <F> frame type handed to the {@link TextRecognizer}
 */
public class MrzDetectionHandler<F> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MrzDetectionHandler.class);

    private final TextRecognizer<F> recognizer;
    private final MrzProcessor mrzProcessor;
    private final Configuration config;
    private final LongSupplier clock;

    private final ExecutorService worker;
    private final ScanDeduplicator deduplicator = new ScanDeduplicator();
    private final ScanResultChannel results = new ScanResultChannel();

    private final AtomicBoolean isProcessing = new AtomicBoolean(false);
    private final AtomicLong lastProcessTime = new AtomicLong(Long.MIN_VALUE);
    private volatile boolean hasScanned = false;
    private final AtomicInteger frameCount = new AtomicInteger();

    public MrzDetectionHandler(TextRecognizer<F> recognizer, Configuration config) {
        this(recognizer, new MrzProcessor(), config, System::currentTimeMillis);
    }

    public MrzDetectionHandler(TextRecognizer<F> recognizer, MrzProcessor mrzProcessor,
                               Configuration config, LongSupplier clock) {
        this.recognizer = recognizer;
        this.mrzProcessor = mrzProcessor;
        this.config = config;
        this.clock = clock;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mrz-ocr-worker");
            thread.setDaemon(true);
            return thread;
        });
        log.info("MrzDetectionHandler initialized (interval={}ms, floor={})",
                config.getProcessIntervalMs(), config.getConfidenceFloor());
    }

    /**
     * Offer a camera frame.
     *
     * @return true if the frame was admitted for recognition, false if it was dropped
     */
    public boolean analyzeFrame(F frame) {
        if (config.isStopAfterFirstResult() && hasScanned) {
            return false;
        }

        long now = clock.getAsLong();
        if (!intervalElapsed(now)) {
            return false;
        }

        if (!isProcessing.compareAndSet(false, true)) {
            log.debug("⏳ Recognition in flight, frame dropped");
            return false;
        }

        lastProcessTime.set(now);
        int frameNumber = frameCount.incrementAndGet();

        try {
            worker.execute(() -> processFrame(frame, frameNumber));
        } catch (RejectedExecutionException e) {
            log.warn("Worker rejected frame #{}, handler is closed", frameNumber);
            isProcessing.set(false);
            return false;
        }
        return true;
    }

    private boolean intervalElapsed(long now) {
        long last = lastProcessTime.get();
        return last == Long.MIN_VALUE || now - last >= config.getProcessIntervalMs();
    }

    private void processFrame(F frame, int frameNumber) {
        try {
            log.debug("📸 Frame #{} - Starting recognition", frameNumber);
            List<OcrLine> recognized = recognizer.recognize(frame);
            List<String> lines = OcrLine.texts(recognized, config.getConfidenceFloor());

            mrzProcessor.process(lines).ifPresent(this::publish);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Recognition of frame #{} interrupted", frameNumber);
        } catch (Exception e) {
            log.warn("❌ Recognition of frame #{} failed", frameNumber, e);
        } finally {
            isProcessing.set(false);
        }
    }

    private void publish(ScanResult result) {
        if (!deduplicator.accept(result)) {
            log.debug("Same MRZ and CAN as last result, not published");
            return;
        }
        hasScanned = true;
        log.debug("✅ Publishing {}", result);
        results.offer(result);
    }

    public ScanResultChannel results() {
        return results;
    }

    public boolean isProcessing() {
        return isProcessing.get();
    }

    /** Frames admitted for recognition since construction. */
    public int getFrameCount() {
        return frameCount.get();
    }

    public boolean hasScanned() {
        return hasScanned;
    }

    /**
     * Start a new scanning session: forget the last result and drop any pending one.
     */
    public void reset() {
        deduplicator.reset();
        results.clear();
        hasScanned = false;
    }

    @Override
    public void close() {
        worker.shutdownNow();
        log.info("MrzDetectionHandler closed after {} frames", frameCount.get());
    }
}
