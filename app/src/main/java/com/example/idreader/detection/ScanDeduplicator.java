package com.example.idreader.detection;

/**
 * Remembers the last accepted scan and rejects an identical one arriving right after it.
 */
public class ScanDeduplicator {

    private ScanResult last;

    /**
     * @return true if the result differs from the previously accepted one, which it then replaces
     */
    public synchronized boolean accept(ScanResult result) {
        if (result.isSameScan(last)) {
            return false;
        }
        last = result;
        return true;
    }

    public synchronized void reset() {
        last = null;
    }
}
