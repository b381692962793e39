package com.ganesh.keep;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe counters describing what an engine instance has done.
 * Uses LongAdder so that hot paths never contend on a shared counter.
 */
public class KeepMetrics {
    public final LongAdder reads = new LongAdder();
    public final LongAdder writes = new LongAdder();
    public final LongAdder removes = new LongAdder();
    public final LongAdder consolidatedFlushes = new LongAdder();
    public final LongAdder recordFileWrites = new LongAdder();
    public final LongAdder superseded = new LongAdder();
    public final LongAdder corruptRecordsDropped = new LongAdder();
    public final LongAdder errorsReported = new LongAdder();

    private final LongAdder totalFlushNanos = new LongAdder();

    /**
     * Records how long one consolidated-file save took, encode included.
     * @param nanos The duration of the save in nanoseconds.
     */
    public void recordFlushLatency(long nanos) {
        totalFlushNanos.add(nanos);
        consolidatedFlushes.increment();
    }

    /**
     * @return The average consolidated save time in ms, or 0 if nothing was saved yet.
     */
    public double getAverageFlushLatencyMs() {
        long flushes = consolidatedFlushes.sum();
        if (flushes == 0) return 0.0;
        return (totalFlushNanos.sum() / (double) flushes) / 1_000_000.0;
    }

    /**
     * Generates a human-readable summary of all collected metrics.
     * @return A string containing the metrics summary.
     */
    public String getSummary() {
        return String.format(
            "--- Keep Metrics ---\n" +
            "Operations -> Reads: %,d | Writes: %,d | Removes: %,d\n" +
            "Disk       -> Consolidated Flushes: %,d (avg %.3f ms) | Record File Writes: %,d\n" +
            "Queue      -> Superseded: %,d\n" +
            "Health     -> Corrupt Records Dropped: %,d | Errors Reported: %,d\n" +
            "--------------------",
            reads.sum(), writes.sum(), removes.sum(),
            consolidatedFlushes.sum(), getAverageFlushLatencyMs(), recordFileWrites.sum(),
            superseded.sum(),
            corruptRecordsDropped.sum(), errorsReported.sum()
        );
    }
}
