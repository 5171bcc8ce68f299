package com.lob.common;

import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interval latency tracking on an HdrHistogram {@link Recorder}.
 *
 * Values are recorded in nanos from any number of threads. Each {@link #sample()}
 * swaps in a fresh interval, so a summary covers only what was recorded since the
 * previous one.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private static final long MAX_TRACKABLE_NANOS = 10_000_000_000L;

    private final String name;
    private final Recorder recorder = new Recorder(MAX_TRACKABLE_NANOS, 3);
    private Histogram interval;

    public LatencyStats(String name) {
        this.name = name;
    }

    public void record(long latencyNanos) {
        recorder.recordValue(Math.min(Math.max(latencyNanos, 0L), MAX_TRACKABLE_NANOS));
    }

    /** Close the current interval and summarise it. */
    public synchronized Summary sample() {
        interval = recorder.getIntervalHistogram(interval);
        return new Summary(name, interval.getTotalCount(),
                micros(interval.getValueAtPercentile(50)),
                micros(interval.getValueAtPercentile(99)),
                micros(interval.getValueAtPercentile(99.9)),
                micros(interval.getMaxValue()));
    }

    /** Sample and log at INFO; empty intervals are skipped. */
    public Summary logAndReset() {
        Summary s = sample();
        if (s.count() > 0 && log.isInfoEnabled()) {
            log.info(s.toString());
        }
        return s;
    }

    private static double micros(long nanos) {
        return nanos / 1_000.0;
    }

    public record Summary(String name, long count, double p50Micros, double p99Micros,
                          double p999Micros, double maxMicros) {
        @Override
        public String toString() {
            return String.format("[metrics] %s count=%d p50=%.1fus p99=%.1fus p999=%.1fus max=%.1fus",
                    name, count, p50Micros, p99Micros, p999Micros, maxMicros);
        }
    }
}
