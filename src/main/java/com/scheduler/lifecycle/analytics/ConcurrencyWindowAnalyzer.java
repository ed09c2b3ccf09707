package com.scheduler.lifecycle.analytics;

import com.scheduler.lifecycle.core.model.ExecutionInterval;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Computes peak concurrency and time-bucketed aggregates over execution intervals
 * with a sweep line.
 *
 * <p>Each execution contributes a +1 event at its start and a -1 event at its end;
 * executions still running contribute no end event. Events are swept in time order
 * and the peak is the maximum running sum. Instances are stateless and thread-safe.</p>
 */
public class ConcurrencyWindowAnalyzer {

    /**
     * Upper bound on the number of buckets a single call may produce.
     */
    public static final int MAX_BUCKETS = 2000;

    private record Event(Instant time, int delta) {
    }

    private final TieBreak tieBreak;
    private final Comparator<Event> order;

    public ConcurrencyWindowAnalyzer() {
        this(TieBreak.END_BEFORE_START);
    }

    public ConcurrencyWindowAnalyzer(TieBreak tieBreak) {
        this.tieBreak = Objects.requireNonNull(tieBreak, "tieBreak is required");
        Comparator<Event> byDelta = Comparator.comparingInt(Event::delta);
        this.order = Comparator.comparing(Event::time)
                .thenComparing(tieBreak == TieBreak.END_BEFORE_START ? byDelta : byDelta.reversed());
    }

    public TieBreak tieBreak() {
        return tieBreak;
    }

    /**
     * Returns the maximum number of executions running at the same instant; 0 for no executions.
     */
    public int peakConcurrent(Collection<ExecutionInterval> intervals) {
        List<Event> events = new ArrayList<>(intervals.size() * 2);
        for (ExecutionInterval interval : intervals) {
            events.add(new Event(interval.startTime(), 1));
            if (!interval.isOpen()) {
                events.add(new Event(interval.endTime(), -1));
            }
        }
        events.sort(order);

        int current = 0;
        int peak = 0;
        for (Event event : events) {
            current += event.delta();
            peak = Math.max(peak, current);
        }
        return peak;
    }

    /**
     * Splits {@code [windowStart, windowEnd)} into contiguous buckets of {@code bucketSize}
     * (the last one may be shorter) and aggregates each.
     * For the per-bucket peak, intervals are clipped to the bucket and executions still
     * running are treated as ending at {@code windowEnd}.
     *
     * @throws IllegalArgumentException if the window holds more than {@link #MAX_BUCKETS} buckets
     */
    public List<ConcurrencyBucket> buckets(Collection<ExecutionInterval> intervals,
                                           Instant windowStart, Instant windowEnd, Duration bucketSize) {
        Objects.requireNonNull(windowStart, "windowStart is required");
        Objects.requireNonNull(windowEnd, "windowEnd is required");
        if (!windowStart.isBefore(windowEnd)) {
            throw new IllegalArgumentException("windowStart must be before windowEnd");
        }
        if (bucketSize == null || bucketSize.isZero() || bucketSize.isNegative()) {
            throw new IllegalArgumentException("bucketSize must be positive");
        }
        long count = bucketCount(Duration.between(windowStart, windowEnd), bucketSize);
        if (count > MAX_BUCKETS) {
            throw new IllegalArgumentException("Window of " + Duration.between(windowStart, windowEnd)
                    + " split into " + bucketSize + " buckets gives " + count
                    + " buckets, more than " + MAX_BUCKETS);
        }

        List<ConcurrencyBucket> buckets = new ArrayList<>((int) count);
        for (Instant bucketStart = windowStart; bucketStart.isBefore(windowEnd); bucketStart = bucketStart.plus(bucketSize)) {
            Instant bucketEnd = min(bucketStart.plus(bucketSize), windowEnd);

            int started = 0;
            int finished = 0;
            long finishedMillis = 0;
            List<ExecutionInterval> clipped = new ArrayList<>();
            for (ExecutionInterval interval : intervals) {
                Instant start = interval.startTime();
                if (!start.isBefore(bucketStart) && start.isBefore(bucketEnd)) {
                    started++;
                    if (!interval.isOpen()) {
                        finished++;
                        finishedMillis += interval.duration().toMillis();
                    }
                }
                Instant clippedStart = max(start, bucketStart);
                Instant clippedEnd = min(interval.endOr(windowEnd), bucketEnd);
                if (clippedStart.isBefore(clippedEnd)) {
                    clipped.add(ExecutionInterval.closed(clippedStart, clippedEnd));
                }
            }

            double averageSeconds = finished > 0 ? finishedMillis / 1000.0 / finished : 0.0;
            buckets.add(new ConcurrencyBucket(bucketStart, started, averageSeconds, peakConcurrent(clipped)));
        }
        return buckets;
    }

    /**
     * Number of buckets, the last one possibly shorter, needed to cover {@code window}.
     */
    public static long bucketCount(Duration window, Duration bucketSize) {
        long whole = window.dividedBy(bucketSize);
        return window.equals(bucketSize.multipliedBy(whole)) ? whole : whole + 1;
    }

    /**
     * Totals for the given executions observed over {@code [windowStart, windowEnd)}.
     */
    public ConcurrencySummary summarize(Collection<ExecutionInterval> intervals, Instant windowStart, Instant windowEnd) {
        int running = 0;
        int finished = 0;
        long finishedMillis = 0;
        for (ExecutionInterval interval : intervals) {
            if (interval.isOpen()) {
                running++;
            } else {
                finished++;
                finishedMillis += interval.duration().toMillis();
            }
        }
        double averageSeconds = finished > 0 ? finishedMillis / 1000.0 / finished : 0.0;
        return new ConcurrencySummary(windowStart, windowEnd, intervals.size(), running,
                peakConcurrent(intervals), averageSeconds);
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
