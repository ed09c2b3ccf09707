package com.scheduler.lifecycle.rest.dto;

import com.scheduler.lifecycle.analytics.ConcurrencyBucket;
import com.scheduler.lifecycle.analytics.ConcurrencySummary;

import java.util.List;

/**
 * Concurrency dashboard: window totals plus per-bucket aggregates.
 */
public record ConcurrencyDashboardResponse(
        ConcurrencySummary summary,
        int bucketMinutes,
        List<ConcurrencyBucket> buckets
) {
}
