package com.containermgmt.querymonitor.collector;

import com.containermgmt.querymonitor.dto.DiscoveredQuery;
import com.containermgmt.querymonitor.dto.QueryInstanceView;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Folds the literal instances of a normalized query into one set of numbers.
 *
 * meanTime is totalTime / callCount over all instances (0 without calls),
 * not the average of the per-instance means.
 */
public final class QueryAggregator {

    private QueryAggregator() {
    }

    public static DiscoveredQuery aggregate(DiscoveredQuery query, List<QueryInstanceView> instances) {
        if (instances == null || instances.isEmpty()) {
            return query.toBuilder()
                .instanceCount(0)
                .callCount(0)
                .totalTime(0)
                .minTime(0)
                .maxTime(0)
                .meanTime(0)
                .sampleQueryText(null)
                .build();
        }

        long calls = 0;
        double total = 0;
        double min = Double.MAX_VALUE;
        double max = 0;
        for (QueryInstanceView instance : instances) {
            calls += instance.getCalls();
            total += instance.getTotalTime();
            min = Math.min(min, instance.getMinTime());
            max = Math.max(max, instance.getMaxTime());
        }

        String sample = instances.stream()
            .max(Comparator.comparing(QueryInstanceView::getLastUpdatedAt,
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
            .map(QueryInstanceView::getQueryText)
            .orElse(null);

        return query.toBuilder()
            .instanceCount(instances.size())
            .callCount(calls)
            .totalTime(total)
            .minTime(min)
            .maxTime(max)
            .meanTime(calls > 0 ? total / calls : 0)
            .sampleQueryText(sample)
            .build();
    }
}
