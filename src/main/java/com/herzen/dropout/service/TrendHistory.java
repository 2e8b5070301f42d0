package com.herzen.dropout.service;

import com.herzen.dropout.classification.ClassificationModels.DropoutType;
import com.herzen.dropout.event.EventModels.EventKey;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Per-key record of earlier analyses; appends for one key are serialized through {@code compute}. */
@Component
public class TrendHistory {
    private final Map<EventKey, List<TrendPoint>> points = new ConcurrentHashMap<>();

    public void append(EventKey key, TrendPoint point) {
        points.compute(key, (k, list) -> {
            List<TrendPoint> next = list == null ? new ArrayList<>() : new ArrayList<>(list);
            next.add(point);
            return List.copyOf(next);
        });
    }

    public List<TrendPoint> pointsFor(EventKey key) {
        return points.getOrDefault(key, List.of());
    }

    public List<Double> lmiValues(EventKey key) {
        return pointsFor(key).stream().map(TrendPoint::lmi).toList();
    }

    public record TrendPoint(Instant asOf, double lmi, double drs, boolean dropoutDetected, List<DropoutType> dropoutTypes) {}
}
