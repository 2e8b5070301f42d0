package com.herzen.dropout.intervention;

import com.herzen.dropout.classification.ClassificationModels.InterventionType;
import com.herzen.dropout.event.EventModels.Attempt;
import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.event.EventModels.EventKey;
import com.herzen.dropout.features.SignalModels.InterventionResponseSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Remembers interventions per (student, question) and measures how attempts changed after the latest one. */
@Component
public class InterventionTracker {
    private static final Logger log = LoggerFactory.getLogger(InterventionTracker.class);

    private final Clock clock;
    private final Map<EventKey, List<InterventionRecord>> interventions = new ConcurrentHashMap<>();

    public InterventionTracker(Clock clock) {
        this.clock = clock;
    }

    public InterventionRecord flag(String studentId, String questionId, InterventionType type, String notes) {
        if (type == null) throw new IllegalArgumentException("intervention type is required");
        EventKey key = new EventKey(studentId, questionId);
        InterventionRecord record = new InterventionRecord(studentId, questionId, type, notes == null ? "" : notes, clock.instant());
        interventions.compute(key, (k, list) -> {
            List<InterventionRecord> next = list == null ? new ArrayList<>() : new ArrayList<>(list);
            next.add(record);
            return List.copyOf(next);
        });
        log.info("Intervention {} flagged for {} at {}", type, key, record.timestamp());
        return record;
    }

    public List<InterventionRecord> history(String studentId, String questionId) {
        return interventions.getOrDefault(new EventKey(studentId, questionId), List.of());
    }

    public InterventionResponseSignals responseFor(AttemptHistory history) {
        List<InterventionRecord> records = history(history.studentId(), history.questionId());
        if (records.isEmpty()) return InterventionResponseSignals.none();

        InterventionRecord latest = records.get(records.size() - 1);
        List<Attempt> before = history.attempts().stream().filter(a -> !a.timestamp().isAfter(latest.timestamp())).toList();
        List<Attempt> after = history.attempts().stream().filter(a -> a.timestamp().isAfter(latest.timestamp())).toList();

        double pre = percentCorrect(before);
        double post = percentCorrect(after);
        return new InterventionResponseSignals(
                true,
                latest.type().name(),
                latest.timestamp(),
                post,
                Math.max(0.0, post - pre),
                !after.isEmpty() && post >= 50
        );
    }

    private static double percentCorrect(List<Attempt> attempts) {
        if (attempts.isEmpty()) return 0.0;
        return attempts.stream().filter(Attempt::correct).count() * 100.0 / attempts.size();
    }

    public record InterventionRecord(String studentId, String questionId, InterventionType type, String notes, Instant timestamp) {}
}
