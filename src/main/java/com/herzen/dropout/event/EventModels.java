package com.herzen.dropout.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class EventModels {
    public record LearningEvent(String eventId,
                                String eventType,
                                String studentId,
                                String questionId,
                                Instant timestamp,
                                Map<String, Object> payload) {
        public LearningEvent {
            if (studentId == null || studentId.isBlank() || questionId == null || questionId.isBlank()) {
                throw new IllegalArgumentException("studentId and questionId are required");
            }
            payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }

        public EventKey key() {
            return new EventKey(studentId, questionId);
        }

        public String text(String field) {
            Object value = payload.get(field);
            return value == null ? null : value.toString();
        }

        public boolean flag(String field) {
            Object value = payload.get(field);
            if (value instanceof Boolean b) return b;
            return value != null && Boolean.parseBoolean(value.toString());
        }

        public double number(String field) {
            Object value = payload.get(field);
            if (value instanceof Number n) return n.doubleValue();
            if (value == null) return 0.0;
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
    }

    public record EventKey(String studentId, String questionId) {
        @Override
        public String toString() {
            return studentId + ":" + questionId;
        }
    }

    public record Attempt(int attemptNumber, String answer, boolean correct, Instant timestamp, double timeSpentSeconds) {}

    public record AttemptHistory(String studentId, String questionId, List<Attempt> attempts) {
        public AttemptHistory {
            attempts = List.copyOf(attempts);
        }

        public int attemptCount() {
            return attempts.size();
        }

        public long correctCount() {
            return attempts.stream().filter(Attempt::correct).count();
        }

        public double correctnessRatio() {
            return attempts.isEmpty() ? 0.0 : (double) correctCount() / attempts.size();
        }

        public boolean correctOnFirstAttempt() {
            return attempts.size() == 1 && attempts.get(0).correct();
        }
    }

    public static final class Payload {
        public static final String QUESTION_CONTENT = "question_content";
        public static final String ANSWER = "answer";
        public static final String CORRECT = "is_correct";
        public static final String TIME_SPENT_SECONDS = "time_spent_seconds";
        public static final String ORIGINAL_ANSWER = "original_answer";
        public static final String REVISED_ANSWER = "revised_answer";
        public static final String REVISION_REASON = "revision_reason";
        public static final String NAV_TYPE = "nav_type";
        public static final String DESTINATION_QUESTION_ID = "destination_question_id";
        public static final String IDLE_DURATION_SECONDS = "idle_duration_seconds";
        public static final String HINT_LEVEL = "hint_level";

        private Payload() {}
    }
}
