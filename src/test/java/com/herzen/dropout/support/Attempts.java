package com.herzen.dropout.support;

import com.herzen.dropout.event.EventModels.Attempt;
import com.herzen.dropout.event.EventModels.AttemptHistory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Builds attempt histories with explicit offsets from a base instant. */
public class Attempts {
    public static final Instant BASE = Instant.parse("2024-03-04T10:00:00Z");

    private final String studentId;
    private final String questionId;
    private final List<Attempt> attempts = new ArrayList<>();

    private Attempts(String studentId, String questionId) {
        this.studentId = studentId;
        this.questionId = questionId;
    }

    public static Attempts of(String studentId, String questionId) {
        return new Attempts(studentId, questionId);
    }

    public Attempts add(String answer, boolean correct, long offsetSeconds) {
        return add(answer, correct, offsetSeconds, 60);
    }

    public Attempts add(String answer, boolean correct, long offsetSeconds, double timeSpentSeconds) {
        attempts.add(new Attempt(attempts.size() + 1, answer, correct, BASE.plusSeconds(offsetSeconds), timeSpentSeconds));
        return this;
    }

    public AttemptHistory build() {
        return new AttemptHistory(studentId, questionId, attempts);
    }
}
