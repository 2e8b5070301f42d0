package com.herzen.dropout.event;

import com.herzen.dropout.config.DropoutProperties;
import com.herzen.dropout.event.EventModels.Attempt;
import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.event.EventModels.EventKey;
import com.herzen.dropout.event.EventModels.LearningEvent;
import com.herzen.dropout.event.EventModels.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, time-ordered log of learning events.
 *
 * <p>Timestamps are assigned from the injected clock while the write lock is held, so the ordering
 * check and the indexed append happen atomically. Reads return snapshots.
 */
@Component
public class EventCollector {
    private static final Logger log = LoggerFactory.getLogger(EventCollector.class);

    private final Clock clock;
    private final OrderingScope orderingScope;

    private final List<LearningEvent> events = new ArrayList<>();
    private final Map<String, List<LearningEvent>> byStudent = new HashMap<>();
    private final Map<String, List<LearningEvent>> byQuestion = new HashMap<>();
    private final Map<EventKey, List<LearningEvent>> byKey = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Instant lastTimestamp;

    public EventCollector(Clock clock, DropoutProperties properties) {
        this.clock = clock;
        this.orderingScope = properties.getEvents().getOrderingScope();
    }

    public LearningEvent recordEvent(String eventType, String studentId, String questionId, Map<String, Object> payload) {
        if (eventType == null || !LearningEventTypes.SUPPORTED.contains(eventType)) {
            throw new IllegalArgumentException("Unsupported event type: " + eventType);
        }
        if (studentId == null || studentId.isBlank() || questionId == null || questionId.isBlank()) {
            throw new IllegalArgumentException("studentId and questionId are required");
        }
        lock.writeLock().lock();
        try {
            Instant timestamp = clock.instant();
            Instant previous = previousTimestamp(new EventKey(studentId, questionId));
            if (previous != null && timestamp.isBefore(previous)) {
                log.warn("Rejected {} for {}:{}: {} is before {}", eventType, studentId, questionId, timestamp, previous);
                throw new OrderingViolationException(timestamp, previous, orderingScope);
            }

            LearningEvent event = new LearningEvent(UUID.randomUUID().toString(), eventType, studentId, questionId, timestamp, payload);
            events.add(event);
            byStudent.computeIfAbsent(studentId, k -> new ArrayList<>()).add(event);
            byQuestion.computeIfAbsent(questionId, k -> new ArrayList<>()).add(event);
            byKey.computeIfAbsent(event.key(), k -> new ArrayList<>()).add(event);
            lastTimestamp = timestamp;

            log.debug("Recorded {} for {} at {}", eventType, event.key(), timestamp);
            return event;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public LearningEvent recordQuestionStart(String studentId, String questionId, String questionContent) {
        return recordEvent(LearningEventTypes.QUESTION_START, studentId, questionId,
                payload(Payload.QUESTION_CONTENT, questionContent));
    }

    public LearningEvent recordQuestionSubmit(String studentId, String questionId, String answer,
                                              boolean correct, double timeSpentSeconds) {
        return recordEvent(LearningEventTypes.QUESTION_SUBMIT, studentId, questionId,
                payload(Payload.ANSWER, answer, Payload.CORRECT, correct, Payload.TIME_SPENT_SECONDS, timeSpentSeconds));
    }

    public LearningEvent recordAnswerRevision(String studentId, String questionId, String originalAnswer,
                                              String revisedAnswer, String revisionReason) {
        return recordEvent(LearningEventTypes.ANSWER_REVISION, studentId, questionId,
                payload(Payload.ORIGINAL_ANSWER, originalAnswer, Payload.REVISED_ANSWER, revisedAnswer,
                        Payload.REVISION_REASON, revisionReason));
    }

    public LearningEvent recordNavigation(String studentId, String questionId, String navType, String destinationQuestionId) {
        return recordEvent(LearningEventTypes.NAVIGATION, studentId, questionId,
                payload(Payload.NAV_TYPE, navType, Payload.DESTINATION_QUESTION_ID, destinationQuestionId));
    }

    public LearningEvent recordFocusLoss(String studentId, String questionId, double idleDurationSeconds) {
        return recordEvent(LearningEventTypes.FOCUS_BLUR, studentId, questionId,
                payload(Payload.IDLE_DURATION_SECONDS, idleDurationSeconds));
    }

    public LearningEvent recordFocusGain(String studentId, String questionId) {
        return recordEvent(LearningEventTypes.FOCUS_GAIN, studentId, questionId, Map.of());
    }

    public LearningEvent recordHintRequest(String studentId, String questionId, int hintLevel) {
        return recordEvent(LearningEventTypes.HINT_REQUEST, studentId, questionId,
                payload(Payload.HINT_LEVEL, hintLevel));
    }

    public LearningEvent recordSessionStart(String studentId) {
        return recordSessionStart(studentId, LearningEventTypes.SESSION_QUESTION);
    }

    public LearningEvent recordSessionStart(String studentId, String questionId) {
        return recordEvent(LearningEventTypes.SESSION_START, studentId, questionId, Map.of());
    }

    public LearningEvent recordSessionEnd(String studentId) {
        return recordSessionEnd(studentId, LearningEventTypes.SESSION_QUESTION);
    }

    public LearningEvent recordSessionEnd(String studentId, String questionId) {
        return recordEvent(LearningEventTypes.SESSION_END, studentId, questionId, Map.of());
    }

    public List<LearningEvent> eventsFor(String studentId, String questionId) {
        return read(() -> byKey.getOrDefault(new EventKey(studentId, questionId), List.of()));
    }

    public List<LearningEvent> eventsForStudent(String studentId) {
        return read(() -> byStudent.getOrDefault(studentId, List.of()));
    }

    public List<LearningEvent> eventsForQuestion(String questionId) {
        return read(() -> byQuestion.getOrDefault(questionId, List.of()));
    }

    public List<LearningEvent> eventsByType(String eventType) {
        return read(() -> events.stream().filter(e -> e.eventType().equals(eventType)).toList());
    }

    public List<LearningEvent> allEvents() {
        return read(() -> events);
    }

    public int eventCount() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Questions the student has events on, in order of first appearance, session events excluded. */
    public List<String> questionsForStudent(String studentId) {
        return eventsForStudent(studentId).stream()
                .map(LearningEvent::questionId)
                .filter(q -> !LearningEventTypes.SESSION_QUESTION.equals(q))
                .distinct()
                .toList();
    }

    public AttemptHistory buildAttemptHistory(String studentId, String questionId) {
        List<Attempt> attempts = new ArrayList<>();
        for (LearningEvent e : eventsFor(studentId, questionId)) {
            if (!LearningEventTypes.QUESTION_SUBMIT.equals(e.eventType())) continue;
            String answer = Optional.ofNullable(e.text(Payload.ANSWER)).orElse("");
            attempts.add(new Attempt(attempts.size() + 1, answer, e.flag(Payload.CORRECT), e.timestamp(),
                    e.number(Payload.TIME_SPENT_SECONDS)));
        }
        return new AttemptHistory(studentId, questionId, attempts);
    }

    private Instant previousTimestamp(EventKey key) {
        if (orderingScope == OrderingScope.GLOBAL) {
            return lastTimestamp;
        }
        List<LearningEvent> keyed = byKey.get(key);
        return keyed == null || keyed.isEmpty() ? null : keyed.get(keyed.size() - 1).timestamp();
    }

    private List<LearningEvent> read(java.util.function.Supplier<List<LearningEvent>> source) {
        lock.readLock().lock();
        try {
            return List.copyOf(source.get());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            out.put((String) keyValues[i], keyValues[i + 1]);
        }
        return out;
    }
}
