package com.herzen.dropout.features;

import com.herzen.dropout.event.EventCollector;
import com.herzen.dropout.event.EventModels.Attempt;
import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.features.CompetitionContextProvider.RankSnapshot;
import com.herzen.dropout.features.SignalModels.*;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Projects the event log of one (student, question) key into the signal categories.
 * Reasoning and intervention response are left as placeholders for their collaborators.
 */
@Service
public class FeatureExtractor {
    private final EventCollector collector;
    private final CompetitionContextProvider competitionContext;
    private final Clock clock;

    public FeatureExtractor(EventCollector collector, CompetitionContextProvider competitionContext, Clock clock) {
        this.collector = collector;
        this.competitionContext = competitionContext;
        this.clock = clock;
    }

    public ComprehensiveFeatureSet extract(String studentId, String questionId) {
        return extract(collector.buildAttemptHistory(studentId, questionId));
    }

    public ComprehensiveFeatureSet extract(AttemptHistory history) {
        Optional<RankSnapshot> ranks = competitionContext.ranksFor(history.studentId());
        return extract(history, ranks.orElse(null));
    }

    public ComprehensiveFeatureSet extract(AttemptHistory history, RankSnapshot ranks) {
        return new ComprehensiveFeatureSet(
                history.studentId(),
                history.questionId(),
                clock.instant(),
                learningProgress(history),
                stagnation(history),
                integrity(history),
                ReasoningInsight.pending(),
                competition(history, ranks),
                behavioral(history),
                InterventionResponseSignals.none()
        );
    }

    LearningProgressSignals learningProgress(AttemptHistory history) {
        int count = history.attemptCount();
        if (count == 0) return LearningProgressSignals.empty();

        List<Attempt> attempts = history.attempts();
        double frequency = 0.0;
        if (count >= 2) {
            double minutes = minutesBetween(attempts.get(0), attempts.get(count - 1));
            frequency = count / Math.max(minutes, 1.0);
        }

        List<Double> timeSpent = attempts.stream().map(Attempt::timeSpentSeconds).toList();

        double improvement;
        if (count > 1) {
            List<Double> correctness = correctness(history);
            double early = mean(correctness.subList(0, count / 2));
            double late = mean(correctness.subList(count / 2, count));
            improvement = Math.max(0.0, late - early) * 100;
        } else {
            improvement = attempts.get(0).correct() ? 100.0 : 0.0;
        }

        List<ChangeType> changes = changeTypes(attempts);
        double semantic = changes.isEmpty() ? 0.0
                : changes.stream().filter(c -> c != ChangeType.SUPERFICIAL).count() * 100.0 / changes.size();

        return new LearningProgressSignals(
                count,
                frequency,
                timeSpent,
                clamp(improvement, 0, 100),
                changes,
                clamp(semantic, 0, 100),
                semantic < 30 && count >= 3,
                learningState(improvement, count)
        );
    }

    StagnationSignals stagnation(AttemptHistory history) {
        int count = history.attemptCount();
        if (count == 0) return StagnationSignals.empty();

        List<Attempt> attempts = history.attempts();
        double duration = count > 1 ? minutesBetween(attempts.get(0), attempts.get(count - 1)) : 0.0;
        boolean stalled = count >= 3 && duration >= 15 && history.correctnessRatio() < 0.5;
        double severity = Math.min(100.0, count * 20 + duration / 5);

        return new StagnationSignals(duration, count, Math.max(0, count - 1), stalled, severity);
    }

    IntegritySignals integrity(AttemptHistory history) {
        if (history.attemptCount() == 0) return IntegritySignals.empty();

        List<Double> correctness = correctness(history);
        boolean suddenJump = false;
        for (int i = 1; i < correctness.size(); i++) {
            if (correctness.get(i) > correctness.get(i - 1) + 0.5) {
                suddenJump = true;
                break;
            }
        }

        ReasoningContinuity continuity = ReasoningContinuity.HIGH;
        double assistance = 0.1;
        List<Double> lengths = history.attempts().stream().map(a -> (double) a.answer().length()).toList();
        if (lengths.size() > 1) {
            double variance = sampleVariance(lengths);
            double avg = mean(lengths);
            if (variance > avg * 2 && suddenJump) {
                continuity = ReasoningContinuity.LOW;
                assistance = 0.6;
            } else if (variance > avg) {
                continuity = ReasoningContinuity.MEDIUM;
                assistance = 0.3;
            }
        }

        double score = 100.0;
        if (suddenJump) score -= 20;
        if (assistance > 0.5) score -= 15;

        return new IntegritySignals(Math.max(0.0, score), continuity, suddenJump, assistance);
    }

    CompetitionSignals competition(AttemptHistory history, RankSnapshot ranks) {
        Integer latest = ranks == null ? null : ranks.latestRank();
        Integer previous = ranks == null ? null : ranks.previousRank();
        Integer delta = latest != null && previous != null ? latest - previous : null;
        double relativeProgress = history.correctnessRatio() * 100;
        boolean pressure = (delta != null && delta > 0) || relativeProgress < 30;
        return new CompetitionSignals(latest, previous, delta, relativeProgress, pressure);
    }

    BehavioralDisengagementSignals behavioral(AttemptHistory history) {
        if (history.attemptCount() == 0) return BehavioralDisengagementSignals.empty();

        List<Attempt> attempts = history.attempts();
        List<Double> gaps = new ArrayList<>();
        for (int i = 1; i < attempts.size(); i++) {
            gaps.add(Duration.between(attempts.get(i - 1).timestamp(), attempts.get(i).timestamp()).toMillis() / 1000.0);
        }

        Map<LocalDate, Integer> perDay = new LinkedHashMap<>();
        attempts.forEach(a -> perDay.merge(LocalDate.ofInstant(a.timestamp(), ZoneOffset.UTC), 1, Integer::sum));

        double consistency = gaps.isEmpty() ? 100.0 : 100.0 - mean(gaps) / 60.0;

        boolean gapIncreasing = false;
        if (gaps.size() > 1) {
            double firstHalf = mean(gaps.subList(0, gaps.size() / 2));
            double secondHalf = mean(gaps.subList(gaps.size() / 2, gaps.size()));
            gapIncreasing = secondHalf > firstHalf * 1.2;
        }

        return new BehavioralDisengagementSignals(List.copyOf(gaps), List.copyOf(perDay.values()),
                clamp(consistency, 0, 100), gapIncreasing);
    }

    private List<ChangeType> changeTypes(List<Attempt> attempts) {
        List<ChangeType> out = new ArrayList<>();
        for (int i = 1; i < attempts.size(); i++) {
            Attempt prev = attempts.get(i - 1);
            Attempt curr = attempts.get(i);
            if (normalize(prev.answer()).equals(normalize(curr.answer()))) {
                out.add(ChangeType.SUPERFICIAL);
            } else if (curr.correct()) {
                out.add(ChangeType.CORRECTIVE);
            } else {
                out.add(ChangeType.STRUCTURAL);
            }
        }
        return out;
    }

    private LearningState learningState(double improvement, int attemptCount) {
        if (improvement > 60 && attemptCount <= 3) return LearningState.PROGRESSING;
        if (attemptCount > 5 && improvement < 30) return LearningState.STALLED;
        return LearningState.PLATEAU;
    }

    static String normalize(String answer) {
        return answer == null ? "" : answer.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    private static List<Double> correctness(AttemptHistory history) {
        return history.attempts().stream().map(a -> a.correct() ? 1.0 : 0.0).toList();
    }

    private static double minutesBetween(Attempt first, Attempt last) {
        return Duration.between(first.timestamp(), last.timestamp()).toMillis() / 60_000.0;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double sampleVariance(List<Double> values) {
        if (values.size() < 2) return 0.0;
        double avg = mean(values);
        double sum = values.stream().mapToDouble(v -> (v - avg) * (v - avg)).sum();
        return sum / (values.size() - 1);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
