package com.herzen.dropout.features;

import com.herzen.dropout.config.DropoutProperties;
import com.herzen.dropout.event.EventCollector;
import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.features.CompetitionContextProvider.RankSnapshot;
import com.herzen.dropout.features.SignalModels.*;
import com.herzen.dropout.support.Attempts;
import com.herzen.dropout.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {
    private final MutableClock clock = MutableClock.startingAt("2024-03-04T12:00:00Z");
    private final EventCollector collector = new EventCollector(clock, new DropoutProperties());
    private final InMemoryCompetitionContextProvider ranks = new InMemoryCompetitionContextProvider();
    private final FeatureExtractor extractor = new FeatureExtractor(collector, ranks, clock);

    @Test
    void improvementComparesSecondHalfAgainstFirstHalf() {
        AttemptHistory history = Attempts.of("s1", "q1")
                .add("1", false, 0)
                .add("2", false, 60)
                .add("3", true, 120)
                .add("3 ", true, 180)
                .build();

        LearningProgressSignals p = extractor.learningProgress(history);
        assertEquals(4, p.attemptCount());
        assertEquals(100.0, p.improvementScore(), 1e-9);
        assertEquals(4.0 / 3.0, p.attemptFrequency(), 1e-9);
        assertEquals(List.of(ChangeType.STRUCTURAL, ChangeType.CORRECTIVE, ChangeType.SUPERFICIAL), p.changeTypes());
        assertEquals(200.0 / 3.0, p.semanticChangeScore(), 1e-9);
        assertEquals(LearningState.PLATEAU, p.learningState());
        assertFalse(p.noProgressFlag());
    }

    @Test
    void singleCorrectAttemptIsProgressing() {
        LearningProgressSignals p = extractor.learningProgress(Attempts.of("s1", "q1").add("42", true, 0, 45).build());
        assertEquals(100.0, p.improvementScore());
        assertEquals(0.0, p.attemptFrequency());
        assertEquals(0.0, p.semanticChangeScore());
        assertEquals(List.of(45.0), p.timeSpentPerAttempt());
        assertEquals(LearningState.PROGRESSING, p.learningState());
    }

    @Test
    void whitespaceAndCaseOnlyEditsAreSuperficial() {
        LearningProgressSignals p = extractor.learningProgress(Attempts.of("s1", "q1")
                .add("x = 1", false, 0)
                .add("x=1", false, 30)
                .add("X = 1", false, 60)
                .build());
        assertEquals(List.of(ChangeType.SUPERFICIAL, ChangeType.SUPERFICIAL), p.changeTypes());
        assertEquals(0.0, p.semanticChangeScore());
        assertTrue(p.noProgressFlag());
    }

    @Test
    void manyAttemptsWithoutImprovementAreStalled() {
        Attempts attempts = Attempts.of("s1", "q1");
        for (int i = 0; i < 6; i++) {
            attempts.add("answer " + i, false, i * 30L);
        }
        assertEquals(LearningState.STALLED, extractor.learningProgress(attempts.build()).learningState());
    }

    @Test
    void stagnationNeedsThreeAttemptsFifteenMinutesAndLowCorrectness() {
        AttemptHistory history = Attempts.of("s1", "q1")
                .add("a", false, 0)
                .add("b", false, 600)
                .add("c", false, 1200)
                .build();

        StagnationSignals s = extractor.stagnation(history);
        assertEquals(20.0, s.stagnationDurationMinutes(), 1e-9);
        assertEquals(3, s.repeatAttemptCount());
        assertEquals(2.0, s.conceptRevisitFrequency());
        assertTrue(s.stalled());
        assertEquals(64.0, s.stagnationSeverity(), 1e-9);

        AttemptHistory quick = Attempts.of("s1", "q1").add("a", false, 0).add("b", false, 60).add("c", false, 120).build();
        assertFalse(extractor.stagnation(quick).stalled());
    }

    @Test
    void suddenJumpWithErraticLengthsLowersIntegrity() {
        IntegritySignals i = extractor.integrity(Attempts.of("s1", "q1")
                .add("1", false, 0)
                .add("1", false, 60)
                .add("a much longer answer that is correct", true, 120)
                .build());
        assertTrue(i.suddenJumpFlag());
        assertEquals(ReasoningContinuity.LOW, i.reasoningContinuity());
        assertEquals(0.6, i.externalAssistanceLikelihood());
        assertEquals(65.0, i.integrityScore());
    }

    @Test
    void varyingLengthsWithoutJumpIsMediumContinuity() {
        IntegritySignals i = extractor.integrity(Attempts.of("s1", "q1")
                .add("1", false, 0)
                .add("1234567890", false, 60)
                .build());
        assertFalse(i.suddenJumpFlag());
        assertEquals(ReasoningContinuity.MEDIUM, i.reasoningContinuity());
        assertEquals(0.3, i.externalAssistanceLikelihood());
        assertEquals(100.0, i.integrityScore());

        assertEquals(0.1, extractor.integrity(Attempts.of("s1", "q1").add("x", true, 0).build()).externalAssistanceLikelihood());
        assertEquals(0.0, extractor.integrity(Attempts.of("s1", "q1").build()).externalAssistanceLikelihood());
    }

    @Test
    void competitionUsesRanksWhenAvailable() {
        AttemptHistory solved = Attempts.of("s1", "q1").add("x", true, 0).build();

        CompetitionSignals dropped = extractor.competition(solved, new RankSnapshot(12, 8));
        assertEquals(4, dropped.rankDelta());
        assertEquals(100.0, dropped.relativeProgressIndex());
        assertTrue(dropped.competitionPressureFlag());

        CompetitionSignals none = extractor.competition(solved, null);
        assertNull(none.latestRank());
        assertNull(none.rankDelta());
        assertFalse(none.competitionPressureFlag());

        AttemptHistory failing = Attempts.of("s1", "q1").add("x", false, 0).build();
        assertTrue(extractor.competition(failing, null).competitionPressureFlag());
    }

    @Test
    void behavioralSignalsTrackGapsAndUtcDays() {
        BehavioralDisengagementSignals b = extractor.behavioral(Attempts.of("s1", "q1")
                .add("a", false, 0)
                .add("b", false, 60)
                .add("c", false, 120)
                .add("d", false, 600)
                .build());
        assertEquals(List.of(60.0, 60.0, 480.0), b.attemptGapSeconds());
        assertEquals(100.0 - 200.0 / 60.0, b.consistencyScore(), 1e-9);
        assertTrue(b.averageGapIncreasing());
        assertEquals(List.of(4), b.dailyAttemptCounts());

        BehavioralDisengagementSignals overnight = extractor.behavioral(Attempts.of("s1", "q1")
                .add("a", false, 0)
                .add("b", false, 13 * 3600)
                .add("c", false, 15 * 3600)
                .add("d", false, 15 * 3600 + 60)
                .build());
        assertEquals(List.of(2, 2), overnight.dailyAttemptCounts());
    }

    @Test
    void extractReadsTheCollectorAndStampsTheClock() {
        collector.recordQuestionSubmit("s7", "q1", "x", false, 30);
        clock.advanceSeconds(90);
        collector.recordQuestionSubmit("s7", "q1", "y", true, 30);
        ranks.recordRank("s7", 5);
        ranks.recordRank("s7", 3);

        ComprehensiveFeatureSet features = extractor.extract("s7", "q1");
        assertEquals(clock.instant(), features.asOf());
        assertEquals(2, features.learningProgress().attemptCount());
        assertEquals(-2, features.competition().rankDelta());
        assertFalse(features.interventionResponse().interventionTriggered());
        assertTrue(features.reasoning().fallback());
    }
}
