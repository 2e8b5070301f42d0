package com.herzen.dropout.view;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.dropout.classification.ClassificationModels.InterventionType;
import com.herzen.dropout.classification.DropoutAssessment;
import com.herzen.dropout.classification.DropoutClassifier;
import com.herzen.dropout.config.DropoutProperties;
import com.herzen.dropout.event.EventCollector;
import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.features.FeatureExtractor;
import com.herzen.dropout.features.InMemoryCompetitionContextProvider;
import com.herzen.dropout.features.SignalModels.ComprehensiveFeatureSet;
import com.herzen.dropout.features.SignalModels.ReasoningInsight;
import com.herzen.dropout.intervention.InterventionTracker.InterventionRecord;
import com.herzen.dropout.reasoning.HeuristicReasoningAnalyzer;
import com.herzen.dropout.scoring.ScoringEngine;
import com.herzen.dropout.scoring.ScoringModels.DropoutRiskScore;
import com.herzen.dropout.scoring.ScoringModels.LearningMomentumIndex;
import com.herzen.dropout.support.Attempts;
import com.herzen.dropout.support.MutableClock;
import com.herzen.dropout.view.ViewModels.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ViewGeneratorTest {
    private final DropoutProperties properties = new DropoutProperties();
    private final MutableClock clock = MutableClock.startingAt("2024-03-04T12:00:00Z");
    private final FeatureExtractor extractor = new FeatureExtractor(
            new EventCollector(clock, properties), new InMemoryCompetitionContextProvider(), clock);
    private final HeuristicReasoningAnalyzer analyzer = new HeuristicReasoningAnalyzer();
    private final ScoringEngine engine = new ScoringEngine(properties);
    private final DropoutClassifier classifier = new DropoutClassifier();
    private final StudentViewGenerator studentViews = new StudentViewGenerator();
    private final TeacherViewGenerator teacherViews = new TeacherViewGenerator();
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private DropoutAssessment assess(ComprehensiveFeatureSet f) {
        LearningMomentumIndex lmi = engine.computeLmi(f, List.of());
        DropoutRiskScore drs = engine.computeDrs(f, lmi);
        return new DropoutAssessment(f, lmi, drs, classifier.classify(f, lmi, drs));
    }

    private DropoutAssessment assess(AttemptHistory history) {
        return assess(extractor.extract(history, null).withReasoning(analyzer.analyze(history, null)));
    }

    private static AttemptHistory struggling() {
        return Attempts.of("s1", "q1")
                .add("wrong_answer_1", false, 0)
                .add("wrong_answer_2", false, 120)
                .add("wrong_answer_3", false, 270)
                .add("wrong_answer_4", false, 450)
                .build();
    }

    @Test
    void studentFeedbackNeverMentionsRiskOrDropout() throws Exception {
        DropoutAssessment assessment = assess(struggling());
        assertTrue(assessment.classification().dropoutDetected());

        StudentFeedback feedback = studentViews.generate(assessment);
        String json = mapper.writeValueAsString(feedback).toLowerCase(Locale.ROOT);

        assertFalse(json.contains("dropout"));
        assertFalse(json.contains("risk"));
        assertFalse(json.contains("cognitive"));
        assertEquals(UserRole.STUDENT, feedback.role());
        assertEquals(StudentViewGenerator.ENCOURAGEMENTS.get(4), feedback.encouragement());
        assertTrue(feedback.growthAreas().stream().anyMatch(g -> g.action() == SupportAction.SUGGEST_RESOURCE));
        assertTrue(feedback.growthAreas().stream().anyMatch(g -> g.action() == SupportAction.MOTIVATIONAL_CHECK_IN));
        assertEquals(feedback.growthAreas().size(), feedback.nextSteps().size());
    }

    @Test
    void analyzerDiagnosisNeverReachesGrowthAreas() {
        AttemptHistory history = Attempts.of("s1", "q1")
                .add("a", false, 0)
                .add("b", false, 60)
                .add("c", false, 120)
                .build();
        DropoutAssessment assessment = assess(history);
        String gap = assessment.features().reasoning().conceptualGapDescription();
        assertEquals("Fundamental misunderstanding - requires intervention", gap);

        StudentFeedback feedback = studentViews.generate(assessment);

        assertTrue(feedback.growthAreas().stream().noneMatch(g -> g.message().contains("requires intervention")));
        assertTrue(feedback.nextSteps().stream().noneMatch(m -> m.contains(gap)));
        assertTrue(feedback.growthAreas().stream()
                .anyMatch(g -> g.message().equals(StudentViewGenerator.PATTERN_REVIEW)));
        feedback.growthAreas().forEach(g -> assertTrue(g.message().endsWith(".") || g.message().endsWith("?")
                || g.message().endsWith("!"), g.message()));
    }

    @Test
    void remoteAnalyzerWordingIsNotShownToTheStudent() throws Exception {
        AttemptHistory history = struggling();
        ReasoningInsight insight = new ReasoningInsight("Classic Dropout trajectory on linear equations",
                "summary", 0.9, List.of("guessing"), 20.0, false);
        StudentFeedback feedback = studentViews.generate(assess(extractor.extract(history, null).withReasoning(insight)));

        String json = mapper.writeValueAsString(feedback).toLowerCase(Locale.ROOT);
        assertFalse(json.contains("dropout"));
        assertFalse(json.contains("linear equations"));
        assertTrue(feedback.growthAreas().stream()
                .anyMatch(g -> g.message().equals(StudentViewGenerator.CONCEPT_REVIEW)));
    }

    @Test
    void teacherReportCarriesTheFullDiagnosis() {
        DropoutAssessment assessment = assess(struggling());
        InterventionRecord previous = new InterventionRecord("s1", "q1", InterventionType.STRATEGIC_GUIDANCE,
                "walked through isolation step", clock.instant().minusSeconds(3600));

        TeacherReport report = teacherViews.generate(assessment, List.of(previous));

        assertEquals("DROPOUT_DETECTED", report.dropoutStatus().status());
        assertTrue(report.dropoutStatus().types().contains("COGNITIVE"));
        assertEquals(List.of("learningProgress", "stagnation", "integrity", "reasoning", "competition",
                "behavioral", "interventionResponse"), List.copyOf(report.signals().keySet()));
        assertEquals(6, report.riskComponents().size());
        assertEquals("CRITICAL", report.scores().lmi().status());
        assertEquals(List.of(previous), report.interventionHistory());
        assertNotNull(report.analyzerNote());
        assertEquals(assessment.features().asOf(), report.generatedAt());
    }

    @Test
    void followUpWindowShrinksWithRisk() {
        DropoutAssessment healthy = assess(Attempts.of("s1", "q1").add("42", true, 0, 45).build());
        assertEquals(72, teacherViews.generate(healthy, List.of()).intervention().followUpInHours());
        assertEquals("NO_DROPOUT", teacherViews.generate(healthy, List.of()).dropoutStatus().status());

        DropoutAssessment stalled = assess(Attempts.of("s1", "q1")
                .add("a", false, 0).add("b", false, 400).add("c", false, 800).add("d", false, 1200).build());
        InterventionBlock block = teacherViews.generate(stalled, List.of()).intervention();
        assertEquals(6, block.followUpInHours());
        assertTrue(block.shouldIntervene());
        assertEquals(InterventionType.CONCEPTUAL_SUPPORT, block.interventionType());
    }

    @Test
    void viewsAreByteIdenticalAcrossGenerations() throws Exception {
        DropoutAssessment assessment = assess(struggling());
        clock.advanceSeconds(600);

        String teacherFirst = mapper.writeValueAsString(teacherViews.generate(assessment, List.of()));
        String teacherSecond = mapper.writeValueAsString(teacherViews.generate(assessment, List.of()));
        assertEquals(teacherFirst, teacherSecond);

        String studentFirst = mapper.writeValueAsString(studentViews.generate(assessment));
        String studentSecond = mapper.writeValueAsString(studentViews.generate(assessment));
        assertEquals(studentFirst, studentSecond);
    }
}
