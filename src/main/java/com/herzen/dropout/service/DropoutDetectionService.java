package com.herzen.dropout.service;

import com.herzen.dropout.classification.ClassificationModels.DropoutClassification;
import com.herzen.dropout.classification.ClassificationModels.InterventionType;
import com.herzen.dropout.classification.DropoutAssessment;
import com.herzen.dropout.classification.DropoutClassifier;
import com.herzen.dropout.event.EventCollector;
import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.event.EventModels.EventKey;
import com.herzen.dropout.event.EventModels.LearningEvent;
import com.herzen.dropout.features.FeatureExtractor;
import com.herzen.dropout.features.SignalModels.ComprehensiveFeatureSet;
import com.herzen.dropout.intervention.InterventionTracker;
import com.herzen.dropout.intervention.InterventionTracker.InterventionRecord;
import com.herzen.dropout.reasoning.ReasoningAnalyzer;
import com.herzen.dropout.scoring.ScoringEngine;
import com.herzen.dropout.scoring.ScoringModels.DropoutRiskScore;
import com.herzen.dropout.scoring.ScoringModels.LearningMomentumIndex;
import com.herzen.dropout.service.TrendHistory.TrendPoint;
import com.herzen.dropout.view.StudentViewGenerator;
import com.herzen.dropout.view.TeacherViewGenerator;
import com.herzen.dropout.view.UserRole;
import com.herzen.dropout.view.ViewModels.AnalysisView;
import com.herzen.dropout.view.ViewModels.TeacherReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Wires the pipeline: events, attempt history, signals, analyzer insight, scores, classification
 * and the role-specific view.
 */
@Service
public class DropoutDetectionService {
    private static final Logger log = LoggerFactory.getLogger(DropoutDetectionService.class);

    private final EventCollector collector;
    private final FeatureExtractor featureExtractor;
    private final ReasoningAnalyzer reasoningAnalyzer;
    private final ScoringEngine scoringEngine;
    private final DropoutClassifier classifier;
    private final InterventionTracker interventionTracker;
    private final TrendHistory trendHistory;
    private final StudentViewGenerator studentViews;
    private final TeacherViewGenerator teacherViews;

    public DropoutDetectionService(EventCollector collector,
                                   FeatureExtractor featureExtractor,
                                   ReasoningAnalyzer reasoningAnalyzer,
                                   ScoringEngine scoringEngine,
                                   DropoutClassifier classifier,
                                   InterventionTracker interventionTracker,
                                   TrendHistory trendHistory,
                                   StudentViewGenerator studentViews,
                                   TeacherViewGenerator teacherViews) {
        this.collector = collector;
        this.featureExtractor = featureExtractor;
        this.reasoningAnalyzer = reasoningAnalyzer;
        this.scoringEngine = scoringEngine;
        this.classifier = classifier;
        this.interventionTracker = interventionTracker;
        this.trendHistory = trendHistory;
        this.studentViews = studentViews;
        this.teacherViews = teacherViews;
    }

    public LearningEvent recordEvent(String eventType, String studentId, String questionId, Map<String, Object> payload) {
        return collector.recordEvent(eventType, studentId, questionId, payload);
    }

    /** Typed recording operations (question start, submit, revision, focus, hints, sessions). */
    public EventCollector events() {
        return collector;
    }

    public AnalysisView analyze(String studentId, String questionId, UserRole role) {
        return analyze(studentId, questionId, role, null);
    }

    public AnalysisView analyze(String studentId, String questionId, UserRole role, String questionContext) {
        DropoutAssessment assessment = assess(studentId, questionId, questionContext);
        if (role == null || role.seesTeacherReport()) {
            return teacherViews.generate(assessment, interventionTracker.history(studentId, questionId),
                    role == null ? UserRole.TEACHER : role);
        }
        return studentViews.generate(assessment);
    }

    public DropoutAssessment assess(String studentId, String questionId, String questionContext) {
        requireId(studentId, "studentId");
        requireId(questionId, "questionId");
        EventKey key = new EventKey(studentId, questionId);

        AttemptHistory history = collector.buildAttemptHistory(studentId, questionId);
        ComprehensiveFeatureSet features = featureExtractor.extract(history)
                .withReasoning(reasoningAnalyzer.analyze(history, questionContext))
                .withInterventionResponse(interventionTracker.responseFor(history));

        LearningMomentumIndex lmi = scoringEngine.computeLmi(features, trendHistory.lmiValues(key));
        DropoutRiskScore drs = scoringEngine.computeDrs(features, lmi);
        DropoutClassification classification = classifier.classify(features, lmi, drs);

        if (history.attemptCount() > 0) {
            trendHistory.append(key, new TrendPoint(features.asOf(), lmi.value(), drs.value(),
                    classification.dropoutDetected(), classification.dropoutTypes()));
        }

        log.info("Analyzed {}: attempts={}, lmi={}, drs={} ({}), types={}", key, history.attemptCount(),
                String.format("%.1f", lmi.value()), String.format("%.2f", drs.value()), drs.level(),
                classification.dropoutTypes());
        return new DropoutAssessment(features, lmi, drs, classification);
    }

    /** Teacher reports for every question the student has events on. */
    public List<TeacherReport> analyzeStudent(String studentId) {
        requireId(studentId, "studentId");
        return collector.questionsForStudent(studentId).stream()
                .map(q -> teacherViews.generate(assess(studentId, q, null), interventionTracker.history(studentId, q)))
                .toList();
    }

    public InterventionRecord flagForIntervention(String studentId, String questionId, InterventionType type, String notes) {
        requireId(studentId, "studentId");
        requireId(questionId, "questionId");
        return interventionTracker.flag(studentId, questionId, type, notes);
    }

    public List<TrendPoint> history(String studentId, String questionId) {
        return trendHistory.pointsFor(new EventKey(studentId, questionId));
    }

    public List<InterventionRecord> interventions(String studentId, String questionId) {
        return interventionTracker.history(studentId, questionId);
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
