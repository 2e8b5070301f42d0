package com.herzen.dropout.classification;

import com.herzen.dropout.classification.ClassificationModels.DropoutClassification;
import com.herzen.dropout.features.SignalModels.ComprehensiveFeatureSet;
import com.herzen.dropout.scoring.ScoringModels.DropoutRiskScore;
import com.herzen.dropout.scoring.ScoringModels.LearningMomentumIndex;

/** One complete analysis of a (student, question) key; both views render from it. */
public record DropoutAssessment(ComprehensiveFeatureSet features,
                                LearningMomentumIndex lmi,
                                DropoutRiskScore drs,
                                DropoutClassification classification) {
    public String studentId() {
        return features.studentId();
    }

    public String questionId() {
        return features.questionId();
    }
}
