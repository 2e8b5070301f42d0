package com.herzen.dropout.reasoning;

import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.features.SignalModels.ReasoningInsight;

/**
 * Interprets an attempt history into a reasoning insight.
 *
 * <p>Implementations may be slow or remote; callers on the analysis path go through
 * {@link BoundedReasoningAnalyzer}.
 */
public interface ReasoningAnalyzer {
    ReasoningInsight analyze(AttemptHistory history, String questionContext);
}
