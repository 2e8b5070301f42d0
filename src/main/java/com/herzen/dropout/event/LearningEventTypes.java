package com.herzen.dropout.event;

import java.util.Set;

public final class LearningEventTypes {
    public static final String SESSION_START = "session_start";
    public static final String SESSION_END = "session_end";
    public static final String QUESTION_START = "question_start";
    public static final String QUESTION_SUBMIT = "question_submit";
    public static final String ANSWER_REVISION = "answer_revision";
    public static final String NAVIGATION = "navigation";
    public static final String FOCUS_BLUR = "focus_blur";
    public static final String FOCUS_GAIN = "focus_gain";
    public static final String HINT_REQUEST = "hint_request";

    public static final Set<String> SUPPORTED = Set.of(
            SESSION_START,
            SESSION_END,
            QUESTION_START,
            QUESTION_SUBMIT,
            ANSWER_REVISION,
            NAVIGATION,
            FOCUS_BLUR,
            FOCUS_GAIN,
            HINT_REQUEST
    );

    /** Question id used for session events that are not tied to a question. */
    public static final String SESSION_QUESTION = "session";

    private LearningEventTypes() {}
}
