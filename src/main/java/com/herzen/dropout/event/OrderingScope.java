package com.herzen.dropout.event;

public enum OrderingScope {
    /** One timeline for every event in the collector. */
    GLOBAL,
    /** Each (student, question) key keeps its own timeline. */
    PER_KEY
}
