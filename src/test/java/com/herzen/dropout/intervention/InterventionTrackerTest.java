package com.herzen.dropout.intervention;

import com.herzen.dropout.classification.ClassificationModels.InterventionType;
import com.herzen.dropout.features.SignalModels.InterventionResponseSignals;
import com.herzen.dropout.support.Attempts;
import com.herzen.dropout.support.MutableClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InterventionTrackerTest {
    private final MutableClock clock = new MutableClock(Attempts.BASE.plusSeconds(300));
    private final InterventionTracker tracker = new InterventionTracker(clock);

    @Test
    void withoutInterventionNothingIsTriggered() {
        InterventionResponseSignals response = tracker.responseFor(Attempts.of("s1", "q1").add("a", false, 0).build());
        assertFalse(response.interventionTriggered());
        assertNull(response.interventionType());
    }

    @Test
    void measuresProgressAfterTheLatestIntervention() {
        tracker.flag("s1", "q1", InterventionType.STRATEGIC_GUIDANCE, "first");
        clock.advanceSeconds(600);
        tracker.flag("s1", "q1", InterventionType.CONCEPTUAL_SUPPORT, "second");

        InterventionResponseSignals response = tracker.responseFor(Attempts.of("s1", "q1")
                .add("a", false, 0)
                .add("b", true, 400)
                .add("c", false, 1000)
                .add("d", true, 1100)
                .build());

        assertTrue(response.interventionTriggered());
        assertEquals("CONCEPTUAL_SUPPORT", response.interventionType());
        assertEquals(clock.instant(), response.interventionTimestamp());
        assertEquals(50.0, response.postInterventionProgress());
        assertEquals(0.0, response.recoveryScore());
        assertTrue(response.interventionSuccess());
        assertEquals(2, tracker.history("s1", "q1").size());
    }

    @Test
    void noAttemptsAfterInterventionIsNotASuccess() {
        clock.advanceSeconds(3600);
        tracker.flag("s1", "q1", InterventionType.MOTIVATIONAL_SUPPORT, null);

        InterventionResponseSignals response = tracker.responseFor(Attempts.of("s1", "q1").add("a", false, 0).build());
        assertTrue(response.interventionTriggered());
        assertEquals(0.0, response.postInterventionProgress());
        assertFalse(response.interventionSuccess());
        assertEquals("", tracker.history("s1", "q1").get(0).notes());
    }

    @Test
    void interventionTypeIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> tracker.flag("s1", "q1", null, "notes"));
    }
}
