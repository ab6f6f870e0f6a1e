package com.scorebook.core.keyplay;

import com.scorebook.core.model.OutcomeKind;
import com.scorebook.core.model.PlayEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyPlayDetectorTest {

    private final KeyPlayDetector detector = new KeyPlayDetector(0.10);
    private final PlayEvent single = PlayEvent.builder().kind(OutcomeKind.SINGLE).batter("b", "B").build();

    @Test
    void swingAtThresholdIsKey() {
        assertTrue(detector.isKeyPlay(single, 0.50, 0.60), "exactamente 10 puntos cuenta");
        assertTrue(detector.isKeyPlay(single, 0.70, 0.40), "las variaciones en contra del local también cuentan");
    }

    @Test
    void smallSwingIsNotKey() {
        assertFalse(detector.isKeyPlay(single, 0.50, 0.55));
    }

    @Test
    void missingProbabilitiesAreNeverKey() {
        assertFalse(detector.isKeyPlay(single, null, 0.9));
        assertFalse(detector.isKeyPlay(single, 0.1, null));
    }

    @Test
    void thresholdCanBeOverriddenPerCall() {
        assertTrue(detector.isKeyPlay(single, 0.50, 0.55, 0.05));
        assertFalse(detector.isKeyPlay(single, 0.50, 0.70, 0.25));
    }

    @Test
    void thresholdMustBeAProbability() {
        assertThrows(IllegalArgumentException.class, () -> new KeyPlayDetector(-0.1));
        assertThrows(IllegalArgumentException.class, () -> detector.isKeyPlay(single, 0.1, 0.2, 1.5));
    }
}
