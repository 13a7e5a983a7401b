package org.endlesssource.playtally.tracking;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompletionEvaluatorTest {

    @Test
    void halfOfDuration_isTheBoundary() {
        assertFalse(CompletionEvaluator.isComplete(99.9, 200));
        assertTrue(CompletionEvaluator.isComplete(100.0, 200));
        assertTrue(CompletionEvaluator.isComplete(250.0, 200));
    }

    @Test
    void unknownDuration_neverCompletes() {
        assertFalse(CompletionEvaluator.isComplete(0, 0));
        assertFalse(CompletionEvaluator.isComplete(10_000, 0));
        assertFalse(CompletionEvaluator.isComplete(10_000, -5));
        assertFalse(CompletionEvaluator.isComplete(Duration.ofHours(1), Duration.ZERO));
    }

    @Test
    void shortTracks_needNoAbsoluteMinimum() {
        assertTrue(CompletionEvaluator.isComplete(Duration.ofSeconds(5), Duration.ofSeconds(10)));
    }

    @Test
    void durationOverload_matchesSeconds() {
        assertFalse(CompletionEvaluator.isComplete(Duration.ofMillis(99_900), Duration.ofSeconds(200)));
        assertTrue(CompletionEvaluator.isComplete(Duration.ofSeconds(100), Duration.ofSeconds(200)));
    }

    @Test
    void completionRatio_isListenedOverDuration() {
        assertEquals(0.75, CompletionEvaluator.completionRatio(Duration.ofSeconds(150), Duration.ofSeconds(200)), 1e-9);
        assertEquals(0.0, CompletionEvaluator.completionRatio(Duration.ofSeconds(150), Duration.ZERO));
    }
}
