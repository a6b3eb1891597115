package io.classtimer;

import io.classtimer.timer.TimerErrorKind;
import io.classtimer.timer.TimerResult;
import io.classtimer.timer.TimerStatus;
import io.classtimer.timer.TriggeredWarnings;
import io.classtimer.timer.WarningConfig;
import io.classtimer.timer.WarningDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Timer Service Tests")
class TimerServiceTest {

    @Test
    @DisplayName("Formats times for display")
    void testFormatting() {
        assertEquals("05:30", TimerService.formatTime(330));
        assertEquals("00:45", TimerService.formatTime(45));
        assertEquals("61:01", TimerService.formatTime(3661));
        assertEquals("2 minutes 30 seconds", TimerService.getReadableTimeRemaining(150));
    }

    @Test
    @DisplayName("Computes progress")
    void testProgress() {
        assertEquals(70.0, TimerService.getProgress(30, 100), 1e-9);
        assertEquals(100.0, TimerService.getProgress(0, 100), 1e-9);
        assertEquals(0.0, TimerService.getProgress(42, 0));
    }

    @Test
    @DisplayName("Computes warning thresholds and zones")
    void testWarnings() {
        assertEquals(List.of(120, 300), TimerService.calculateWarningThresholds(600, WarningConfig.all()));
        assertEquals(List.of(), TimerService.calculateWarningThresholds(120, WarningConfig.all()));
        assertEquals(List.of(), TimerService.calculateWarningThresholds(100, WarningConfig.all()));

        assertTrue(TimerService.isInWarningZone(120, List.of(120, 300)));
        assertFalse(TimerService.isInWarningZone(301, List.of(120, 300)));

        assertTrue(TimerService.hasWarningBeenTriggered(120, TriggeredWarnings.of(120, 300)));
        assertFalse(TimerService.hasWarningBeenTriggered(60, TriggeredWarnings.of(120)));
    }

    @Test
    @DisplayName("Remaining time under any threshold is inside the warning zone")
    void testWarningZoneUsesAnyThreshold() {
        // 150 is above the two-minute warning but below the five-minute one
        assertTrue(TimerService.isInWarningZone(150, List.of(120, 300)));
        assertTrue(TimerService.isInWarningZone(300, List.of(120, 300)));
        assertFalse(TimerService.isInWarningZone(150, List.of(120)));
        assertFalse(TimerService.isInWarningZone(150, List.of()));
    }

    @Test
    @DisplayName("Validates status transitions")
    void testTransitions() {
        assertTrue(TimerService.isValidTransition(TimerStatus.IDLE, TimerStatus.RUNNING));
        assertFalse(TimerService.isValidTransition(TimerStatus.RUNNING, TimerStatus.RUNNING));
        assertTrue(TimerService.isValidTransition(TimerStatus.COMPLETED, TimerStatus.RUNNING));
        assertTrue(TimerService.isValidTransition("idle", "running"));
        assertFalse(TimerService.isValidTransition("running", "running"));
    }

    @Test
    @DisplayName("Validates and parses durations")
    void testDurations() {
        assertEquals(TimerErrorKind.INVALID_DURATION, TimerService.validateDuration(0).getErrorKind());
        assertEquals(TimerErrorKind.INVALID_DURATION, TimerService.validateDuration(86401).getErrorKind());
        assertTrue(TimerService.validateDuration(300).isSuccess());
        assertTrue(TimerService.validateDuration(2.5).isFailure());

        assertEquals(330, TimerService.parseTimeString("05:30").getValue());
        assertEquals(TimerErrorKind.INVALID_FORMAT, TimerService.parseTimeString("bad").getErrorKind());
    }

    @Test
    @DisplayName("A driver loop fires each warning once while the zone stays flagged")
    void testDriverLoop() {
        TimerResult<Integer> duration = TimerService.parseTimeString("06:00");
        int total = duration.getValue();
        List<Integer> thresholds = TimerService.calculateWarningThresholds(total, WarningConfig.all());
        TriggeredWarnings triggered = TriggeredWarnings.empty();
        List<Integer> fired = new ArrayList<>();
        int zoneTicks = 0;

        for (int remaining = total - 1; remaining >= 0; remaining--) {
            if (TimerService.isInWarningZone(remaining, thresholds)) {
                zoneTicks++;
            }
            WarningDecision decision = TimerService.evaluateWarnings(remaining, thresholds, triggered);
            fired.addAll(decision.fired());
            triggered = decision.triggered();
        }

        assertEquals(List.of(300, 120), fired);
        assertEquals(301, zoneTicks);
        assertEquals(TriggeredWarnings.of(120, 300), triggered);
    }
}
