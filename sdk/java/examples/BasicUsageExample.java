package io.classtimer.examples;

import io.classtimer.TimerService;
import io.classtimer.config.TimerConfig;
import io.classtimer.config.TimerConfigRepository;
import io.classtimer.config.TimerPreset;
import io.classtimer.engine.TickResult;
import io.classtimer.engine.TimerEngine;
import io.classtimer.engine.TimerState;
import io.classtimer.store.JsonStorage;
import io.classtimer.store.MemoryBackend;
import io.classtimer.timer.TimerResult;

/**
 * Basic usage example for the classroom timer Java SDK.
 *
 * Run with: mvn exec:java -Dexec.mainClass="io.classtimer.examples.BasicUsageExample"
 */
public class BasicUsageExample {

    public static void main(String[] args) {
        System.out.println("=== Classroom Timer SDK Basic Usage Example ===\n");

        // Example 1: Parsing and formatting
        parsingExample();

        // Example 2: Running a countdown
        countdownExample();

        // Example 3: Stored configuration
        configurationExample();

        System.out.println("\n=== All examples completed ===");
    }

    static void parsingExample() {
        System.out.println("--- Example 1: Parsing and Formatting ---");

        for (String input : new String[] {"05:30", "120:00", "bad", "00:00"}) {
            TimerResult<Integer> result = TimerService.parseTimeString(input);
            if (result.isSuccess()) {
                int seconds = result.getValue();
                System.out.println(input + " -> " + seconds + "s (" + TimerService.getReadableTimeRemaining(seconds) + ")");
            } else {
                System.out.println(input + " -> " + result.getErrorKind() + ": " + result.getMessage());
            }
        }

        System.out.println();
    }

    static void countdownExample() {
        System.out.println("--- Example 2: Running a Countdown ---");

        TimerState state = TimerEngine.setDuration(
            TimerState.initial(), TimerPreset.FIVE_MINUTES.getSeconds(), TimerConfig.defaults().toWarningConfig());
        System.out.println("Thresholds: " + state.getWarningThresholds());

        state = TimerEngine.start(state);
        TickResult result;
        do {
            result = TimerEngine.tick(state);
            state = result.state();
            if (result.hasWarning()) {
                System.out.println("Warning at " + state.getFormattedTime() + " for " + result.firedWarnings());
            }
        } while (!result.completed());

        System.out.printf("Status: %s, progress: %.0f%%%n", state.getStatus(), state.getProgress());
        System.out.println();
    }

    static void configurationExample() {
        System.out.println("--- Example 3: Stored Configuration ---");

        try (JsonStorage storage = JsonStorage.builder()
            .backend(new MemoryBackend())
            .build()) {

            TimerConfigRepository repository = new TimerConfigRepository(storage);
            System.out.println("Loaded: " + repository.load());

            repository.update(builder -> builder.warningAt5Min(false));
            repository.rememberDuration(TimerPreset.TEN_MINUTES.getSeconds());
            System.out.println("Updated: " + repository.load());
            System.out.println("Stored JSON: " + storage.exportJson());
        }
    }
}
