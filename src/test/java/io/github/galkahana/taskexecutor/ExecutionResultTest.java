package io.github.galkahana.taskexecutor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutionResultTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private static ExecutionResult result(int total, int success, int failed, int cancelled, boolean aborted) {
        return new ExecutionResult(total, success, failed, 0, cancelled, aborted, null,
            START, START.plusSeconds(2), List.of(), Map.of());
    }

    @ParameterizedTest(name = "{1}/{0} succeeded -> {2}%")
    @CsvSource({
        "0, 0, 0.0",
        "10, 10, 100.0",
        "10, 5, 50.0",
        "4, 1, 25.0",
        "10, 0, 0.0"
    })
    public void testSuccessRate(int total, int success, double expected) {
        assertEquals(expected, result(total, success, total - success, 0, false).successRate(), 0.0001);
    }

    @Test
    public void testHasErrors() {
        assertFalse(result(10, 10, 0, 0, false).hasErrors());
        assertTrue(result(10, 9, 1, 0, false).hasErrors());
        assertTrue(result(10, 5, 0, 5, true).hasErrors(), "An abort counts as an error even with no failures");
        assertFalse(result(10, 5, 0, 5, false).hasErrors(), "Cancelled tasks alone are not errors");
    }

    @Test
    public void testIsComplete() {
        assertTrue(result(10, 6, 2, 2, false).isComplete());
        assertTrue(result(0, 0, 0, 0, false).isComplete());
        assertFalse(result(10, 3, 1, 2, true).isComplete());
    }

    @Test
    public void testDuration() {
        assertEquals(Duration.ofSeconds(2), result(1, 1, 0, 0, false).duration());
    }

    @Test
    public void testCollectionsAreImmutableCopies() {
        // Arrange
        List<ErrorSample> samples = new ArrayList<>();
        samples.add(new ErrorSample(new RuntimeException("boom"), 1, 0, START));
        Map<String, Integer> counts = new HashMap<>();
        counts.put("boom", 1);

        // Act
        ExecutionResult result = new ExecutionResult(1, 0, 1, 0, 0, false, null,
            START, START, samples, counts);
        samples.clear();
        counts.clear();

        // Assert
        assertEquals(1, result.errorSamples().size());
        assertEquals(1, result.errorCount().get("boom"));
        assertThrows(UnsupportedOperationException.class, () -> result.errorSamples().clear());
        assertThrows(UnsupportedOperationException.class, () -> result.errorCount().put("other", 1));
    }

    @Test
    public void testNullCollectionsBecomeEmpty() {
        ExecutionResult result = new ExecutionResult(0, 0, 0, 0, 0, false, null, START, START, null, null);

        assertTrue(result.errorSamples().isEmpty());
        assertTrue(result.errorCount().isEmpty());
    }
}
