package com.gentrade.backtester.infrastructure.container;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests ContainerRuntime against real short-lived processes.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ContainerRuntimeTest {

    private final ContainerRuntime runtime = new ContainerRuntime();

    @Test
    void testRun_CapturesOutputAndExitCode() {
        ContainerRunResult result = runtime.run(
                List.of("sh", "-c", "echo first; echo second >&2; exit 3"), Duration.ofSeconds(10));

        assertEquals(3, result.getExitCode());
        assertFalse(result.isSuccess());
        assertTrue(result.getOutput().contains("first"));
        assertTrue(result.getOutput().contains("second"));
    }

    @Test
    void testRun_TimeoutKillsProcess() {
        long start = System.currentTimeMillis();

        ContainerExecutionException ex = assertThrows(ContainerExecutionException.class,
                () -> runtime.run(List.of("sh", "-c", "sleep 30"), Duration.ofMillis(300)));

        assertEquals(ExecutionFailureCause.TIMEOUT, ex.getFailureCause());
        assertTrue(System.currentTimeMillis() - start < 10_000);
    }

    @Test
    void testRun_MissingBinaryIsRuntimeUnavailable() {
        ContainerExecutionException ex = assertThrows(ContainerExecutionException.class,
                () -> runtime.run(List.of("definitely-not-a-real-binary-7f3a"), Duration.ofSeconds(5)));

        assertEquals(ExecutionFailureCause.RUNTIME_UNAVAILABLE, ex.getFailureCause());
    }
}
