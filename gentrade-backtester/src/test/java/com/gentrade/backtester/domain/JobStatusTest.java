package com.gentrade.backtester.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the job lifecycle transitions.
 */
class JobStatusTest {

    @Test
    void testCanAdvanceTo_SuccessPathOneStepAtATime() {
        assertTrue(JobStatus.CREATED.canAdvanceTo(JobStatus.DOWNLOADING_DATA));
        assertTrue(JobStatus.DOWNLOADING_DATA.canAdvanceTo(JobStatus.RUNNING));
        assertTrue(JobStatus.RUNNING.canAdvanceTo(JobStatus.FINISHED));
    }

    @Test
    void testCanAdvanceTo_NoSkippingOrGoingBack() {
        assertFalse(JobStatus.CREATED.canAdvanceTo(JobStatus.RUNNING));
        assertFalse(JobStatus.CREATED.canAdvanceTo(JobStatus.FINISHED));
        assertFalse(JobStatus.DOWNLOADING_DATA.canAdvanceTo(JobStatus.FINISHED));
        assertFalse(JobStatus.RUNNING.canAdvanceTo(JobStatus.DOWNLOADING_DATA));
        assertFalse(JobStatus.RUNNING.canAdvanceTo(JobStatus.RUNNING));
        assertFalse(JobStatus.CREATED.canAdvanceTo(null));
    }

    @Test
    void testCanAdvanceTo_FailedFromAnyNonTerminalState() {
        assertTrue(JobStatus.CREATED.canAdvanceTo(JobStatus.FAILED));
        assertTrue(JobStatus.DOWNLOADING_DATA.canAdvanceTo(JobStatus.FAILED));
        assertTrue(JobStatus.RUNNING.canAdvanceTo(JobStatus.FAILED));
    }

    @Test
    void testCanAdvanceTo_NothingLeavesTerminalState() {
        for (JobStatus next : JobStatus.values()) {
            assertFalse(JobStatus.FINISHED.canAdvanceTo(next), "finished -> " + next);
            assertFalse(JobStatus.FAILED.canAdvanceTo(next), "failed -> " + next);
        }
    }

    @Test
    void testValue_LowerCaseWireFormat() {
        assertEquals("downloading_data", JobStatus.DOWNLOADING_DATA.value());
        assertEquals(JobStatus.RUNNING, JobStatus.fromValue("running"));
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromValue("queued"));
    }

    @Test
    void testConverter_PersistsLowerCaseValue() {
        JobStatusConverter converter = new JobStatusConverter();

        assertEquals("finished", converter.convertToDatabaseColumn(JobStatus.FINISHED));
        assertEquals(JobStatus.FAILED, converter.convertToEntityAttribute("failed"));
    }
}
