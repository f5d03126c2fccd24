package com.gentrade.backtester.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketDataCoverage range bookkeeping.
 */
class MarketDataCoverageTest {

    @TempDir
    Path dataDirectory;

    private MarketDataCoverage coverage;
    private Path hourly;
    private Path funding;

    @BeforeEach
    void setUp() {
        coverage = new MarketDataCoverage(new ObjectMapper());
        hourly = dataDirectory.resolve("futures").resolve("BTC_USDT_USDT-1h-futures.feather");
        funding = dataDirectory.resolve("futures").resolve("BTC_USDT_USDT-8h-funding_rate.feather");
    }

    @Test
    void testUncovered_NothingRecorded() {
        assertEquals(List.of(hourly, funding), coverage.uncovered(List.of(hourly, funding), "20240101-20240131"));
    }

    @Test
    void testUncovered_InsideRecordedRange() {
        // Arrange
        coverage.record(List.of(hourly, funding), "20240101-20240630");

        // Act & Assert
        assertTrue(coverage.uncovered(List.of(hourly, funding), "20240201-20240229").isEmpty());
        assertEquals(List.of(hourly, funding), coverage.uncovered(List.of(hourly, funding), "20240601-20240731"));
    }

    @Test
    void testRecord_PerFile() {
        coverage.record(List.of(hourly), "20240101-20240131");

        assertEquals(List.of(funding), coverage.uncovered(List.of(hourly, funding), "20240101-20240131"));
    }

    @Test
    void testRecord_AdjacentRangesSpanTogether() {
        // Arrange
        coverage.record(List.of(hourly), "20240101-20240131");
        coverage.record(List.of(hourly), "20240201-20240229");

        // Act & Assert
        assertTrue(coverage.uncovered(List.of(hourly), "20240115-20240215").isEmpty());
    }

    @Test
    void testRecord_SurvivesNewInstance() {
        coverage.record(List.of(hourly), "20240101-20240131");

        MarketDataCoverage reloaded = new MarketDataCoverage(new ObjectMapper());

        assertTrue(reloaded.uncovered(List.of(hourly), "20240110-20240120").isEmpty());
        assertTrue(Files.exists(hourly.getParent().resolve(MarketDataCoverage.MANIFEST_NAME)));
    }

    @Test
    void testUncovered_CorruptManifestTreatedAsEmpty() throws Exception {
        // Arrange
        Files.createDirectories(hourly.getParent());
        Files.writeString(hourly.getParent().resolve(MarketDataCoverage.MANIFEST_NAME), "{not json");

        // Act & Assert
        assertEquals(List.of(hourly), coverage.uncovered(List.of(hourly), "20240101-20240131"));
    }

    @Test
    void testMerge_OverlappingAndDisjoint() {
        List<String> merged = MarketDataCoverage.merge(List.of(
                "20240301-20240331", "20240101-20240215", "20240201-20240228", "20241001-20241031"));

        assertEquals(List.of("20240101-20240331", "20241001-20241031"), merged);
    }

    @Test
    void testUncovered_InvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> coverage.uncovered(List.of(hourly), "2024-01-01"));
    }
}
