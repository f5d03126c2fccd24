package com.gentrade.backtester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tracks which date ranges have been downloaded into each market data file.
 *
 * <p>A JSON manifest next to the data files maps each file name to its downloaded ranges
 * ({@code YYYYMMDD-YYYYMMDD}). Overlapping and adjacent ranges are merged when a download
 * is recorded. A file counts as covering a request only if one recorded range spans it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarketDataCoverage {

    static final String MANIFEST_NAME = ".download-coverage.json";

    private static final TypeReference<TreeMap<String, List<String>>> MANIFEST_TYPE = new TypeReference<>() {
    };
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);

    private final ObjectMapper objectMapper;
    private final Object lock = new Object();

    /**
     * Files whose recorded downloads do not span {@code dateRange}.
     */
    public List<Path> uncovered(List<Path> files, String dateRange) {
        LocalDate[] requested = parse(dateRange);
        Map<Path, Map<String, List<String>>> manifests = new HashMap<>();
        List<Path> uncovered = new ArrayList<>();
        synchronized (lock) {
            for (Path file : files) {
                Map<String, List<String>> manifest = manifests.computeIfAbsent(file.getParent(), this::read);
                boolean covered = manifest.getOrDefault(file.getFileName().toString(), List.of()).stream()
                        .map(MarketDataCoverage::parse)
                        .anyMatch(range -> !range[0].isAfter(requested[0]) && !range[1].isBefore(requested[1]));
                if (!covered) {
                    uncovered.add(file);
                }
            }
        }
        return uncovered;
    }

    /**
     * Record that {@code dateRange} was downloaded into every one of {@code files}.
     */
    public void record(List<Path> files, String dateRange) {
        parse(dateRange);
        Map<Path, List<Path>> byDirectory = new LinkedHashMap<>();
        for (Path file : files) {
            byDirectory.computeIfAbsent(file.getParent(), dir -> new ArrayList<>()).add(file);
        }

        synchronized (lock) {
            byDirectory.forEach((directory, directoryFiles) -> {
                Map<String, List<String>> manifest = read(directory);
                for (Path file : directoryFiles) {
                    String name = file.getFileName().toString();
                    List<String> ranges = new ArrayList<>(manifest.getOrDefault(name, List.of()));
                    ranges.add(dateRange);
                    manifest.put(name, merge(ranges));
                }
                write(directory, manifest);
            });
        }
    }

    static List<String> merge(List<String> ranges) {
        List<LocalDate[]> sorted = new ArrayList<>();
        for (String range : ranges) {
            sorted.add(parse(range));
        }
        sorted.sort(Comparator.comparing(range -> range[0]));

        List<LocalDate[]> merged = new ArrayList<>();
        for (LocalDate[] range : sorted) {
            LocalDate[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && !range[0].isAfter(last[1].plusDays(1))) {
                if (range[1].isAfter(last[1])) {
                    last[1] = range[1];
                }
            } else {
                merged.add(new LocalDate[]{range[0], range[1]});
            }
        }
        return merged.stream()
                .map(range -> DAY.format(range[0]) + "-" + DAY.format(range[1]))
                .toList();
    }

    private Map<String, List<String>> read(Path directory) {
        Path manifest = directory.resolve(MANIFEST_NAME);
        if (!Files.isRegularFile(manifest)) {
            return new TreeMap<>();
        }
        try {
            return objectMapper.readValue(manifest.toFile(), MANIFEST_TYPE);
        } catch (JsonProcessingException e) {
            // Unreadable manifest means nothing is known to be covered; the next download rewrites it
            log.warn("Ignoring unreadable coverage manifest {}: {}", manifest, e.getOriginalMessage());
            return new TreeMap<>();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void write(Path directory, Map<String, List<String>> manifest) {
        Path target = directory.resolve(MANIFEST_NAME);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, MANIFEST_NAME, ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), manifest);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write coverage manifest " + target, e);
        }
    }

    private static LocalDate[] parse(String dateRange) {
        String[] parts = dateRange != null ? dateRange.split("-", -1) : new String[0];
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid date range: " + dateRange);
        }
        try {
            return new LocalDate[]{LocalDate.parse(parts[0], DAY), LocalDate.parse(parts[1], DAY)};
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date range: " + dateRange, e);
        }
    }
}
