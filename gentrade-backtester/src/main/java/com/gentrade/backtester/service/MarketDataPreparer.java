package com.gentrade.backtester.service;

import com.gentrade.backtester.domain.Strategy;
import com.gentrade.backtester.exception.DataPreparationException;
import com.gentrade.backtester.infrastructure.container.ContainerExecutionException;
import com.gentrade.backtester.infrastructure.container.ContainerRunResult;
import com.gentrade.backtester.infrastructure.container.ContainerRuntime;
import com.gentrade.backtester.infrastructure.container.ExecutionEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Makes sure the market data a strategy needs is present in the shared data directory
 * for the requested date range before its backtest runs. Missing candles are fetched
 * with freqtrade's {@code download-data} inside the user's container.
 */
@Service
@Slf4j
public class MarketDataPreparer {

    static final String FUTURES = "futures";

    private final ContainerRuntime runtime;
    private final MarketDataCoverage coverage;
    private final String dockerBinary;
    private final String service;
    private final Duration downloadTimeout;

    public MarketDataPreparer(ContainerRuntime runtime,
                              MarketDataCoverage coverage,
                              @Value("${backtest.container.docker-binary:docker}") String dockerBinary,
                              @Value("${backtest.container.service:freqtrade}") String service,
                              @Value("${backtest.container.data-download-timeout:30m}") Duration downloadTimeout) {
        this.runtime = runtime;
        this.coverage = coverage;
        this.dockerBinary = dockerBinary;
        this.service = service;
        this.downloadTimeout = downloadTimeout;
    }

    /**
     * Ensure every expected data file exists and covers {@code dateRange}, downloading
     * when any is missing or was never downloaded for that range.
     *
     * @return the verified files
     * @throws DataPreparationException when the data cannot be made available
     */
    public List<Path> prepare(ExecutionEnvironment environment, Strategy strategy, String dateRange) {
        List<String> pairs = strategy.pairList();
        List<String> timeframes = strategy.timeframeList();
        if (pairs.isEmpty()) {
            throw new DataPreparationException("Strategy " + strategy.getId() + " declares no pairs");
        }
        if (timeframes.isEmpty()) {
            throw new DataPreparationException("Strategy " + strategy.getId() + " declares no timeframes");
        }

        String tradingMode = strategy.getTradingMode() != null ? strategy.getTradingMode() : FUTURES;
        List<Path> expected = expectedFiles(environment.getCommonDataDirectory(), pairs, timeframes, tradingMode);

        List<Path> missing = missingFiles(expected);
        List<Path> uncovered = coverage.uncovered(expected, dateRange);
        if (missing.isEmpty() && uncovered.isEmpty()) {
            log.info("Market data for {} already present ({} files), skipping download", dateRange, expected.size());
            return expected;
        }

        log.info("{} of {} market data files missing, {} not covering {}, downloading",
                missing.size(), expected.size(), uncovered.size(), dateRange);
        download(environment, strategy, pairs, timeframes, dateRange, tradingMode);

        missing = missingFiles(expected);
        if (!missing.isEmpty()) {
            List<String> missingNames = missing.stream().map(Path::toString).toList();
            throw new DataPreparationException("Market data still missing after download: "
                    + String.join(", ", missingNames), missingNames, null);
        }
        coverage.record(expected, dateRange);

        log.info("Market data download verified ({} files)", expected.size());
        return expected;
    }

    private void download(ExecutionEnvironment environment, Strategy strategy, List<String> pairs,
                          List<String> timeframes, String dateRange, String tradingMode) {
        List<String> args = new ArrayList<>();
        args.add("download-data");
        args.add("--datadir");
        args.add(ExecutionEnvironment.CONTAINER_COMMON_DATA);
        args.add("--pairs");
        args.addAll(pairs);
        args.add("--timeframes");
        args.addAll(timeframes);
        args.add("--timerange");
        args.add(dateRange);
        args.add("--exchange");
        args.add(strategy.getExchange() != null ? strategy.getExchange() : "binance");
        args.add("--trading-mode");
        args.add(tradingMode);

        ContainerRunResult result;
        try {
            result = runtime.run(environment.composeRun(dockerBinary, service, args), downloadTimeout);
        } catch (ContainerExecutionException e) {
            throw new DataPreparationException("Market data download failed [" + e.getFailureCause() + "]: "
                    + e.getMessage(), e);
        }

        if (!result.isSuccess()) {
            throw new DataPreparationException("Market data download exited with code "
                    + result.getExitCode() + ": " + result.tail(10));
        }
    }

    /**
     * {@code <common>/<mode>/<PAIR>-<tf>-<mode>.feather}, plus the 8h mark and funding
     * rate series per pair in futures mode.
     */
    static List<Path> expectedFiles(Path commonData, List<String> pairs, List<String> timeframes, String tradingMode) {
        Path modeDir = commonData.resolve(tradingMode);
        Set<Path> files = new LinkedHashSet<>();
        for (String pair : pairs) {
            String formattedPair = pair.replace("/", "_").replace(":", "_");
            for (String timeframe : timeframes) {
                files.add(modeDir.resolve(formattedPair + "-" + timeframe + "-" + tradingMode + ".feather"));
            }
            if (FUTURES.equals(tradingMode)) {
                files.add(modeDir.resolve(formattedPair + "-8h-mark.feather"));
                files.add(modeDir.resolve(formattedPair + "-8h-funding_rate.feather"));
            }
        }
        return List.copyOf(files);
    }

    private static List<Path> missingFiles(List<Path> expected) {
        return expected.stream()
                .filter(file -> !isNonEmptyFile(file))
                .toList();
    }

    private static boolean isNonEmptyFile(Path file) {
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
