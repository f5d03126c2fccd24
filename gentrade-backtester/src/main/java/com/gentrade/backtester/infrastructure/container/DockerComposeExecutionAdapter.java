package com.gentrade.backtester.infrastructure.container;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs freqtrade backtests through {@code docker compose run} in the user's sandbox.
 */
@Component
@Slf4j
public class DockerComposeExecutionAdapter implements ContainerExecutionAdapter {

    private static final Pattern DUMP_LINE = Pattern.compile("dumping json to \"([^\"]+)\"");
    private static final String DAEMON_UNREACHABLE = "Cannot connect to the Docker daemon";
    private static final int ERROR_TAIL_LINES = 20;

    private final ContainerRuntime runtime;
    private final String dockerBinary;
    private final String service;
    private final Duration timeout;

    public DockerComposeExecutionAdapter(ContainerRuntime runtime,
                                         @Value("${backtest.container.docker-binary:docker}") String dockerBinary,
                                         @Value("${backtest.container.service:freqtrade}") String service,
                                         @Value("${backtest.container.timeout:15m}") Duration timeout) {
        this.runtime = runtime;
        this.dockerBinary = dockerBinary;
        this.service = service;
        this.timeout = timeout;
    }

    @Override
    public Path execute(ExecutionEnvironment environment, String reference, String dateRange) {
        String strategyName = strategyName(reference);
        Path strategyFile = environment.getStrategiesDirectory().resolve(strategyName + ".py");
        if (!Files.isRegularFile(strategyFile)) {
            throw new IllegalStateException("Strategy file not found: " + strategyFile);
        }

        String exportName = "backtest_" + UUID.randomUUID() + ".json";
        List<String> command = environment.composeRun(dockerBinary, service, List.of(
                "backtesting",
                "--datadir", ExecutionEnvironment.CONTAINER_COMMON_DATA,
                "--strategy", strategyName,
                "--timerange", dateRange,
                "--export", "trades",
                "--export-filename", ExecutionEnvironment.CONTAINER_USER_DATA + "/backtest_results/" + exportName));

        log.info("Running backtest for strategy {} over {}", strategyName, dateRange);
        ContainerRunResult result = runtime.run(command, timeout);

        if (!result.isSuccess()) {
            String tail = result.tail(ERROR_TAIL_LINES);
            ExecutionFailureCause cause = tail.contains(DAEMON_UNREACHABLE)
                    ? ExecutionFailureCause.RUNTIME_UNAVAILABLE
                    : ExecutionFailureCause.NON_ZERO_EXIT;
            throw new ContainerExecutionException(cause,
                    "Backtest exited with code " + result.getExitCode() + ": " + tail);
        }

        Path artifact = locateArtifact(environment.getResultsDirectory(), result.getOutput(), exportName);
        log.info("Backtest artifact written to {}", artifact);
        return artifact;
    }

    /**
     * The announced result file wins; freqtrade may rename the export with a timestamp.
     */
    Path locateArtifact(Path resultsDirectory, List<String> output, String exportName) {
        for (String line : output) {
            Matcher matcher = DUMP_LINE.matcher(line);
            if (matcher.find()) {
                String fileName = Path.of(matcher.group(1)).getFileName().toString();
                String baseName = fileName.endsWith(".json")
                        ? fileName.substring(0, fileName.length() - ".json".length())
                        : fileName;
                Path meta = resultsDirectory.resolve(baseName + ".meta.json");
                if (Files.exists(meta)) {
                    return meta;
                }
                Path announced = resultsDirectory.resolve(fileName);
                if (Files.exists(announced)) {
                    return announced;
                }
            }
        }

        Path requested = resultsDirectory.resolve(exportName);
        if (Files.exists(requested)) {
            return requested;
        }

        throw new ContainerExecutionException(ExecutionFailureCause.MISSING_ARTIFACT,
                "Backtest finished but no result file was found in " + resultsDirectory);
    }

    static String strategyName(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalStateException("Strategy has no file reference");
        }
        String fileName = Path.of(reference).getFileName().toString();
        return fileName.endsWith(".py") ? fileName.substring(0, fileName.length() - 3) : fileName;
    }
}
