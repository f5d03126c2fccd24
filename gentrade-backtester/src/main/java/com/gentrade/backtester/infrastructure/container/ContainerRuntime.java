package com.gentrade.backtester.infrastructure.container;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a deadline.
 *
 * <p>Output is redirected to a temporary file instead of a pipe, so a chatty process can
 * never block on a full buffer while we wait for it. Each call owns its own process.
 */
@Component
@Slf4j
public class ContainerRuntime {

    public ContainerRunResult run(List<String> command, Duration timeout) {
        log.info("Executing command: {}", String.join(" ", command));

        Path outputFile;
        try {
            outputFile = Files.createTempFile("backtest-run-", ".log");
        } catch (IOException e) {
            throw new IllegalStateException("Could not create process output file", e);
        }

        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(outputFile.toFile());

            Process process;
            try {
                process = processBuilder.start();
            } catch (IOException e) {
                throw new ContainerExecutionException(ExecutionFailureCause.RUNTIME_UNAVAILABLE,
                        "Could not start " + command.get(0) + ": " + e.getMessage(), e);
            }

            boolean completed;
            try {
                completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for " + command.get(0), e);
            }

            if (!completed) {
                process.destroyForcibly();
                throw new ContainerExecutionException(ExecutionFailureCause.TIMEOUT,
                        "Execution timed out after " + timeout.toSeconds() + "s");
            }

            List<String> output = readOutput(outputFile);
            output.forEach(line -> log.debug("Container output: {}", line));
            return new ContainerRunResult(process.exitValue(), output);

        } finally {
            try {
                Files.deleteIfExists(outputFile);
            } catch (IOException e) {
                log.warn("Failed to delete process output file {}", outputFile, e);
            }
        }
    }

    private static List<String> readOutput(Path outputFile) {
        try {
            return Files.readAllLines(outputFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read process output", e);
        }
    }
}
