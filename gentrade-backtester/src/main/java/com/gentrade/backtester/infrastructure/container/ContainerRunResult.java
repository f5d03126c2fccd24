package com.gentrade.backtester.infrastructure.container;

import lombok.Value;

import java.util.List;

/**
 * Exit code and combined stdout/stderr of a finished process.
 */
@Value
public class ContainerRunResult {

    int exitCode;
    List<String> output;

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Last {@code maxLines} lines of output, for error messages.
     */
    public String tail(int maxLines) {
        int from = Math.max(0, output.size() - maxLines);
        return String.join("\n", output.subList(from, output.size()));
    }
}
