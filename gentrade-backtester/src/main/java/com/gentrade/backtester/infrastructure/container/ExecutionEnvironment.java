package com.gentrade.backtester.infrastructure.container;

import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Host-side layout of one user's sandbox.
 *
 * <p>Inside the container the same directories are mounted at
 * {@link #CONTAINER_USER_DATA} and {@link #CONTAINER_COMMON_DATA}.
 */
@Value
public class ExecutionEnvironment {

    public static final String CONTAINER_USER_DATA = "/freqtrade/user_data";
    public static final String CONTAINER_COMMON_DATA = "/freqtrade/common_data";

    private static final String USER_DIR_PREFIX = "user_";

    Path userDirectory;
    Path composeFile;
    Path strategiesDirectory;
    Path resultsDirectory;
    Path commonDataDirectory;

    public static ExecutionEnvironment forUser(Path userdataRoot, String principalId) {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("Principal ID cannot be empty");
        }
        String dirName = principalId.startsWith(USER_DIR_PREFIX) ? principalId : USER_DIR_PREFIX + principalId;
        Path userDir = userdataRoot.resolve(dirName);
        Path userData = userDir.resolve("user_data");
        return new ExecutionEnvironment(
                userDir,
                userDir.resolve("docker-compose.yml"),
                userData.resolve("strategies"),
                userData.resolve("backtest_results"),
                userdataRoot.resolve("_common_data"));
    }

    /**
     * {@code <docker> compose -f <compose file> run --rm <service> <args...>}
     */
    public List<String> composeRun(String dockerBinary, String service, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(dockerBinary);
        command.add("compose");
        command.add("-f");
        command.add(composeFile.toString());
        command.add("run");
        command.add("--rm");
        command.add(service);
        command.addAll(args);
        return command;
    }
}
