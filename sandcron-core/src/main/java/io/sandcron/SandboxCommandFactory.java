package io.sandcron;

import io.sandcron.core.ExecutionRequest;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the command line that launches the isolated agent process.
 *
 * <p>The isolation mechanism (container runtime, jail, ...) lives behind this seam.
 */
public interface SandboxCommandFactory {

    List<String> command(SandboxLaunch launch);

    /**
     * Everything prepared for one launch.
     *
     * @param request   the request being executed
     * @param groupDir  the group's working directory
     * @param bundleDir the handoff bundle written for this execution
     * @param inputFile the serialized request inside {@code bundleDir}
     */
    record SandboxLaunch(ExecutionRequest request, Path groupDir, Path bundleDir, Path inputFile) {
    }
}
