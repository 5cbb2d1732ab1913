package io.sandcron.internal.sandbox;

import io.sandcron.SandboxCommandFactory;
import io.sandcron.config.SchedulerProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Launches the agent in a throwaway Docker container.
 *
 * <p>The group directory is mounted read-write at {@value #GROUP_MOUNT}, the handoff bundle read-only at
 * {@value #IPC_MOUNT}. Configured environment variables are forwarded by name only, and only when set.
 */
public class DockerSandboxCommandFactory implements SandboxCommandFactory {

    public static final String GROUP_MOUNT = "/workspace/group";
    public static final String IPC_MOUNT = "/workspace/ipc";

    private final SchedulerProperties.Sandbox sandbox;
    private final Function<String, String> environment;

    public DockerSandboxCommandFactory(SchedulerProperties.Sandbox sandbox) {
        this(sandbox, System::getenv);
    }

    DockerSandboxCommandFactory(SchedulerProperties.Sandbox sandbox, Function<String, String> environment) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public List<String> command(SandboxLaunch launch) {
        Objects.requireNonNull(launch, "launch must not be null");
        if (sandbox.getImage() == null || sandbox.getImage().isBlank()) {
            throw new IllegalStateException("sandcron.sandbox.image must not be blank");
        }

        List<String> args = new ArrayList<>();
        args.add(sandbox.getCommand());
        args.addAll(List.of("run", "--rm", "-i"));
        args.addAll(List.of("-v", launch.groupDir().toAbsolutePath() + ":" + GROUP_MOUNT));
        args.addAll(List.of("-v", launch.bundleDir().toAbsolutePath() + ":" + IPC_MOUNT + ":ro"));

        if (sandbox.getEnvPassthrough() != null) {
            for (String name : sandbox.getEnvPassthrough()) {
                if (name != null && !name.isBlank() && environment.apply(name) != null) {
                    args.addAll(List.of("-e", name));
                }
            }
        }

        if (sandbox.getEntrypoint() != null && !sandbox.getEntrypoint().isBlank()) {
            args.addAll(List.of("--entrypoint", sandbox.getEntrypoint()));
        }

        args.add(sandbox.getImage());
        if (sandbox.getArgs() != null) {
            args.addAll(sandbox.getArgs());
        }
        return args;
    }
}
