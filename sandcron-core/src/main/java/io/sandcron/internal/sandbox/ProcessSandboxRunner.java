package io.sandcron.internal.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sandcron.ExecutionRunner;
import io.sandcron.SandboxCommandFactory;
import io.sandcron.config.SchedulerProperties;
import io.sandcron.core.ExecutionInfrastructureException;
import io.sandcron.core.ExecutionOutcome;
import io.sandcron.core.ExecutionRequest;
import io.sandcron.core.ExecutionResult;
import io.sandcron.utils.DurationFormat;
import io.sandcron.utils.OutputProtocolParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ExecutionRunner} that launches the agent as an operating-system process.
 *
 * <p>Per call:
 * <ol>
 *   <li>ensure {@code <groupsDir>/<group>} exists</li>
 *   <li>write the handoff bundle (context files and serialized request)</li>
 *   <li>spawn the command built by the {@link SandboxCommandFactory}</li>
 *   <li>write the request to stdin, capture stdout up to {@code maxOutputBytes} and wait for exit,
 *       all raced against the timeout</li>
 *   <li>parse the capture with the {@link OutputProtocolParser}</li>
 *   <li>delete the handoff bundle</li>
 * </ol>
 * On timeout the process tree is killed and whatever was captured is parsed as a failed exit.
 * A command factory that throws is reported as an {@link ExecutionInfrastructureException}.
 */
public class ProcessSandboxRunner implements ExecutionRunner, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProcessSandboxRunner.class);

    private static final long KILL_GRACE_MILLIS = 1000;

    private final Path groupsDir;
    private final long maxOutputBytes;
    private final SandboxCommandFactory commandFactory;
    private final OutputProtocolParser parser;
    private final HandoffBundleWriter bundleWriter;
    private final ExecutorService ioPool;

    public ProcessSandboxRunner(SchedulerProperties props,
                                SandboxCommandFactory commandFactory,
                                OutputProtocolParser parser,
                                ObjectMapper objectMapper) {
        Objects.requireNonNull(props, "props must not be null");
        this.groupsDir = Objects.requireNonNull(props.getGroupsDir(), "sandcron.groupsDir must not be null");
        this.maxOutputBytes = props.getMaxOutputBytes();
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("sandcron.maxOutputBytes must be positive");
        }
        this.commandFactory = Objects.requireNonNull(commandFactory, "commandFactory must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.bundleWriter = new HandoffBundleWriter(
                Objects.requireNonNull(props.getDataDir(), "sandcron.dataDir must not be null"),
                Objects.requireNonNull(objectMapper, "objectMapper must not be null"));

        AtomicInteger threadCount = new AtomicInteger();
        this.ioPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("sandcron.sandbox-io-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ExecutionOutcome run(ExecutionRequest request, Duration timeout) throws ExecutionInfrastructureException {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }

        Path groupDir = prepareGroupDir(request.groupFolder());
        HandoffBundleWriter.HandoffBundle bundle = bundleWriter.write(request);
        try {
            List<String> command = buildCommand(request, groupDir, bundle);
            return execute(request, command, groupDir, bundle.input(), timeout);
        } finally {
            bundleWriter.delete(bundle);
        }
    }

    @Override
    public void close() {
        ioPool.shutdownNow();
    }

    private Path prepareGroupDir(String groupFolder) throws ExecutionInfrastructureException {
        if (!isSafeFolderName(groupFolder)) {
            throw new ExecutionInfrastructureException("Invalid group folder: '" + groupFolder + "'");
        }
        Path groupDir = groupsDir.resolve(groupFolder);
        try {
            Files.createDirectories(groupDir);
        } catch (IOException e) {
            throw new ExecutionInfrastructureException("Failed to create group directory " + groupDir + ": " + e.getMessage(), e);
        }
        return groupDir;
    }

    private List<String> buildCommand(ExecutionRequest request,
                                      Path groupDir,
                                      HandoffBundleWriter.HandoffBundle bundle) throws ExecutionInfrastructureException {
        try {
            return commandFactory.command(
                    new SandboxCommandFactory.SandboxLaunch(request, groupDir, bundle.dir(), bundle.inputFile()));
        } catch (RuntimeException e) {
            throw new ExecutionInfrastructureException("Failed to build sandbox command group="
                    + request.groupFolder() + ": " + e.getMessage(), e);
        }
    }

    static boolean isSafeFolderName(String name) {
        return name != null
                && !name.isBlank()
                && !name.equals(".")
                && !name.equals("..")
                && name.indexOf('/') < 0
                && name.indexOf('\\') < 0
                && name.indexOf('\0') < 0;
    }

    private ExecutionOutcome execute(ExecutionRequest request,
                                     List<String> command,
                                     Path groupDir,
                                     byte[] input,
                                     Duration timeout) throws ExecutionInfrastructureException {
        String group = request.groupFolder();
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(groupDir.toFile())
                .redirectErrorStream(false);

        long startNanos = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ExecutionInfrastructureException("Failed to spawn sandbox: " + String.join(" ", command), e);
        }
        log.debug("Sandbox spawned group={} session={} pid={}", group, request.sessionId(), process.pid());

        ioPool.submit(() -> drainStderr(process.getErrorStream(), group));
        // a child that never reads stdin must not hold the caller past the timeout
        Future<?> stdinWrite = ioPool.submit(() -> writeInput(process, input, group));

        OutputCapture capture = new OutputCapture(maxOutputBytes);
        Future<Integer> completion = ioPool.submit(() -> {
            capture.readFrom(process.getInputStream());
            return process.waitFor();
        });

        try {
            int exitCode = completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration elapsed = elapsedSince(startNanos);
            ExecutionResult result = parser.parse(capture.snapshot(), exitCode == 0);
            log.debug("Sandbox exited group={} exitCode={} duration={} truncated={}",
                    group, exitCode, DurationFormat.format(elapsed.toMillis()), capture.isTruncated());
            return new ExecutionOutcome(result, elapsed, false);
        } catch (TimeoutException e) {
            completion.cancel(true);
            stdinWrite.cancel(true);
            terminate(process);
            Duration elapsed = elapsedSince(startNanos);
            log.warn("Sandbox timed out group={} session={} timeout={}", group, request.sessionId(), timeout);
            return new ExecutionOutcome(parser.parse(capture.snapshot(), false), elapsed, true);
        } catch (ExecutionException e) {
            stdinWrite.cancel(true);
            terminate(process);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Reading sandbox output failed group={} msg={}", group, cause.getMessage());
            return new ExecutionOutcome(parser.parse(capture.snapshot(), false), elapsedSince(startNanos), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            completion.cancel(true);
            stdinWrite.cancel(true);
            terminate(process);
            throw new ExecutionInfrastructureException("Interrupted while waiting for sandbox group=" + group, e);
        }
    }

    private void writeInput(Process process, byte[] input, String group) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
            stdin.flush();
        } catch (IOException e) {
            // the process may exit without reading its input; its output still decides the result
            log.warn("Could not write request to sandbox stdin group={} msg={}", group, e.getMessage());
        }
    }

    private void drainStderr(InputStream stderr, String group) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("sandbox stderr group={} {}", group, line);
            }
        } catch (IOException e) {
            log.debug("sandbox stderr closed group={} msg={}", group, e.getMessage());
        }
    }

    private void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(KILL_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
