package io.sandcron.internal.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sandcron.core.ExecutionInfrastructureException;
import io.sandcron.core.ExecutionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Writes the per-execution handoff bundle the sandboxed agent reads its context from.
 *
 * <p>Layout of {@code <dataDir>/handoff/<group>/<executionId>/}:
 * <pre>
 * current_tasks.json     {"tasks":[{"id":"...","prompt":"...","is_scheduled":true}]}
 * available_groups.json  {"groups":{"&lt;group&gt;":{"name":"&lt;group&gt;","registered":true}}}
 * input.json             the serialized {@link ExecutionRequest}
 * </pre>
 * The directory is created fresh for every execution and never rewritten.
 */
public class HandoffBundleWriter {
    private static final Logger log = LoggerFactory.getLogger(HandoffBundleWriter.class);

    public static final String CURRENT_TASKS_FILE = "current_tasks.json";
    public static final String AVAILABLE_GROUPS_FILE = "available_groups.json";
    public static final String INPUT_FILE = "input.json";

    private static final String INTERACTIVE_TASK_ID = "interactive";

    private final Path handoffRoot;
    private final ObjectMapper objectMapper;

    public HandoffBundleWriter(Path dataDir, ObjectMapper objectMapper) {
        this.handoffRoot = Objects.requireNonNull(dataDir, "dataDir must not be null").resolve("handoff");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * A written bundle.
     *
     * @param dir       bundle directory
     * @param inputFile serialized request inside {@code dir}
     * @param input     serialized request bytes, also fed to the subprocess stdin
     */
    public record HandoffBundle(Path dir, Path inputFile, byte[] input) {
    }

    public HandoffBundle write(ExecutionRequest request) throws ExecutionInfrastructureException {
        Objects.requireNonNull(request, "request must not be null");

        byte[] input;
        byte[] currentTasks;
        byte[] availableGroups;
        try {
            input = objectMapper.writeValueAsBytes(request);
            currentTasks = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(currentTasks(request));
            availableGroups = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(availableGroups(request));
        } catch (JsonProcessingException e) {
            throw new ExecutionInfrastructureException("Failed to serialize execution request: " + e.getOriginalMessage(), e);
        }

        Path dir = handoffRoot.resolve(request.groupFolder()).resolve(UUID.randomUUID().toString());
        try {
            Files.createDirectories(dir.getParent());
            Files.createDirectory(dir);
            Files.write(dir.resolve(CURRENT_TASKS_FILE), currentTasks);
            Files.write(dir.resolve(AVAILABLE_GROUPS_FILE), availableGroups);
            Files.write(dir.resolve(INPUT_FILE), input);
        } catch (IOException e) {
            delete(dir);
            throw new ExecutionInfrastructureException("Failed to write handoff bundle " + dir + ": " + e.getMessage(), e);
        }

        log.debug("Handoff bundle written group={} dir={}", request.groupFolder(), dir);
        return new HandoffBundle(dir, dir.resolve(INPUT_FILE), input);
    }

    /**
     * Best-effort removal of a bundle; failures are logged and otherwise ignored.
     */
    public void delete(HandoffBundle bundle) {
        if (bundle != null) {
            delete(bundle.dir());
        }
    }

    private void delete(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete handoff file path={} msg={}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up handoff bundle dir={} msg={}", dir, e.getMessage());
        }
    }

    private ObjectNode currentTasks(ExecutionRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode task = root.putArray("tasks").addObject();
        task.put("id", request.sessionId() != null ? request.sessionId() : INTERACTIVE_TASK_ID);
        task.put("prompt", request.prompt());
        task.put("is_scheduled", request.scheduledTask());
        return root;
    }

    private ObjectNode availableGroups(ExecutionRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode group = root.putObject("groups").putObject(request.groupFolder());
        group.put("name", request.groupFolder());
        group.put("registered", true);
        return root;
    }
}
