package io.sandcron.internal.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sandcron.core.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps one JSON file per completed run under {@code <logsDir>/<group>/}. Best-effort.
 */
public class RunOutputJournal {
    private static final Logger log = LoggerFactory.getLogger(RunOutputJournal.class);

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path logsDir;
    private final ObjectMapper objectMapper;

    public RunOutputJournal(Path logsDir, ObjectMapper objectMapper) {
        this.logsDir = Objects.requireNonNull(logsDir, "logsDir must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @return the written file, or empty if it could not be written
     */
    public Optional<Path> record(String groupFolder, String sessionId, ExecutionResult result, Instant at) {
        Objects.requireNonNull(groupFolder, "groupFolder must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(at, "at must not be null");

        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("timestamp", at.toString());
        entry.put("group_folder", groupFolder);
        entry.put("session_id", sessionId);
        entry.put("status", result.status());
        entry.put("result", result.result());
        entry.put("error", result.error());
        entry.put("new_session_id", result.newSessionId());

        Path dir = logsDir.resolve(groupFolder);
        Path file = dir.resolve("run_" + (sessionId != null ? sessionId : "interactive") + "_" + FILE_STAMP.format(at) + ".json");
        try {
            Files.createDirectories(dir);
            Files.write(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(entry));
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Could not write run journal group={} session={} msg={}", groupFolder, sessionId, e.getMessage());
            return Optional.empty();
        }
    }
}
