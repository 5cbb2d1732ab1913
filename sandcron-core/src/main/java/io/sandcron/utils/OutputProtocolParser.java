package io.sandcron.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.sandcron.core.ExecutionResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Decodes the captured stdout of an agent subprocess into an {@link ExecutionResult}.
 *
 * <p>Three ordered attempts, the first that succeeds wins:
 * <ol>
 *   <li>the text strictly between the start and end markers, parsed as a result record</li>
 *   <li>the last non-blank line of the output, parsed as a result record</li>
 *   <li>a synthesized result: {@code success} with the raw output, or {@code error} with a generic message</li>
 * </ol>
 *
 * <p>A result record is a JSON object with a textual {@code status} and optional textual
 * {@code result}, {@code new_session_id} and {@code error}. Unknown fields are ignored.
 *
 * <p>Pure function of its inputs: no I/O, no clock.
 */
public final class OutputProtocolParser {

    public static final String DEFAULT_START_MARKER = "---SANDCRON_OUTPUT_START---";
    public static final String DEFAULT_END_MARKER = "---SANDCRON_OUTPUT_END---";
    public static final String GENERIC_FAILURE_MESSAGE = "Sandbox execution failed";

    private final ObjectReader reader;
    private final String startMarker;
    private final String endMarker;

    public OutputProtocolParser() {
        this(new ObjectMapper());
    }

    public OutputProtocolParser(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_START_MARKER, DEFAULT_END_MARKER);
    }

    public OutputProtocolParser(ObjectMapper objectMapper, String startMarker, String endMarker) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        if (startMarker == null || startMarker.isEmpty()) {
            throw new IllegalArgumentException("startMarker must not be empty");
        }
        if (endMarker == null || endMarker.isEmpty()) {
            throw new IllegalArgumentException("endMarker must not be empty");
        }
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.startMarker = startMarker;
        this.endMarker = endMarker;
    }

    public String startMarker() {
        return startMarker;
    }

    public String endMarker() {
        return endMarker;
    }

    /**
     * @param output  full captured output; null is treated as empty
     * @param success whether the subprocess exited successfully
     */
    public ExecutionResult parse(String output, boolean success) {
        String text = output == null ? "" : output;

        Optional<ExecutionResult> marked = extractMarkedContent(text).flatMap(this::parseRecord);
        if (marked.isPresent()) {
            return marked.get();
        }

        Optional<ExecutionResult> lastLine = lastNonBlankLine(text).flatMap(this::parseRecord);
        if (lastLine.isPresent()) {
            return lastLine.get();
        }

        return success
                ? ExecutionResult.success(text)
                : ExecutionResult.error(GENERIC_FAILURE_MESSAGE);
    }

    /**
     * Text strictly between the first start marker and the first end marker.
     * Empty when either is missing or the end marker comes first.
     */
    public Optional<String> extractMarkedContent(String output) {
        if (output == null) {
            return Optional.empty();
        }
        int start = output.indexOf(startMarker);
        int end = output.indexOf(endMarker);
        if (start < 0 || end < 0 || start >= end) {
            return Optional.empty();
        }
        int contentStart = start + startMarker.length();
        if (contentStart > end) {
            // markers overlap
            return Optional.empty();
        }
        return Optional.of(output.substring(contentStart, end));
    }

    /**
     * Parse a single result record. Empty when the candidate is not a well-formed record.
     */
    public Optional<ExecutionResult> parseRecord(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = reader.readTree(candidate.trim());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        JsonNode status = node.get("status");
        if (status == null || !status.isTextual()) {
            return Optional.empty();
        }
        if (!isTextOrAbsent(node.get("result"))
                || !isTextOrAbsent(node.get("new_session_id"))
                || !isTextOrAbsent(node.get("error"))) {
            return Optional.empty();
        }

        return Optional.of(new ExecutionResult(
                status.asText(),
                textOrNull(node.get("result")),
                textOrNull(node.get("new_session_id")),
                textOrNull(node.get("error"))
        ));
    }

    private static Optional<String> lastNonBlankLine(String text) {
        String last = null;
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) {
                last = line;
            }
        }
        return last == null ? Optional.empty() : Optional.of(last.trim());
    }

    private static boolean isTextOrAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isTextual();
    }

    private static String textOrNull(JsonNode node) {
        return (node == null || node.isNull()) ? null : node.asText();
    }
}
