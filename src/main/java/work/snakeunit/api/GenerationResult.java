package work.snakeunit.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Summary of one {@link TestGenerator} run: what was emitted, what was skipped and the warnings
 * collected on the way.
 *
 * @param metadata run facts such as emitted test names and recipe counts
 * @param warnings diagnostics reported while loading and synthesizing, in order
 */
public record GenerationResult(
    Status status,
    Map<String, Object> metadata,
    List<String> warnings,
    Instant startedAt,
    Instant finishedAt
) {
    static final String ERROR_KEY = "error";
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public GenerationResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        warnings = List.copyOf(warnings);
    }

    static GenerationResult success(Map<String, Object> metadata, List<String> warnings, Instant startedAt) {
        return new GenerationResult(Status.SUCCESS, metadata, warnings, startedAt, Instant.now());
    }

    static GenerationResult failure(
        Throwable cause,
        Map<String, Object> metadata,
        List<String> warnings,
        Instant startedAt
    ) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        String message = cause.getMessage();
        meta.put(ERROR_KEY, message == null || message.isBlank() ? cause.getClass().getSimpleName() : message);
        return new GenerationResult(Status.FAILURE, meta, warnings, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Optional<String> error() {
        return Optional.ofNullable(metadata.get(ERROR_KEY)).map(String::valueOf);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.putAll(metadata);
        serializable.put("warnings", warnings);
        serializable.put("elapsedMillis", elapsed().toMillis());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to render run summary", ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
