package com.waypoint.core.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.waypoint.core.enhancement.FeatureTask;
import com.waypoint.core.error.SchemaValidationException;
import com.waypoint.core.model.ApprovedStack;
import com.waypoint.core.model.DeferredFeature;
import com.waypoint.core.model.GuardrailConfig;
import com.waypoint.core.model.ProgressTracker;
import com.waypoint.core.model.TaskGraph;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON codec for the state files.
 * <p>
 * Keys are snake_case, unknown fields and unknown enum values are rejected,
 * and output is stable (sorted map keys, ISO instants) so identical state
 * always serializes to identical bytes.
 */
@Component
public class StateMapper {

    private static final TypeReference<List<DeferredFeature>> DEFERRED_LIST = new TypeReference<>() {};
    private static final TypeReference<List<FeatureTask>> FEATURE_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public StateMapper() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public TaskGraph readGraph(Path file) {
        return read(file, TaskGraph.class);
    }

    public ProgressTracker readTracker(Path file) {
        return read(file, ProgressTracker.class);
    }

    public List<DeferredFeature> readDeferredFeatures(Path file) {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return mapper.readValue(Files.readAllBytes(file), DEFERRED_LIST);
        } catch (IOException e) {
            throw schemaError(file, e);
        }
    }

    /**
     * Reads an enhancement's proposed tasks: a JSON array of feature tasks.
     */
    public List<FeatureTask> readFeatureTasks(Path file) {
        if (!Files.exists(file)) {
            throw new SchemaValidationException(file.getFileName().toString(), "file not found", null);
        }
        try {
            List<FeatureTask> tasks = mapper.readValue(Files.readAllBytes(file), FEATURE_LIST);
            return tasks == null ? List.of() : tasks;
        } catch (IOException e) {
            throw schemaError(file, e);
        }
    }

    public GuardrailConfig readGuardrails(Path file) {
        return Files.exists(file) ? read(file, GuardrailConfig.class) : GuardrailConfig.defaults();
    }

    public ApprovedStack readApprovedStack(Path file) {
        return Files.exists(file) ? read(file, ApprovedStack.class) : ApprovedStack.empty();
    }

    public byte[] toBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public String toJson(Object value) {
        return new String(toBytes(value), StandardCharsets.UTF_8);
    }

    private <T> T read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            throw new SchemaValidationException(file.getFileName().toString(), "file not found", null);
        }
        try {
            T value = mapper.readValue(Files.readAllBytes(file), type);
            if (value == null) {
                throw new SchemaValidationException(file.getFileName().toString(), "file is empty", null);
            }
            return value;
        } catch (IOException e) {
            throw schemaError(file, e);
        }
    }

    private static SchemaValidationException schemaError(Path file, IOException e) {
        return new SchemaValidationException(file.getFileName().toString(), describe(e), e);
    }

    static String describe(IOException e) {
        if (e instanceof UnrecognizedPropertyException unknown) {
            return "unknown field '" + unknown.getPropertyName() + "' at " + location(unknown);
        }
        if (e instanceof JsonMappingException mapping) {
            String where = location(mapping);
            return mapping.getOriginalMessage() + (where.isEmpty() ? "" : " at " + where);
        }
        if (e instanceof JsonProcessingException processing) {
            return processing.getOriginalMessage();
        }
        return e.getMessage();
    }

    private static String location(JsonMappingException e) {
        return e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."))
                .replace(".[", "[");
    }
}
