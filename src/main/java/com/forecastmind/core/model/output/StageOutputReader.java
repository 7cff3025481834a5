package com.forecastmind.core.model.output;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads raw stage outputs into their canonical schema records.
 * <p>
 * Outputs are interpreted against {@link #SCHEMA_VERSION}; each stage has exactly one shape,
 * so consumers never guess at alternative field names.
 */
public class StageOutputReader {

    public static final int SCHEMA_VERSION = 1;

    private final ObjectMapper mapper;

    public StageOutputReader() {
        this.mapper = JsonMapper.builder()
                .addModule(new ParameterNamesModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .build();
    }

    /**
     * @throws IllegalArgumentException if the output cannot be coerced into {@code schema}
     */
    public <T> T read(Map<String, Object> output, Class<T> schema) {
        return mapper.convertValue(output, schema);
    }

    /** Copies {@code list} without its null elements; a null list reads as empty. */
    public static <T> List<T> withoutNulls(List<T> list) {
        return list == null ? List.of() : list.stream().filter(Objects::nonNull).toList();
    }
}
