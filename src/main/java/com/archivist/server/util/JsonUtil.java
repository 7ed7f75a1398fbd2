package com.archivist.server.util;

import com.archivist.server.exception.JsonException;
import com.archivist.server.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public static String serializeToString(Object value) throws JsonException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonException("serializeToString failed. value is %s".formatted(value), e);
        }
    }

    public static JsonNode parseJsonTree(String json) throws ValidationException, JsonException {
        if (StringUtils.isBlank(json)) {
            throw new ValidationException("parseJsonTree failed. json is blank");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseJsonTree failed. json is %s".formatted(
                    StringUtils.abbreviate(json, 200)), e);
        }
    }

    public static <T> T convertNode(JsonNode jsonNode, Class<T> clazz) throws JsonException {
        if (ObjectUtils.isEmpty(jsonNode)) {
            throw new JsonException("convertNode failed. jsonNode is null");
        }
        try {
            return objectMapper.treeToValue(jsonNode, clazz);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JsonException("convertNode failed. target class is %s".formatted(clazz.getSimpleName()), e);
        }
    }

    public static Map<String, Object> readYamlFile(Path yamlFile) throws JsonException {
        try (BufferedReader reader = Files.newBufferedReader(yamlFile)) {
            Map<String, Object> result = yamlMapper.readValue(reader, new TypeReference<>() {});
            return ObjectUtils.defaultIfNull(result, Map.of());
        } catch (IOException e) {
            throw new JsonException("readYamlFile failed. yamlFile is %s".formatted(yamlFile), e);
        }
    }

    public static Map<String, Object> parseYamlString(String yaml) throws JsonException {
        try {
            Map<String, Object> result = yamlMapper.readValue(yaml, new TypeReference<>() {});
            return ObjectUtils.defaultIfNull(result, Map.of());
        } catch (JsonProcessingException e) {
            throw new JsonException("parseYamlString failed.", e);
        }
    }
}
