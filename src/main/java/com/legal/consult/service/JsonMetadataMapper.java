package com.legal.consult.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts free-form metadata maps to and from the JSON text columns.
 */
@Component
public class JsonMetadataMapper {

    private static final Logger log = LoggerFactory.getLogger(JsonMetadataMapper.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonMetadataMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable as JSON", e);
        }
    }

    public Map<String, Object> read(String json) {
        if (StringUtils.isBlank(json)) return Collections.emptyMap();
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable metadata column: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    public Map<String, String> readStrings(String json) {
        if (StringUtils.isBlank(json)) return Collections.emptyMap();
        try {
            return mapper.readValue(json, STRING_MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable template variables: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
