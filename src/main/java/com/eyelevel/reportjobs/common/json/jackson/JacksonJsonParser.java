package com.eyelevel.reportjobs.common.json.jackson;

import com.eyelevel.reportjobs.common.json.JsonParser;
import com.eyelevel.reportjobs.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link JsonParser} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public JsonNode parseTree(final String json) {
        log.debug("Parsing JSON string of {} characters to a tree.", json == null ? 0 : json.length());
        if (json == null) {
            throw new JsonParsingException("Error parsing JSON string", new IllegalArgumentException("null input"));
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Error parsing JSON string to a tree", e);
            throw new JsonParsingException("Error parsing JSON string", e);
        }
    }
}
