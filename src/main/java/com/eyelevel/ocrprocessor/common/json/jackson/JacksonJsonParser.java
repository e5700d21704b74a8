package com.eyelevel.ocrprocessor.common.json.jackson;

import com.eyelevel.ocrprocessor.common.json.JsonParser;
import com.eyelevel.ocrprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Implementation of the {@link JsonParser} interface backed by the application's Jackson
 * {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @throws JsonParsingException if an error occurs during JSON parsing.
     */
    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        try {
            T result = objectMapper.readValue(json, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON string to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON string", e);
        }
    }
}
