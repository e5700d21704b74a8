package com.eyelevel.ocrprocessor.common.json;

/**
 * Defines the contract for parsing JSON data into Java objects.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.ocrprocessor.exception.json.JsonParsingException if an error occurs during
     *                                                                       JSON parsing.
     */
    <T> T parseObject(String json, Class<T> valueType);
}
