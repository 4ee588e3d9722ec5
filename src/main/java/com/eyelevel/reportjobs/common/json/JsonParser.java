package com.eyelevel.reportjobs.common.json;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Defines the contract for reading JSON documents whose shape is not bound to a Java type, such as the
 * assessment payloads stored with each job.
 */
public interface JsonParser {

    /**
     * Parses a JSON document into a tree.
     *
     * @param json The JSON data as a string.
     * @return The root node of the document.
     * @throws com.eyelevel.reportjobs.exception.json.JsonParsingException if the data is not valid JSON.
     */
    JsonNode parseTree(String json);
}
