package com.eyelevel.reportjobs.common.json;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    /**
     * @throws com.eyelevel.reportjobs.exception.json.JsonParsingException if the object cannot be serialized.
     */
    <T> String serialize(T object);
}
