package com.eyelevel.reportjobs.service.generation;

import java.util.Map;

/**
 * The rendered bytes of one report and what the generator knows about them.
 */
public record GeneratedReport(byte[] content, String contentType, Map<String, Object> metadata) {

    public GeneratedReport {
        metadata = Map.copyOf(metadata);
    }
}
