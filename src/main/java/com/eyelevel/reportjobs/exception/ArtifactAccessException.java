package com.eyelevel.reportjobs.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a download link could not be issued for a stored artifact.
 */
@Getter
public class ArtifactAccessException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3377920117452061864L;

    private final String storageKey;

    public ArtifactAccessException(String storageKey, Throwable cause) {
        super("Failed to issue an access handle for " + storageKey + ": " + cause.getMessage(), cause);
        this.storageKey = storageKey;
    }
}
