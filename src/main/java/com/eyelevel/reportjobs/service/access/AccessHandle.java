package com.eyelevel.reportjobs.service.access;

import java.time.Instant;

/**
 * A time-limited link to one stored artifact.
 *
 * @param url       Pre-signed GET URL.
 * @param expiresIn Validity window in seconds.
 * @param expiresAt The instant the URL stops working.
 */
public record AccessHandle(String url, long expiresIn, Instant expiresAt) {
}
