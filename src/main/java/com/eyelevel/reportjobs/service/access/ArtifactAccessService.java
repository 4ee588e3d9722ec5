package com.eyelevel.reportjobs.service.access;

import com.eyelevel.reportjobs.exception.ArtifactAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Issues pre-signed download URLs for stored artifacts. Handles are never stored: every call signs a new one.
 * <p>
 * Signatures carry a one-second timestamp, so each request also carries a random {@value #ISSUE_ID_PARAM}
 * query parameter; it is covered by the signature and ignored by S3.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtifactAccessService {

    static final String ISSUE_ID_PARAM = "issue-id";

    private final S3Presigner s3Presigner;
    private final Clock clock;

    /**
     * @throws ArtifactAccessException if the URL cannot be signed.
     */
    public AccessHandle issue(final String container, final String storageKey, final Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Access handle TTL must be positive, got " + ttl);
        }
        log.debug("Generating pre-signed download URL for S3 key: {}", storageKey);
        final Instant issuedAt = clock.instant();
        try {
            final GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                    .bucket(container)
                    .key(storageKey)
                    .overrideConfiguration(o -> o.putRawQueryParameter(ISSUE_ID_PARAM, UUID.randomUUID().toString()))
                    .build();
            final GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                                                                                  .signatureDuration(ttl)
                                                                                  .getObjectRequest(getObjectRequest)
                                                                                  .build();
            final PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(presignRequest);
            return new AccessHandle(presigned.url().toString(), ttl.toSeconds(), issuedAt.plus(ttl));
        } catch (SdkException e) {
            throw new ArtifactAccessException(storageKey, e);
        }
    }
}
