package com.eyelevel.reportjobs.service.storage;

import com.eyelevel.reportjobs.config.ReportJobsProperties;
import com.eyelevel.reportjobs.exception.ReportGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;

/**
 * Writes generated artifacts to S3. Keys are write-once: an upload never replaces an existing object.
 */
@Slf4j
@Service
public class S3StorageService {

    private final S3Client s3Client;
    private final ReportJobsProperties.Storage storage;

    public S3StorageService(final S3Client s3Client, final ReportJobsProperties properties) {
        this.s3Client = s3Client;
        this.storage = properties.storage();
        log.info("S3StorageService initialized for bucket '{}' with key prefix '{}' and encryption '{}'.",
                 storage.bucket(), storage.keyPrefix(), storage.sseMode());
    }

    public String bucket() {
        return storage.bucket();
    }

    /**
     * Uploads {@code content} to {@code key} unless an object already exists there.
     *
     * @return the bucket the object was written to.
     * @throws ReportGenerationException if the key is taken or the upload fails.
     */
    public String putIfAbsent(final String key, final byte[] content, final String contentType) {
        final PutObjectRequest.Builder request = PutObjectRequest.builder()
                                                                 .bucket(storage.bucket())
                                                                 .key(key)
                                                                 .contentType(contentType)
                                                                 .contentLength((long) content.length)
                                                                 .ifNoneMatch("*");
        if (storage.usesKms()) {
            request.serverSideEncryption(ServerSideEncryption.AWS_KMS).ssekmsKeyId(storage.kmsKeyId());
        } else {
            request.serverSideEncryption(ServerSideEncryption.AES256);
        }

        try {
            s3Client.putObject(request.build(), RequestBody.fromBytes(content));
        } catch (S3Exception e) {
            if (e.statusCode() == HttpStatus.PRECONDITION_FAILED.value()) {
                throw new ReportGenerationException("An object already exists at key " + key, e);
            }
            throw new ReportGenerationException("Failed to upload " + key + ": " + e.getMessage(), e);
        }
        log.info("Uploaded {} bytes to S3 key: {}", content.length, key);
        return storage.bucket();
    }
}
