package com.eyelevel.reportjobs.service.storage;

import com.eyelevel.reportjobs.model.ArtifactType;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds blob keys for generated artifacts. Every key lives under a folder that contains the job id, so keys
 * are never shared between jobs.
 */
public final class StorageKeys {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
                                                                        .withZone(ZoneOffset.UTC);

    private StorageKeys() {
    }

    /**
     * Lowercases the company label and replaces every character outside {@code [a-z0-9_-]} with {@code _}.
     */
    public static String safeCompany(final String company) {
        if (company == null || company.isBlank()) {
            return "unknown";
        }
        return company.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
    }

    /**
     * @return {@code "{prefix}{safe_company}/{jobId}/"}
     */
    public static String folderPrefix(final String keyPrefix, final String company, final String jobId) {
        final String prefix = keyPrefix == null ? "" : keyPrefix;
        return prefix + safeCompany(company) + "/" + jobId + "/";
    }

    /**
     * @return {@code "{folder}{type}_report_{yyyyMMdd_HHmmss}.pdf"}, the timestamp in UTC.
     */
    public static String artifactKey(final String folder, final ArtifactType type, final Instant generatedAt) {
        return folder + type.wireName() + "_report_" + TIMESTAMP.format(generatedAt) + ".pdf";
    }

    /**
     * The folder part of an artifact key, up to and including its last {@code /}.
     */
    public static String folderOf(final String storageKey) {
        final int slash = storageKey.lastIndexOf('/');
        return slash < 0 ? "" : storageKey.substring(0, slash + 1);
    }
}
