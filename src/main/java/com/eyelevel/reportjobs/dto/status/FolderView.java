package com.eyelevel.reportjobs.dto.status;

/**
 * The storage location grouping every artifact of one job.
 */
public record FolderView(String container, String prefix, String description) {
}
