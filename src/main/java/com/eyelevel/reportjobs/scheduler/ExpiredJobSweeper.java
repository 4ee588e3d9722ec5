package com.eyelevel.reportjobs.scheduler;

import com.eyelevel.reportjobs.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Deletes job records past their retention horizon. Stored report files are left to the bucket's own
 * lifecycle rules.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredJobSweeper {

    private final JobStore jobStore;
    private final Clock clock;

    @Scheduled(cron = "${app.reports.store.retention-cron}")
    public void purgeExpiredJobs() {
        final int purged = jobStore.purgeExpired(clock.instant());
        if (purged > 0) {
            log.info("Purged {} job records past their retention period.", purged);
        } else {
            log.debug("No expired job records to purge.");
        }
    }
}
