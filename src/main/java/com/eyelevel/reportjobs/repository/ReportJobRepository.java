package com.eyelevel.reportjobs.repository;

import com.eyelevel.reportjobs.model.JobStatus;
import com.eyelevel.reportjobs.model.ReportJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link ReportJob} entity.
 */
@Repository
public interface ReportJobRepository extends JpaRepository<ReportJob, String> {

    /**
     * Atomically moves a job to a new status, but only if its current status is one of {@code from}.
     * {@code updatedAt} keeps the later of its stored value and {@code now}, so it never moves backwards
     * even when writers' clocks disagree.
     *
     * @return The number of rows updated: 1 if the transition was applied, 0 if it was rejected or the
     * job does not exist.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ReportJob j
               SET j.status = :to,
                   j.errorMessage = :errorMessage,
                   j.version = j.version + 1,
                   j.updatedAt = CASE WHEN j.updatedAt > :now THEN j.updatedAt ELSE :now END
             WHERE j.id = :id AND j.status IN :from
            """)
    int transition(@Param("id") String id,
                   @Param("from") Collection<JobStatus> from,
                   @Param("to") JobStatus to,
                   @Param("errorMessage") String errorMessage,
                   @Param("now") Instant now);

    /**
     * Used by {@link com.eyelevel.reportjobs.scheduler.StaleJobScheduler} to find jobs that stopped moving.
     */
    @Query("SELECT j.id FROM ReportJob j WHERE j.status = :status AND j.updatedAt < :threshold ORDER BY j.updatedAt")
    List<String> findIdsByStatusAndUpdatedAtBefore(@Param("status") JobStatus status,
                                                   @Param("threshold") Instant threshold);

    @Query("SELECT j.id FROM ReportJob j WHERE j.expiresAt < :now")
    List<String> findExpiredIds(@Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM ReportJob j WHERE j.id IN :ids")
    int deleteAllByIdIn(@Param("ids") Collection<String> ids);
}
