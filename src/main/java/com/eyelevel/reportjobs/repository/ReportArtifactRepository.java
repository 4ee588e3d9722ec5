package com.eyelevel.reportjobs.repository;

import com.eyelevel.reportjobs.model.ReportArtifact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ReportArtifactRepository extends JpaRepository<ReportArtifact, Long> {

    List<ReportArtifact> findAllByJobId(String jobId);

    @Modifying
    @Query("DELETE FROM ReportArtifact a WHERE a.jobId IN :jobIds")
    int deleteAllByJobIdIn(@Param("jobIds") Collection<String> jobIds);
}
