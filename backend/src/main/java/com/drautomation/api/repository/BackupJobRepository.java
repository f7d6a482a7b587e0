package com.drautomation.api.repository;

import com.drautomation.api.model.entity.BackupJob;
import com.drautomation.api.model.enums.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface BackupJobRepository extends JpaRepository<BackupJob, String> {

    List<BackupJob> findAllByOrderByCreatedAtDesc();

    List<BackupJob> findByStatusOrderByCreatedAtDesc(JobStatus status);

    List<BackupJob> findByScheduleIdOrderByCreatedAtDesc(String scheduleId);

    long countByStatus(JobStatus status);

    @Query("SELECT j FROM BackupJob j WHERE j.status IN :statuses AND j.completedAt >= :since")
    List<BackupJob> findFinishedSince(@Param("statuses") Collection<JobStatus> statuses, @Param("since") Instant since);

    List<BackupJob> findByStatusIn(Collection<JobStatus> statuses);

    /**
     * Moves the row to {@code newStatus} only while it is still in {@code currentStatus}.
     *
     * @return the number of rows changed, 0 when another writer changed the status first
     */
    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE BackupJob j SET j.status = :newStatus WHERE j.id = :id AND j.status = :currentStatus")
    int updateStatus(@Param("id") String id,
                     @Param("currentStatus") JobStatus currentStatus,
                     @Param("newStatus") JobStatus newStatus);
}
