package com.drautomation.api.repository;

import com.drautomation.api.model.entity.ReplicationJob;
import com.drautomation.api.model.enums.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ReplicationJobRepository extends JpaRepository<ReplicationJob, String> {

    List<ReplicationJob> findAllByOrderByCreatedAtDesc();

    List<ReplicationJob> findByStatus(JobStatus status);

    List<ReplicationJob> findByBackupIdOrderByCreatedAtDesc(String backupId);

    long countByStatus(JobStatus status);

    /**
     * Moves the row to {@code newStatus} only while it is still in {@code currentStatus}.
     *
     * @return the number of rows changed, 0 when another writer changed the status first
     */
    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE ReplicationJob j SET j.status = :newStatus WHERE j.id = :id AND j.status = :currentStatus")
    int updateStatus(@Param("id") String id,
                     @Param("currentStatus") JobStatus currentStatus,
                     @Param("newStatus") JobStatus newStatus);
}
