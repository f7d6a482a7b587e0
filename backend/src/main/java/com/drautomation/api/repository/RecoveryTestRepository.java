package com.drautomation.api.repository;

import com.drautomation.api.model.entity.RecoveryTest;
import com.drautomation.api.model.enums.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecoveryTestRepository extends JpaRepository<RecoveryTest, String> {

    List<RecoveryTest> findByArchivedFalseOrderByCreatedAtDesc();

    List<RecoveryTest> findByArchivedTrueOrderByCompletedAtDesc(Pageable pageable);

    List<RecoveryTest> findByArchivedTrue();

    long countByStatus(JobStatus status);
}
