package com.drautomation.api.repository;

import com.drautomation.api.model.entity.BackupSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BackupScheduleRepository extends JpaRepository<BackupSchedule, String> {

    List<BackupSchedule> findAllByOrderByCreatedAtAsc();

    List<BackupSchedule> findByEnabledTrue();

    Optional<BackupSchedule> findFirstByEnabledTrueAndNextRunNotNullOrderByNextRunAsc();

    boolean existsByName(String name);
}
