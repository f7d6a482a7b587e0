package com.drautomation.api.repository;

import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.RetentionTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BackupMetadataRepository extends JpaRepository<BackupMetadata, String> {

    List<BackupMetadata> findAllByOrderByCompletedAtDesc();

    List<BackupMetadata> findByRetentionTierOrderByCompletedAtDesc(RetentionTier retentionTier);

    List<BackupMetadata> findByKindOrderByCompletedAtDesc(BackupKind kind);

    Optional<BackupMetadata> findFirstByOrderByCompletedAtDesc();

    Optional<BackupMetadata> findFirstByKindOrderByCompletedAtDesc(BackupKind kind);

    Optional<BackupMetadata> findBySourceJobId(String sourceJobId);

    @Query("SELECT COALESCE(SUM(m.sizeBytes), 0) FROM BackupMetadata m")
    long sumSizeBytes();
}
