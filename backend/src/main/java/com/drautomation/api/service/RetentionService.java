package com.drautomation.api.service;

import com.drautomation.api.client.StorageClient;
import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.RetentionPolicy;
import com.drautomation.api.model.enums.RetentionTier;
import com.drautomation.api.repository.BackupMetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Prunes the backup catalog: newest N per tier, then max age, then total size.
 * MANUAL backups are never deleted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionService {

    private final BackupMetadataRepository backupMetadataRepository;
    private final StorageClient storageClient;
    private final AutomationProperties properties;
    private final Clock clock;

    public RetentionPolicy defaultPolicy() {
        AutomationProperties.Retention retention = properties.getBackup().getRetention();
        return RetentionPolicy.builder()
                .keepDaily(retention.getKeepDaily())
                .keepWeekly(retention.getKeepWeekly())
                .keepMonthly(retention.getKeepMonthly())
                .keepYearly(retention.getKeepYearly())
                .maxAgeDays(retention.getMaxAgeDays())
                .maxSizeBytes(retention.getMaxSizeBytes())
                .build();
    }

    /**
     * @return ids of the deleted backups
     */
    @Transactional
    public List<String> applyRetention(RetentionPolicy policy) {
        List<BackupMetadata> catalog = backupMetadataRepository.findAllByOrderByCompletedAtDesc();
        Set<String> expired = new LinkedHashSet<>();

        expired.addAll(beyondCount(catalog, RetentionTier.DAILY, policy.getKeepDaily()));
        expired.addAll(beyondCount(catalog, RetentionTier.WEEKLY, policy.getKeepWeekly()));
        expired.addAll(beyondCount(catalog, RetentionTier.MONTHLY, policy.getKeepMonthly()));
        expired.addAll(beyondCount(catalog, RetentionTier.YEARLY, policy.getKeepYearly()));

        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(policy.getMaxAgeDays()));
        for (BackupMetadata backup : catalog) {
            if (backup.getRetentionTier() != RetentionTier.MANUAL && backup.getCompletedAt().isBefore(cutoff)) {
                expired.add(backup.getId());
            }
        }

        long totalSize = catalog.stream()
                .filter(b -> !expired.contains(b.getId()))
                .mapToLong(BackupMetadata::getSizeBytes)
                .sum();
        // Oldest first
        for (int i = catalog.size() - 1; i >= 0 && totalSize > policy.getMaxSizeBytes(); i--) {
            BackupMetadata backup = catalog.get(i);
            if (backup.getRetentionTier() == RetentionTier.MANUAL || expired.contains(backup.getId())) {
                continue;
            }
            expired.add(backup.getId());
            totalSize -= backup.getSizeBytes();
        }

        List<String> deleted = new ArrayList<>();
        for (BackupMetadata backup : catalog) {
            if (expired.contains(backup.getId())) {
                delete(backup);
                deleted.add(backup.getId());
            }
        }
        if (!deleted.isEmpty()) {
            log.info("Retention removed {} backups: {}", deleted.size(), deleted);
        }
        return deleted;
    }

    private List<String> beyondCount(List<BackupMetadata> newestFirst, RetentionTier tier, int keep) {
        return newestFirst.stream()
                .filter(b -> b.getRetentionTier() == tier)
                .skip(Math.max(keep, 0))
                .map(BackupMetadata::getId)
                .toList();
    }

    private void delete(BackupMetadata backup) {
        try {
            storageClient.deleteObject(backup.getLocation().getRegion(), backup.getLocation().getBucket(),
                    backup.getStorageKey());
        } catch (Exception e) {
            // Metadata is still removed; an orphaned object only costs storage
            log.warn("Failed to delete artifact {} of backup {}: {}", backup.getStorageKey(), backup.getId(),
                    e.getMessage());
        }
        backupMetadataRepository.delete(backup);
    }
}
