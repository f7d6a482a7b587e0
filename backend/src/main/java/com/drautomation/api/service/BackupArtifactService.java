package com.drautomation.api.service;

import com.drautomation.api.client.StorageClient;
import com.drautomation.api.exception.AutomationException;
import com.drautomation.api.model.entity.BackupMetadata;
import com.drautomation.api.model.entity.StorageLocation;
import com.drautomation.api.model.enums.ErrorCategory;
import com.drautomation.api.model.payload.BackupPayload;
import com.drautomation.api.security.BackupEncryptor;
import com.drautomation.api.util.Checksums;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Converts backup payloads to and from stored artifacts: JSON, gzip, then optional AES-256-GCM.
 * The recorded checksum always covers the bytes as stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupArtifactService {

    private final StorageClient storageClient;
    private final BackupEncryptor encryptor;
    private final ObjectMapper objectMapper;

    public static String artifactKey(StorageLocation location, String backupId) {
        String prefix = location.getPrefix() != null ? location.getPrefix() : "";
        if (!prefix.isEmpty() && !prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        return prefix + backupId;
    }

    public byte[] serialize(BackupPayload payload) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            objectMapper.writeValue(gzip, payload);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize backup " + payload.getBackupId(), e);
        }
        return buffer.toByteArray();
    }

    public BackupPayload deserialize(byte[] compressed) {
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzip, BackupPayload.class);
        } catch (IOException e) {
            throw new AutomationException(AutomationException.CODE_CHECKSUM_MISMATCH, ErrorCategory.INTEGRITY,
                    "Backup artifact is not readable: " + e.getMessage(), e);
        }
    }

    /**
     * Downloads the artifact of {@code metadata}, checks its checksum, decrypts and deserializes it.
     */
    public LoadedArtifact load(BackupMetadata metadata) {
        StorageLocation location = metadata.getLocation();
        byte[] stored = storageClient.getObject(location.getRegion(), location.getBucket(), metadata.getStorageKey());
        if (stored == null) {
            throw AutomationException.integrity(AutomationException.CODE_ARTIFACT_NOT_FOUND,
                    "Backup artifact not found: " + metadata.getStorageKey());
        }

        String actualChecksum = Checksums.sha256(stored);
        if (!actualChecksum.equals(metadata.getChecksum())) {
            throw AutomationException.integrity(AutomationException.CODE_CHECKSUM_MISMATCH,
                    "Checksum mismatch for backup " + metadata.getId()
                            + ": expected " + metadata.getChecksum() + ", got " + actualChecksum);
        }

        byte[] compressed = metadata.getEncryption() != null && metadata.getEncryption().isEnabled()
                ? encryptor.decrypt(stored)
                : stored;
        BackupPayload payload = deserialize(compressed);
        log.debug("Loaded backup {} ({} tables, {} files)", metadata.getId(),
                payload.getTables().size(), payload.getFiles().size());
        return new LoadedArtifact(payload, actualChecksum, stored.length);
    }

    @Getter
    @AllArgsConstructor
    public static class LoadedArtifact {
        private final BackupPayload payload;
        private final String checksum;
        private final long storedSize;
    }
}
