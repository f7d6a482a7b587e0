package com.drautomation.api.model.dto;

import com.drautomation.api.model.entity.EncryptionSettings;
import com.drautomation.api.model.entity.StorageLocation;
import com.drautomation.api.model.enums.RetentionTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-backup settings. Anything left null falls back to {@code automation.backup.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupOptions {

    private String name;
    private String description;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private RetentionTier retentionTier;
    private String scheduleId;
    private boolean automated;
    private Boolean encrypt;
    private StorageLocation storageLocation;
    private EncryptionSettings encryption;
}
