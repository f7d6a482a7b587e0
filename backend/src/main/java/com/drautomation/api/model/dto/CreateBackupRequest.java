package com.drautomation.api.model.dto;

import com.drautomation.api.model.enums.BackupKind;
import com.drautomation.api.model.enums.RetentionTier;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBackupRequest {

    @NotNull(message = "Backup kind is required")
    private BackupKind kind;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    private String description;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Tier used by retention. Defaults to MANUAL, which retention never deletes.
     */
    private RetentionTier retentionTier;

    /**
     * Overrides the configured encryption setting for this backup only.
     */
    private Boolean encrypt;

    public BackupOptions toOptions() {
        return BackupOptions.builder()
                .name(name)
                .description(description)
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .retentionTier(retentionTier)
                .encrypt(encrypt)
                .build();
    }
}
