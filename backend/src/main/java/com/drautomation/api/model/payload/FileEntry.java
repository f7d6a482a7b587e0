package com.drautomation.api.model.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileEntry {

    // Path relative to its backup root
    private String path;
    private long sizeBytes;
    private Instant lastModified;
    private String sha256;
    @ToString.Exclude
    private byte[] content;
}
