package com.drautomation.api.client;

import com.drautomation.api.model.payload.FileEntry;

import java.util.List;

/**
 * Application files included in full and files-only backups.
 */
public interface FileStoreClient {

    List<FileEntry> collectFiles();

    /**
     * Writes {@code files} under {@code targetRoot}, or the configured restore root when null.
     *
     * @return number of files written
     */
    int restoreFiles(List<FileEntry> files, String targetRoot);

    boolean isAvailable();
}
