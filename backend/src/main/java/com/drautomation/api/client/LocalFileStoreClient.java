package com.drautomation.api.client;

import com.drautomation.api.config.AutomationProperties;
import com.drautomation.api.model.payload.FileEntry;
import com.drautomation.api.util.Checksums;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads files from the configured roots on the local filesystem. Restored files keep their
 * root-relative path under the target root.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalFileStoreClient implements FileStoreClient {

    private final AutomationProperties properties;

    @Override
    public List<FileEntry> collectFiles() {
        AutomationProperties.Files config = properties.getBackup().getFiles();
        List<FileEntry> entries = new ArrayList<>();
        for (String root : config.getRoots()) {
            Path rootPath = Paths.get(root).toAbsolutePath().normalize();
            if (!Files.isDirectory(rootPath)) {
                log.warn("Backup file root does not exist: {}", rootPath);
                continue;
            }
            for (Path file : listRegularFiles(rootPath)) {
                try {
                    long size = Files.size(file);
                    if (size > config.getMaxFileSizeBytes()) {
                        log.warn("Skipping {} ({} bytes exceeds limit)", file, size);
                        continue;
                    }
                    byte[] content = Files.readAllBytes(file);
                    entries.add(FileEntry.builder()
                            .path(rootPath.getFileName() + "/" + rootPath.relativize(file).toString().replace('\\', '/'))
                            .sizeBytes(size)
                            .lastModified(Files.getLastModifiedTime(file).toInstant())
                            .sha256(Checksums.sha256(content))
                            .content(content)
                            .build());
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read " + file, e);
                }
            }
        }
        log.info("Collected {} files for backup", entries.size());
        return entries;
    }

    @Override
    public int restoreFiles(List<FileEntry> files, String targetRoot) {
        Path root = Paths.get(targetRoot != null ? targetRoot : properties.getBackup().getFiles().getRestoreRoot())
                .toAbsolutePath().normalize();
        int written = 0;
        for (FileEntry entry : files) {
            Path target = root.resolve(entry.getPath()).normalize();
            if (!target.startsWith(root)) {
                throw new IllegalArgumentException("File path escapes restore root: " + entry.getPath());
            }
            try {
                Files.createDirectories(target.getParent());
                Files.write(target, entry.getContent() != null ? entry.getContent() : new byte[0]);
                written++;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to restore " + target, e);
            }
        }
        log.info("Restored {} files under {}", written, root);
        return written;
    }

    @Override
    public boolean isAvailable() {
        return properties.getBackup().getFiles().getRoots().stream()
                .map(Paths::get)
                .allMatch(Files::isDirectory);
    }

    private List<Path> listRegularFiles(Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + root, e);
        }
    }
}
