package com.drautomation.api.client;

import com.drautomation.api.config.AutomationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Snapshots Spring environment properties under the configured prefixes. Secret-looking values
 * are masked, and restored snapshots are written as a properties file for review.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentConfigurationSnapshotClient implements ConfigurationSnapshotClient {

    static final String MASK = "******";
    private static final String[] SECRET_MARKERS = {"password", "secret", "key", "token", "credential"};

    private final ConfigurableEnvironment environment;
    private final AutomationProperties properties;

    @Override
    public Map<String, String> captureSnapshot() {
        Map<String, String> snapshot = new TreeMap<>();
        for (PropertySource<?> source : environment.getPropertySources()) {
            if (!(source instanceof EnumerablePropertySource)) {
                continue;
            }
            for (String name : ((EnumerablePropertySource<?>) source).getPropertyNames()) {
                if (snapshot.containsKey(name) || !matchesPrefix(name)) {
                    continue;
                }
                String value = environment.getProperty(name);
                if (value != null) {
                    snapshot.put(name, isSecret(name) ? MASK : value);
                }
            }
        }
        log.debug("Captured {} configuration properties", snapshot.size());
        return snapshot;
    }

    @Override
    public String restoreSnapshot(Map<String, String> snapshot, String backupId) {
        Path directory = Paths.get(properties.getBackup().getConfiguration().getRestoreDirectory());
        Path target = directory.resolve(backupId + ".properties");
        Properties props = new Properties();
        props.putAll(snapshot);
        try {
            Files.createDirectories(directory);
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                props.store(writer, "Configuration restored from backup " + backupId);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write configuration snapshot " + target, e);
        }
        log.info("Wrote configuration snapshot of backup {} to {}", backupId, target);
        return target.toString();
    }

    private boolean matchesPrefix(String name) {
        return properties.getBackup().getConfiguration().getPrefixes().stream()
                .anyMatch(prefix -> name.equals(prefix) || name.startsWith(prefix + "."));
    }

    static boolean isSecret(String name) {
        String lower = name.toLowerCase();
        for (String marker : SECRET_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
