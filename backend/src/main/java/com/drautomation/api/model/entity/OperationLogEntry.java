package com.drautomation.api.model.entity;

import com.drautomation.api.model.enums.LogLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One timestamped line in a job's operation log. Stored as JSON on the owning row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationLogEntry {

    public static final int MAX_ENTRIES = 100;

    private Instant timestamp;
    private LogLevel level;
    private String message;

    /**
     * Returns a new list with {@code entry} appended, keeping only the newest {@link #MAX_ENTRIES}.
     */
    public static List<OperationLogEntry> append(List<OperationLogEntry> logs, OperationLogEntry entry) {
        List<OperationLogEntry> updated = new ArrayList<>(logs != null ? logs : List.of());
        updated.add(entry);
        if (updated.size() > MAX_ENTRIES) {
            updated = new ArrayList<>(updated.subList(updated.size() - MAX_ENTRIES, updated.size()));
        }
        return updated;
    }
}
