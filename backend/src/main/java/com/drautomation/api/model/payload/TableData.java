package com.drautomation.api.model.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rows of one table. Temporal values are ISO-8601 strings, binary values base64.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableData {

    private String table;
    @Builder.Default
    private List<String> columns = new ArrayList<>();
    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();

    public long rowCount() {
        return rows != null ? rows.size() : 0;
    }
}
