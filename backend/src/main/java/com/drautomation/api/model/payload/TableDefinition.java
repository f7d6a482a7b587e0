package com.drautomation.api.model.payload;

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
public class TableDefinition {

    private String name;
    @Builder.Default
    private List<ColumnDefinition> columns = new ArrayList<>();
    @Builder.Default
    private List<String> primaryKey = new ArrayList<>();

    public ColumnDefinition findColumn(String column) {
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(column))
                .findFirst()
                .orElse(null);
    }
}
