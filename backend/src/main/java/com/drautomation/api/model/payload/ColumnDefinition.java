package com.drautomation.api.model.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Column as reported by JDBC metadata. {@code jdbcType} is a {@link java.sql.Types} constant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDefinition {

    private String name;
    private String typeName;
    private int jdbcType;
    private Integer size;
    private Integer scale;
    private boolean nullable;
}
