package com.autoreports.sync.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One column assignment. {@code column} always comes from the fixed registry column set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnValue {
    private String column;
    private Object value;
}
