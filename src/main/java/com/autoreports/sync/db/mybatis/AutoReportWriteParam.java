package com.autoreports.sync.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoReportWriteParam {
    private String taskName;
    private List<ColumnValue> columns;
    private OffsetDateTime updatedAt;
}
