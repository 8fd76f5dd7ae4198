package com.marketintel.store.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStateRow {
    private String runId;
    private String marketDomain;
    private String query;
    private String stateJson;
    private String createdAt;
    private String updatedAt;
}
