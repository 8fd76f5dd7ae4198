package com.marketintel.store.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurnRow {
    private Long id;
    private String sessionId;
    private String role;
    private String content;
    private long createdAtMs;
}
