package com.marketintel.model;

import java.time.Instant;

public record ChatTurn(
        String sessionId,
        ChatRole role,
        String content,
        Instant timestamp
) {
}
