package io.github.drompincen.bugflow.protocol.api;

import java.time.Instant;

public record ActivityDto(
        String id,
        String bugId,
        ActivityAction action,
        String authorId,
        long seq,
        Instant timestamp
) {}
