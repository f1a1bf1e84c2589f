package io.github.drompincen.bugflow.protocol.api;

import java.time.Instant;

public record CommentDto(String id, String bugId, String authorId, String message, Instant createdAt) {}
