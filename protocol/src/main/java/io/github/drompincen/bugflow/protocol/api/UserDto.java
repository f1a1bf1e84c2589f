package io.github.drompincen.bugflow.protocol.api;

import java.time.Instant;

public record UserDto(String id, String name, String email, UserRole role, Instant createdAt, Instant updatedAt) {}
