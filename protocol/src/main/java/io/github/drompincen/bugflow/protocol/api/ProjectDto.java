package io.github.drompincen.bugflow.protocol.api;

import java.time.Instant;

public record ProjectDto(String id, String name, String description, String createdBy, Instant createdAt) {}
