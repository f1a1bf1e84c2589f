package io.github.drompincen.bugflow.protocol.api;

import jakarta.validation.constraints.NotNull;

import java.util.Set;

public record UpdateTagsRequest(@NotNull(message = "Tags are required") Set<BugTag> tags, Long expectedVersion) {}
