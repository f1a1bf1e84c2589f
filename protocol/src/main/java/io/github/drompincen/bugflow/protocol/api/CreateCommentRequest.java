package io.github.drompincen.bugflow.protocol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateCommentRequest(
        @NotBlank(message = "Bug ID is required") String bugId,
        @NotBlank(message = "Author user ID is required") String authorId,
        @NotBlank(message = "Comment message is required")
        @Size(max = 2000, message = "Comment message must be 2000 characters or less")
        String message
) {}
