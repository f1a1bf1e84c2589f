package io.github.drompincen.bugflow.protocol.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank @Size(max = 200) String name,
        @NotBlank @Email String email,
        @NotNull UserRole role
) {}
