package io.github.drompincen.bugflow.protocol.api;

public record ValidationResponse(String message, BugDto bug) {}
