package io.github.drompincen.bugflow.runtime.bug;

import io.github.drompincen.bugflow.persistence.document.BugDocument;

/**
 * Result of {@code validate}. {@code alreadyValidated} is true when the call was a
 * no-op because the bug had been validated before.
 */
public record ValidationResult(BugDocument bug, boolean alreadyValidated) {}
