package io.github.drompincen.bugflow.ui.board;

public enum DropOutcome {
    /** Dropped where it already was, or nothing was being dragged. */
    NO_CHANGE,
    /** Target was Closed on an unvalidated bug; the card went back and a prompt is pending. */
    VALIDATION_REQUIRED,
    APPLIED,
    /** The engine refused or failed; the board was reloaded. */
    REJECTED
}
