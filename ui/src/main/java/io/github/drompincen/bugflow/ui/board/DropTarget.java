package io.github.drompincen.bugflow.ui.board;

import io.github.drompincen.bugflow.protocol.api.BugStatus;

/**
 * Where a card was released: a column, or another card (whose status is the
 * target).
 */
public record DropTarget(BugStatus column, String cardBugId) {

    public static DropTarget column(BugStatus status) {
        return new DropTarget(status, null);
    }

    public static DropTarget card(String bugId) {
        return new DropTarget(null, bugId);
    }
}
