package io.github.drompincen.bugflow.ui.board;

import io.github.drompincen.bugflow.protocol.api.BugDto;

import java.util.List;

/**
 * Callbacks from {@link BoardReconciler}. May be invoked off the UI thread.
 */
public interface BoardListener {

    void cardsChanged(List<BugDto> cards);

    void validationRequired(BugDto bug);

    void errorReported(String message);
}
