package io.github.drompincen.bugflow.ui.board;

import io.github.drompincen.bugflow.protocol.api.BugDto;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.runtime.policy.Actor;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Optimistic drag-and-drop state for one project's board.
 *
 * <p>Cards move immediately in a speculative copy; the engine's answer then
 * replaces that copy. Any refusal or failure throws the speculative copy away and
 * reloads everything from the gateway. Nothing is retried.
 *
 * <p>Closing needs a validated bug. Dropping an unvalidated bug on Closed does
 * not call the engine: the card goes back and {@link BoardListener#validationRequired}
 * fires. {@link #confirmValidation} then issues validate followed by the status
 * change. If the second call fails the bug stays validated in Resolved, which is
 * a state the user can simply retry from.
 */
public class BoardReconciler {

    private static final Logger log = LoggerFactory.getLogger(BoardReconciler.class);

    private final BoardGateway gateway;
    private final BoardListener listener;

    private final Map<String, BugDto> cards = new LinkedHashMap<>();
    private final Map<String, BugDto> confirmed = new LinkedHashMap<>();
    private String projectId;
    private String draggingBugId;
    private BugStatus preDragStatus;
    private String pendingValidationBugId;

    public BoardReconciler(BoardGateway gateway, BoardListener listener) {
        this.gateway = gateway;
        this.listener = listener;
    }

    public synchronized void load(String projectId) {
        this.projectId = projectId;
        clearDrag();
        pendingValidationBugId = null;
        refetch();
    }

    /** Reloads authoritative state, e.g. after another client changed something. */
    public synchronized void refresh() {
        if (projectId != null) {
            refetch();
        }
    }

    public synchronized boolean startDrag(String bugId) {
        BugDto bug = cards.get(bugId);
        if (bug == null) {
            return false;
        }
        draggingBugId = bugId;
        preDragStatus = bug.status();
        return true;
    }

    public synchronized void cancelDrag() {
        clearDrag();
    }

    public synchronized DropOutcome drop(DropTarget target, Actor actor) {
        String bugId = draggingBugId;
        BugStatus from = preDragStatus;
        clearDrag();
        if (bugId == null) {
            return DropOutcome.NO_CHANGE;
        }
        BugDto bug = cards.get(bugId);
        Optional<BugStatus> resolved = targetStatus(target);
        if (bug == null || resolved.isEmpty() || resolved.get() == from) {
            return DropOutcome.NO_CHANGE;
        }
        BugStatus to = resolved.get();

        if (to == BugStatus.CLOSED && !bug.validated()) {
            log.debug("Bug {} needs validation before closing", bugId);
            pendingValidationBugId = bugId;
            publish();
            listener.validationRequired(bug);
            return DropOutcome.VALIDATION_REQUIRED;
        }

        BugDto speculative = bug.withStatus(to);
        if (from == BugStatus.CLOSED) {
            speculative = speculative.withValidated(false);
        }
        cards.put(bugId, speculative);
        publish();

        LifecycleResult<BugDto> result = call(() -> gateway.updateStatus(bugId, to, actor));
        if (result.isFailure()) {
            rejectAndReload(bugId, result.getError());
            return DropOutcome.REJECTED;
        }
        accept(result.getValue());
        return DropOutcome.APPLIED;
    }

    /** Validates then closes the bug the pending prompt was raised for. */
    public synchronized DropOutcome confirmValidation(Actor actor) {
        String bugId = pendingValidationBugId;
        pendingValidationBugId = null;
        BugDto bug = bugId != null ? cards.get(bugId) : null;
        if (bug == null) {
            return DropOutcome.NO_CHANGE;
        }

        cards.put(bugId, bug.withValidated(true).withStatus(BugStatus.CLOSED));
        publish();

        LifecycleResult<BugDto> validated = call(() -> gateway.validate(bugId, actor));
        if (validated.isFailure()) {
            rejectAndReload(bugId, validated.getError());
            return DropOutcome.REJECTED;
        }
        LifecycleResult<BugDto> closed = call(() -> gateway.updateStatus(bugId, BugStatus.CLOSED, actor));
        if (closed.isFailure()) {
            rejectAndReload(bugId, closed.getError());
            return DropOutcome.REJECTED;
        }
        accept(closed.getValue());
        return DropOutcome.APPLIED;
    }

    public synchronized void cancelValidation() {
        pendingValidationBugId = null;
    }

    public synchronized List<BugDto> cards() {
        return List.copyOf(cards.values());
    }

    public synchronized List<BugDto> cardsIn(BugStatus status) {
        return cards.values().stream().filter(b -> b.status() == status).toList();
    }

    public synchronized Optional<String> pendingValidation() {
        return Optional.ofNullable(pendingValidationBugId);
    }

    private Optional<BugStatus> targetStatus(DropTarget target) {
        if (target.cardBugId() != null) {
            BugDto onto = cards.get(target.cardBugId());
            return Optional.ofNullable(onto).map(BugDto::status);
        }
        return Optional.ofNullable(target.column());
    }

    /** A gateway that throws is treated like one that answered with an infrastructure error. */
    private static LifecycleResult<BugDto> call(Supplier<LifecycleResult<BugDto>> mutation) {
        try {
            return mutation.get();
        } catch (RuntimeException e) {
            log.error("Board change could not reach the engine", e);
            return LifecycleResult.failure(LifecycleError.infrastructure(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }

    private void accept(BugDto authoritative) {
        cards.put(authoritative.id(), authoritative);
        confirmed.put(authoritative.id(), authoritative);
        publish();
    }

    private void rejectAndReload(String bugId, LifecycleError error) {
        log.warn("Board change on bug {} rejected ({}): {}", bugId, error.code(), error.message());
        cards.clear();
        cards.putAll(confirmed);
        listener.errorReported(error.message());
        refetch();
    }

    private void refetch() {
        List<BugDto> fresh;
        try {
            fresh = gateway.fetchBugs(projectId);
        } catch (RuntimeException e) {
            log.error("Reloading board for project {} failed", projectId, e);
            listener.errorReported("Could not reload the board: " + e.getMessage());
            publish();
            return;
        }
        cards.clear();
        confirmed.clear();
        for (BugDto bug : fresh) {
            cards.put(bug.id(), bug);
            confirmed.put(bug.id(), bug);
        }
        publish();
    }

    private void publish() {
        listener.cardsChanged(new ArrayList<>(cards.values()));
    }

    private void clearDrag() {
        draggingBugId = null;
        preDragStatus = null;
    }
}
