package io.github.drompincen.bugflow.runtime.bug;

import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.persistence.repository.BugRepository;
import io.github.drompincen.bugflow.persistence.repository.ProjectRepository;
import io.github.drompincen.bugflow.persistence.repository.UserRepository;
import io.github.drompincen.bugflow.protocol.api.ActivityAction;
import io.github.drompincen.bugflow.protocol.api.BugPriority;
import io.github.drompincen.bugflow.protocol.api.BugSeverity;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.protocol.api.BugTag;
import io.github.drompincen.bugflow.protocol.api.BugType;
import io.github.drompincen.bugflow.protocol.api.CreateBugRequest;
import io.github.drompincen.bugflow.protocol.api.UpdateBugRequest;
import io.github.drompincen.bugflow.runtime.activity.ActivityLogService;
import io.github.drompincen.bugflow.runtime.policy.Actor;
import io.github.drompincen.bugflow.runtime.policy.AuthorizationPolicy;
import io.github.drompincen.bugflow.runtime.policy.Decision;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Owns every change to a bug's status, assignee and validated flag. Each accepted
 * mutation is checked against {@link AuthorizationPolicy}, saved with a version
 * compare-and-swap, and recorded with exactly one activity (two for
 * {@link #validateAndClose}).
 */
@Service
public class BugLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(BugLifecycleService.class);

    private final BugRepository bugRepository;
    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;
    private final ActivityLogService activityLog;
    private final AuthorizationPolicy policy;
    private final Clock clock;

    public BugLifecycleService(BugRepository bugRepository, UserRepository userRepository,
                               ProjectRepository projectRepository, ActivityLogService activityLog,
                               AuthorizationPolicy policy, Clock clock) {
        this.bugRepository = bugRepository;
        this.userRepository = userRepository;
        this.projectRepository = projectRepository;
        this.activityLog = activityLog;
        this.policy = policy;
        this.clock = clock;
    }

    public LifecycleResult<BugDocument> create(CreateBugRequest request, Actor actor) {
        return guarded("create", null, () -> {
            Decision decision = policy.checkCreate(actor.role());
            if (decision.denied()) {
                return deny("create", null, actor, decision);
            }
            if (!projectRepository.existsById(request.projectId())) {
                return LifecycleResult.failure(LifecycleError.notFound("Project", request.projectId()));
            }
            if (!userRepository.existsById(request.reportedBy())) {
                return LifecycleResult.failure(LifecycleError.notFound("User", request.reportedBy()));
            }
            if (request.assignedTo() != null && !request.assignedTo().isBlank()
                    && !userRepository.existsById(request.assignedTo())) {
                return LifecycleResult.failure(LifecycleError.notFound("Assigned user", request.assignedTo()));
            }

            Instant now = clock.instant();
            BugDocument bug = new BugDocument();
            bug.setBugId(UUID.randomUUID().toString());
            bug.setTitle(request.title());
            bug.setDescription(request.description());
            bug.setProjectId(request.projectId());
            bug.setReportedBy(request.reportedBy());
            bug.setAssignedTo(blankToNull(request.assignedTo()));
            bug.setSprintId(blankToNull(request.sprintId()));
            bug.setStatus(BugStatus.OPEN);
            bug.setPriority(request.priority() != null ? request.priority() : BugPriority.MEDIUM);
            bug.setSeverity(request.severity() != null ? request.severity() : BugSeverity.MINOR);
            bug.setType(request.type() != null ? request.type() : BugType.BUG);
            bug.setTags(copyTags(request.tags()));
            bug.setAttachments(request.attachments() != null ? new ArrayList<>(request.attachments()) : new ArrayList<>());
            bug.setValidated(false);
            bug.setCreatedAt(now);
            bug.setUpdatedAt(now);

            BugDocument saved = bugRepository.insert(bug);
            try {
                activityLog.append(saved.getBugId(), ActivityAction.reported(), request.reportedBy());
            } catch (DataAccessException e) {
                discard(saved.getBugId());
                throw e;
            }
            log.info("Bug {} reported in project {} by {}", saved.getBugId(), saved.getProjectId(), request.reportedBy());
            return LifecycleResult.success(saved);
        });
    }

    public LifecycleResult<BugDocument> updateStatus(String bugId, BugStatus newStatus, Actor actor, Long expectedVersion) {
        return guarded("updateStatus", bugId, () -> {
            Optional<BugDocument> found = bugRepository.findById(bugId);
            if (found.isEmpty()) {
                return LifecycleResult.failure(LifecycleError.notFound("Bug", bugId));
            }
            BugDocument bug = found.get();
            LifecycleResult<BugDocument> stale = checkVersion(bug, expectedVersion);
            if (stale != null) {
                return stale;
            }
            BugStatus current = bug.getStatus();
            Decision decision = policy.checkStatusChange(current, newStatus, actor.role());
            if (decision.denied()) {
                return deny("updateStatus", bugId, actor, decision);
            }

            BugDocument before = bug.copy();
            bug.setStatus(newStatus);
            if (clearsValidation(current, newStatus)) {
                bug.setValidated(false);
            }
            bug.setUpdatedAt(clock.instant());
            BugDocument saved = commit(before, bug, actor.id(), ActivityAction.statusChanged(newStatus));
            log.info("Bug {} moved {} -> {} by {}", bugId, current.label(), newStatus.label(), actor.id());
            return LifecycleResult.success(saved);
        });
    }

    public LifecycleResult<BugDocument> assign(String bugId, String assigneeId, Actor actor, Long expectedVersion) {
        return guarded("assign", bugId, () -> {
            Decision decision = policy.checkAssign(actor.role());
            if (decision.denied()) {
                return deny("assign", bugId, actor, decision);
            }
            Optional<BugDocument> found = bugRepository.findById(bugId);
            if (found.isEmpty()) {
                return LifecycleResult.failure(LifecycleError.notFound("Bug", bugId));
            }
            if (assigneeId == null || !userRepository.existsById(assigneeId)) {
                return LifecycleResult.failure(LifecycleError.assigneeNotFound());
            }
            BugDocument bug = found.get();
            LifecycleResult<BugDocument> stale = checkVersion(bug, expectedVersion);
            if (stale != null) {
                return stale;
            }

            BugDocument before = bug.copy();
            bug.setAssignedTo(assigneeId);
            bug.setUpdatedAt(clock.instant());
            BugDocument saved = commit(before, bug, actor.id(), ActivityAction.assigned(assigneeId));
            log.info("Bug {} assigned to {} by {}", bugId, assigneeId, actor.id());
            return LifecycleResult.success(saved);
        });
    }

    /** Replaces the label set. Not audited. */
    public LifecycleResult<BugDocument> updateTags(String bugId, Set<BugTag> tags, Long expectedVersion) {
        return guarded("updateTags", bugId, () -> {
            Optional<BugDocument> found = bugRepository.findById(bugId);
            if (found.isEmpty()) {
                return LifecycleResult.failure(LifecycleError.notFound("Bug", bugId));
            }
            BugDocument bug = found.get();
            LifecycleResult<BugDocument> stale = checkVersion(bug, expectedVersion);
            if (stale != null) {
                return stale;
            }
            bug.setTags(copyTags(tags));
            bug.setUpdatedAt(clock.instant());
            return LifecycleResult.success(bugRepository.save(bug));
        });
    }

    /**
     * Edits descriptive fields only. Status, assignee and the validated flag are
     * left alone; they change through the dedicated operations. Not audited.
     */
    public LifecycleResult<BugDocument> update(String bugId, UpdateBugRequest request) {
        return guarded("update", bugId, () -> {
            Optional<BugDocument> found = bugRepository.findById(bugId);
            if (found.isEmpty()) {
                return LifecycleResult.failure(LifecycleError.notFound("Bug", bugId));
            }
            BugDocument bug = found.get();
            LifecycleResult<BugDocument> stale = checkVersion(bug, request.expectedVersion());
            if (stale != null) {
                return stale;
            }
            if (request.title() != null) bug.setTitle(request.title());
            if (request.description() != null) bug.setDescription(request.description());
            if (request.priority() != null) bug.setPriority(request.priority());
            if (request.severity() != null) bug.setSeverity(request.severity());
            if (request.type() != null) bug.setType(request.type());
            if (request.sprintId() != null) bug.setSprintId(blankToNull(request.sprintId()));
            if (request.attachments() != null) bug.setAttachments(new ArrayList<>(request.attachments()));
            bug.setUpdatedAt(clock.instant());
            return LifecycleResult.success(bugRepository.save(bug));
        });
    }

    public LifecycleResult<ValidationResult> validate(String bugId, Actor actor, Long expectedVersion) {
        return guarded("validate", bugId, () -> {
            if (actor.id() == null || !userRepository.existsById(actor.id())) {
                return LifecycleResult.failure(LifecycleError.notFound("User", actor.id()));
            }
            Decision decision = policy.checkValidate(actor.role());
            if (decision.denied()) {
                return deny("validate", bugId, actor, decision);
            }
            Optional<BugDocument> found = bugRepository.findById(bugId);
            if (found.isEmpty()) {
                return LifecycleResult.failure(LifecycleError.notFound("Bug", bugId));
            }
            BugDocument bug = found.get();
            if (bug.isValidated()) {
                log.debug("Bug {} already validated, nothing to do", bugId);
                return LifecycleResult.success(new ValidationResult(bug, true));
            }
            if (bug.getStatus() != BugStatus.RESOLVED) {
                return LifecycleResult.failure(mustBeResolved());
            }
            LifecycleResult<ValidationResult> stale = checkVersion(bug, expectedVersion);
            if (stale != null) {
                return stale;
            }

            BugDocument before = bug.copy();
            bug.setValidated(true);
            bug.setUpdatedAt(clock.instant());
            BugDocument saved = commit(before, bug, actor.id(), ActivityAction.validated());
            log.info("Bug {} validated by {}", bugId, actor.id());
            return LifecycleResult.success(new ValidationResult(saved, false));
        });
    }

    /**
     * Validates (when needed) and closes a Resolved bug in a single save. Appends
     * {@code Validated} unless the bug was already validated, then
     * {@code StatusChanged{to: Closed}}.
     */
    public LifecycleResult<BugDocument> validateAndClose(String bugId, Actor actor, Long expectedVersion) {
        return guarded("validateAndClose", bugId, () -> {
            Decision validateDecision = policy.checkValidate(actor.role());
            if (validateDecision.denied()) {
                return deny("validateAndClose", bugId, actor, validateDecision);
            }
            Optional<BugDocument> found = bugRepository.findById(bugId);
            if (found.isEmpty()) {
                return LifecycleResult.failure(LifecycleError.notFound("Bug", bugId));
            }
            BugDocument bug = found.get();
            Decision closeDecision = policy.checkStatusChange(bug.getStatus(), BugStatus.CLOSED, actor.role());
            if (closeDecision.denied()) {
                return deny("validateAndClose", bugId, actor, closeDecision);
            }
            if (bug.getStatus() != BugStatus.RESOLVED) {
                return LifecycleResult.failure(mustBeResolved());
            }
            LifecycleResult<BugDocument> stale = checkVersion(bug, expectedVersion);
            if (stale != null) {
                return stale;
            }

            BugDocument before = bug.copy();
            bug.setValidated(true);
            bug.setStatus(BugStatus.CLOSED);
            bug.setUpdatedAt(clock.instant());
            BugDocument saved = before.isValidated()
                    ? commit(before, bug, actor.id(), ActivityAction.statusChanged(BugStatus.CLOSED))
                    : commit(before, bug, actor.id(), ActivityAction.validated(),
                            ActivityAction.statusChanged(BugStatus.CLOSED));
            log.info("Bug {} validated and closed by {}", bugId, actor.id());
            return LifecycleResult.success(saved);
        });
    }

    public Optional<BugDocument> findById(String bugId) {
        return bugRepository.findById(bugId);
    }

    /** First non-null filter wins, in the order project, status, assignee. */
    public List<BugDocument> list(String projectId, BugStatus status, String assignedTo) {
        if (projectId != null && !projectId.isBlank()) {
            return bugRepository.findByProjectIdOrderByUpdatedAtDesc(projectId);
        }
        if (status != null) {
            return bugRepository.findByStatusOrderByUpdatedAtDesc(status);
        }
        if (assignedTo != null && !assignedTo.isBlank()) {
            return bugRepository.findByAssignedToOrderByUpdatedAtDesc(assignedTo);
        }
        return bugRepository.findAllByOrderByUpdatedAtDesc();
    }

    static boolean clearsValidation(BugStatus from, BugStatus to) {
        if (from == BugStatus.CLOSED && to != BugStatus.CLOSED) {
            return true;
        }
        return to == BugStatus.OPEN || to == BugStatus.IN_PROGRESS;
    }

    /**
     * Saves the mutated bug, then records its activities. When recording fails the
     * previous document is written back over the new version, so the change does
     * not stay visible without its audit entry.
     */
    private BugDocument commit(BugDocument before, BugDocument bug, String authorId, ActivityAction... actions) {
        BugDocument saved = bugRepository.save(bug);
        try {
            for (ActivityAction action : actions) {
                activityLog.append(saved.getBugId(), action, authorId);
            }
        } catch (DataAccessException e) {
            restore(before, saved.getVersion());
            throw e;
        }
        return saved;
    }

    private void restore(BugDocument before, Long savedVersion) {
        before.setVersion(savedVersion);
        try {
            bugRepository.save(before);
            log.warn("Activity write failed, bug {} rolled back to its previous state", before.getBugId());
        } catch (DataAccessException e) {
            log.error("Activity write failed and bug {} could not be rolled back", before.getBugId(), e);
        }
    }

    private void discard(String bugId) {
        try {
            bugRepository.deleteById(bugId);
            log.warn("Activity write failed, new bug {} removed", bugId);
        } catch (DataAccessException e) {
            log.error("Activity write failed and new bug {} could not be removed", bugId, e);
        }
    }

    private <T> LifecycleResult<T> guarded(String operation, String bugId, Supplier<LifecycleResult<T>> body) {
        try {
            return body.get();
        } catch (OptimisticLockingFailureException e) {
            log.warn("{} on bug {} lost a concurrent update: {}", operation, bugId, e.getMessage());
            return LifecycleResult.failure(LifecycleError.conflict("Bug was modified concurrently, reload and retry"));
        } catch (DataAccessException e) {
            log.error("{} on bug {} failed in the store", operation, bugId, e);
            return LifecycleResult.failure(LifecycleError.infrastructure(e.getMostSpecificCause().getMessage()));
        }
    }

    private static <T> LifecycleResult<T> deny(String operation, String bugId, Actor actor, Decision decision) {
        log.warn("{} on bug {} denied for {} ({}): {}", operation, bugId, actor.id(),
                actor.role() != null ? actor.role().label() : "no role", decision.reason().code());
        return LifecycleResult.failure(LifecycleError.forbidden(decision));
    }

    private static <T> LifecycleResult<T> checkVersion(BugDocument bug, Long expectedVersion) {
        if (expectedVersion != null && !expectedVersion.equals(bug.getVersion())) {
            return LifecycleResult.failure(LifecycleError.conflict(
                    "Bug %s is at version %s, expected %s".formatted(bug.getBugId(), bug.getVersion(), expectedVersion)));
        }
        return null;
    }

    private static LifecycleError mustBeResolved() {
        return LifecycleError.invalidState(LifecycleError.MUST_BE_RESOLVED,
                "Bug must be in Resolved status to be validated");
    }

    private static Set<BugTag> copyTags(Set<BugTag> tags) {
        return tags == null || tags.isEmpty() ? EnumSet.noneOf(BugTag.class) : EnumSet.copyOf(tags);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
