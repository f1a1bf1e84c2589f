package io.github.drompincen.bugflow.gateway.controller;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import io.github.drompincen.bugflow.protocol.api.ActivityDto;
import io.github.drompincen.bugflow.protocol.api.ImportLegacyActivityRequest;
import io.github.drompincen.bugflow.runtime.activity.ActivityFeedService;
import io.github.drompincen.bugflow.runtime.activity.ActivityLogService;
import io.github.drompincen.bugflow.runtime.activity.ActivityMapper;
import io.github.drompincen.bugflow.runtime.policy.AuthorizationPolicy;
import io.github.drompincen.bugflow.runtime.policy.Decision;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/activities")
public class ActivityController {

    private static final Logger log = LoggerFactory.getLogger(ActivityController.class);

    private final ActivityLogService activityLog;
    private final ActivityFeedService feed;
    private final AuthorizationPolicy policy;

    public ActivityController(ActivityLogService activityLog, ActivityFeedService feed, AuthorizationPolicy policy) {
        this.activityLog = activityLog;
        this.feed = feed;
        this.policy = policy;
    }

    /** Enriched feed, newest first. {@code bugId} takes precedence over {@code limit}. */
    @GetMapping
    public ResponseEntity<Object> list(@RequestParam(required = false) String bugId,
                                       @RequestParam(required = false) String limit) {
        LifecycleResult<List<ActivityDocument>> result = activityLog.query(bugId, limit);
        if (result.isFailure()) {
            return ErrorResponses.of(result.getError());
        }
        return ResponseEntity.ok(feed.enrich(result.getValue()));
    }

    /** Raw trail of one bug without display names. */
    @GetMapping("/bugs/{bugId}")
    public List<ActivityDto> trail(@PathVariable String bugId) {
        return activityLog.listByBug(bugId).stream().map(ActivityMapper::toDto).toList();
    }

    /** Migrates one record from the old string encoding, keeping its original timestamp. */
    @PostMapping("/import")
    public ResponseEntity<Object> importLegacy(@Valid @RequestBody ImportLegacyActivityRequest req) {
        Decision decision = policy.checkImport(req.userRole());
        if (decision.denied()) {
            log.warn("Legacy import on bug {} denied for {}", req.bugId(), req.authorId());
            return ErrorResponses.of(LifecycleError.forbidden(decision));
        }
        LifecycleResult<ActivityDocument> result =
                activityLog.importLegacy(req.bugId(), req.action(), req.authorId(), req.timestamp());
        if (result.isFailure()) {
            return ErrorResponses.of(result.getError());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ActivityMapper.toDto(result.getValue()));
    }
}
