package io.github.drompincen.bugflow.gateway.controller;

import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.protocol.api.AssignBugRequest;
import io.github.drompincen.bugflow.protocol.api.BugDto;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.protocol.api.CreateBugRequest;
import io.github.drompincen.bugflow.protocol.api.UpdateBugRequest;
import io.github.drompincen.bugflow.protocol.api.UpdateStatusRequest;
import io.github.drompincen.bugflow.protocol.api.UpdateTagsRequest;
import io.github.drompincen.bugflow.protocol.api.ValidateBugRequest;
import io.github.drompincen.bugflow.protocol.api.ValidationResponse;
import io.github.drompincen.bugflow.runtime.bug.BugLifecycleService;
import io.github.drompincen.bugflow.runtime.bug.BugMapper;
import io.github.drompincen.bugflow.runtime.bug.ValidationResult;
import io.github.drompincen.bugflow.runtime.policy.Actor;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/bugs")
public class BugController {

    private final BugLifecycleService lifecycle;

    public BugController(BugLifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @PostMapping
    public ResponseEntity<Object> create(@Valid @RequestBody CreateBugRequest req) {
        LifecycleResult<BugDocument> result = lifecycle.create(req, Actor.of(req.reportedBy(), req.userRole()));
        if (result.isFailure()) {
            return ErrorResponses.of(result.getError());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(BugMapper.toDto(result.getValue()));
    }

    @GetMapping
    public List<BugDto> list(@RequestParam(required = false) String projectId,
                             @RequestParam(required = false) BugStatus status,
                             @RequestParam(required = false) String assignedTo) {
        return lifecycle.list(projectId, status, assignedTo).stream().map(BugMapper::toDto).toList();
    }

    @GetMapping("/{bugId}")
    public ResponseEntity<BugDto> get(@PathVariable String bugId) {
        return lifecycle.findById(bugId)
                .map(d -> ResponseEntity.ok(BugMapper.toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{bugId}")
    public ResponseEntity<Object> update(@PathVariable String bugId, @Valid @RequestBody UpdateBugRequest req) {
        return respond(lifecycle.update(bugId, req));
    }

    @PatchMapping("/{bugId}/status")
    public ResponseEntity<Object> updateStatus(@PathVariable String bugId, @Valid @RequestBody UpdateStatusRequest req) {
        return respond(lifecycle.updateStatus(bugId, req.status(), Actor.of(req.userId(), req.userRole()),
                req.expectedVersion()));
    }

    @PatchMapping("/{bugId}/assign")
    public ResponseEntity<Object> assign(@PathVariable String bugId, @Valid @RequestBody AssignBugRequest req) {
        return respond(lifecycle.assign(bugId, req.assignedTo(), Actor.of(req.assignedBy(), req.userRole()),
                req.expectedVersion()));
    }

    @PatchMapping("/{bugId}/tags")
    public ResponseEntity<Object> updateTags(@PathVariable String bugId, @Valid @RequestBody UpdateTagsRequest req) {
        return respond(lifecycle.updateTags(bugId, req.tags(), req.expectedVersion()));
    }

    @PatchMapping("/{bugId}/validate")
    public ResponseEntity<Object> validate(@PathVariable String bugId, @Valid @RequestBody ValidateBugRequest req) {
        LifecycleResult<ValidationResult> result =
                lifecycle.validate(bugId, Actor.of(req.userId(), req.userRole()), req.expectedVersion());
        if (result.isFailure()) {
            return ErrorResponses.of(result.getError());
        }
        ValidationResult outcome = result.getValue();
        String message = outcome.alreadyValidated() ? "Bug is already validated" : "Bug validated successfully";
        return ResponseEntity.ok(new ValidationResponse(message, BugMapper.toDto(outcome.bug())));
    }

    @PostMapping("/{bugId}/validate-and-close")
    public ResponseEntity<Object> validateAndClose(@PathVariable String bugId, @Valid @RequestBody ValidateBugRequest req) {
        return respond(lifecycle.validateAndClose(bugId, Actor.of(req.userId(), req.userRole()), req.expectedVersion()));
    }

    private static ResponseEntity<Object> respond(LifecycleResult<BugDocument> result) {
        if (result.isFailure()) {
            return ErrorResponses.of(result.getError());
        }
        return ResponseEntity.ok(BugMapper.toDto(result.getValue()));
    }
}
