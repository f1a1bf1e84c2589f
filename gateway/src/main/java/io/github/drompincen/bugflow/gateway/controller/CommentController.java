package io.github.drompincen.bugflow.gateway.controller;

import io.github.drompincen.bugflow.persistence.document.CommentDocument;
import io.github.drompincen.bugflow.protocol.api.CommentDto;
import io.github.drompincen.bugflow.protocol.api.CreateCommentRequest;
import io.github.drompincen.bugflow.protocol.api.ErrorResponse;
import io.github.drompincen.bugflow.runtime.comment.CommentService;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/comments")
public class CommentController {

    private final CommentService commentService;

    public CommentController(CommentService commentService) {
        this.commentService = commentService;
    }

    @PostMapping
    public ResponseEntity<Object> create(@Valid @RequestBody CreateCommentRequest req) {
        LifecycleResult<CommentDocument> result = commentService.create(req);
        if (result.isFailure()) {
            return ErrorResponses.of(result.getError());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(result.getValue()));
    }

    @GetMapping
    public ResponseEntity<Object> list(@RequestParam(required = false) String bugId) {
        if (bugId == null || bugId.isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("Validation failed", "bugId query parameter is required", "ValidationFailed"));
        }
        return ResponseEntity.ok(commentService.listByBug(bugId).stream().map(this::toDto).toList());
    }

    private CommentDto toDto(CommentDocument doc) {
        return new CommentDto(doc.getCommentId(), doc.getBugId(), doc.getAuthorId(), doc.getMessage(), doc.getCreatedAt());
    }
}
