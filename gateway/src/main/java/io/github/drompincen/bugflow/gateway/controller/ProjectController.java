package io.github.drompincen.bugflow.gateway.controller;

import io.github.drompincen.bugflow.persistence.document.ProjectDocument;
import io.github.drompincen.bugflow.protocol.api.CreateProjectRequest;
import io.github.drompincen.bugflow.protocol.api.ProjectDto;
import io.github.drompincen.bugflow.runtime.directory.ProjectService;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping
    public ResponseEntity<Object> create(@Valid @RequestBody CreateProjectRequest req) {
        LifecycleResult<ProjectDocument> result = projectService.create(req);
        if (result.isFailure()) {
            return ErrorResponses.of(result.getError());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(result.getValue()));
    }

    @GetMapping
    public List<ProjectDto> list() {
        return projectService.findAll().stream().map(this::toDto).toList();
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<ProjectDto> get(@PathVariable String projectId) {
        return projectService.findById(projectId)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    private ProjectDto toDto(ProjectDocument doc) {
        return new ProjectDto(doc.getProjectId(), doc.getName(), doc.getDescription(),
                doc.getCreatedBy(), doc.getCreatedAt());
    }
}
