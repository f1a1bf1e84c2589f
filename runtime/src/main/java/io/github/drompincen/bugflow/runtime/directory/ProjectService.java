package io.github.drompincen.bugflow.runtime.directory;

import io.github.drompincen.bugflow.persistence.document.ProjectDocument;
import io.github.drompincen.bugflow.persistence.repository.ProjectRepository;
import io.github.drompincen.bugflow.persistence.repository.UserRepository;
import io.github.drompincen.bugflow.protocol.api.CreateProjectRequest;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class ProjectService {

    private final ProjectRepository projectRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    public ProjectService(ProjectRepository projectRepository, UserRepository userRepository, Clock clock) {
        this.projectRepository = projectRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    public LifecycleResult<ProjectDocument> create(CreateProjectRequest request) {
        if (!userRepository.existsById(request.createdBy())) {
            return LifecycleResult.failure(LifecycleError.notFound("User", request.createdBy()));
        }
        ProjectDocument project = new ProjectDocument();
        project.setProjectId(UUID.randomUUID().toString());
        project.setName(request.name());
        project.setDescription(request.description());
        project.setCreatedBy(request.createdBy());
        project.setCreatedAt(clock.instant());
        return LifecycleResult.success(projectRepository.insert(project));
    }

    public Optional<ProjectDocument> findById(String projectId) {
        return projectRepository.findById(projectId);
    }

    public List<ProjectDocument> findAll() {
        return projectRepository.findAllByOrderByCreatedAtDesc();
    }
}
