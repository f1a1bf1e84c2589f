package io.github.drompincen.bugflow.runtime.directory;

import io.github.drompincen.bugflow.persistence.document.ProjectDocument;
import io.github.drompincen.bugflow.persistence.repository.ProjectRepository;
import io.github.drompincen.bugflow.persistence.repository.UserRepository;
import io.github.drompincen.bugflow.protocol.api.CreateProjectRequest;
import io.github.drompincen.bugflow.runtime.result.ErrorKind;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProjectServiceTest {

    @Mock
    private ProjectRepository projectRepository;
    @Mock
    private UserRepository userRepository;

    private ProjectService projectService;

    @BeforeEach
    void setUp() {
        projectService = new ProjectService(projectRepository, userRepository,
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void createStoresProjectForExistingCreator() {
        when(userRepository.existsById("u1")).thenReturn(true);
        when(projectRepository.insert(any(ProjectDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        LifecycleResult<ProjectDocument> result =
                projectService.create(new CreateProjectRequest("Payments", "Checkout flows", "u1"));

        ProjectDocument project = result.getValue();
        assertThat(project.getProjectId()).isNotBlank();
        assertThat(project.getName()).isEqualTo("Payments");
        assertThat(project.getCreatedBy()).isEqualTo("u1");
        assertThat(project.getCreatedAt()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
    }

    @Test
    void createRequiresKnownCreator() {
        when(userRepository.existsById("ghost")).thenReturn(false);

        LifecycleResult<ProjectDocument> result =
                projectService.create(new CreateProjectRequest("Payments", "Checkout flows", "ghost"));

        assertThat(result.getError().kind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(result.getError().code()).isEqualTo("UserNotFound");
        verify(projectRepository, never()).insert(any(ProjectDocument.class));
    }
}
