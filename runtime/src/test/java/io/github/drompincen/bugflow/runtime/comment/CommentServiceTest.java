package io.github.drompincen.bugflow.runtime.comment;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.persistence.document.CommentDocument;
import io.github.drompincen.bugflow.protocol.api.ActivityAction;
import io.github.drompincen.bugflow.protocol.api.CreateCommentRequest;
import io.github.drompincen.bugflow.protocol.api.UserRole;
import io.github.drompincen.bugflow.runtime.activity.ActivityLogService;
import io.github.drompincen.bugflow.runtime.config.ActivityProperties;
import io.github.drompincen.bugflow.runtime.policy.AuthorizationPolicy;
import io.github.drompincen.bugflow.runtime.result.ErrorKind;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import io.github.drompincen.bugflow.runtime.support.InMemoryStore;
import io.github.drompincen.bugflow.runtime.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

class CommentServiceTest {

    private InMemoryStore store;
    private MutableClock clock;
    private CommentService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        clock = new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
        ActivityLogService activityLog = new ActivityLogService(store.activityRepository, new ActivityProperties(), clock);
        service = new CommentService(store.commentRepository, store.bugRepository, store.userRepository,
                activityLog, new AuthorizationPolicy(), clock, Runnable::run);

        store.addUser("dev", "Dev", UserRole.DEVELOPER);
        BugDocument bug = new BugDocument();
        bug.setBugId("b1");
        bug.setVersion(0L);
        store.bugs.put("b1", bug);
    }

    @Test
    void createStoresCommentAndAppendsCommented() {
        LifecycleResult<CommentDocument> result = service.create(new CreateCommentRequest("b1", "dev", "Repro on Safari"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getCommentId()).isNotBlank();
        assertThat(result.getValue().getCreatedAt()).isEqualTo(clock.instant());
        List<ActivityDocument> trail = store.activitiesFor("b1");
        assertThat(trail).hasSize(1);
        assertThat(trail.get(0).toAction()).isEqualTo(ActivityAction.commented());
        assertThat(trail.get(0).getAuthorId()).isEqualTo("dev");
    }

    @Test
    void createPersistsRequestFields() {
        service.create(new CreateCommentRequest("b1", "dev", "Repro on Safari"));

        ArgumentCaptor<CommentDocument> captor = ArgumentCaptor.forClass(CommentDocument.class);
        verify(store.commentRepository).insert(captor.capture());
        assertThat(captor.getValue().getBugId()).isEqualTo("b1");
        assertThat(captor.getValue().getAuthorId()).isEqualTo("dev");
        assertThat(captor.getValue().getMessage()).isEqualTo("Repro on Safari");
    }

    @Test
    void createRequiresBugAndAuthor() {
        assertThat(service.create(new CreateCommentRequest("nope", "dev", "x")).getError().kind())
                .isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(service.create(new CreateCommentRequest("b1", "ghost", "x")).getError().kind())
                .isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(store.comments).isEmpty();
        assertThat(store.activities).isEmpty();
    }

    @Test
    void storeFailureDuringExistenceCheckIsInfrastructure() {
        doThrow(new DataAccessResourceFailureException("down")).when(store.bugRepository).existsById(anyString());

        LifecycleResult<CommentDocument> result = service.create(new CreateCommentRequest("b1", "dev", "x"));

        assertThat(result.getError().kind()).isEqualTo(ErrorKind.INFRASTRUCTURE);
    }

    @Test
    void listReturnsOldestFirst() {
        service.create(new CreateCommentRequest("b1", "dev", "first"));
        clock.advance(Duration.ofMinutes(1));
        service.create(new CreateCommentRequest("b1", "dev", "second"));

        assertThat(service.listByBug("b1")).extracting(CommentDocument::getMessage).containsExactly("first", "second");
    }
}
