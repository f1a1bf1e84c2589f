package io.github.drompincen.bugflow.runtime.activity;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.protocol.api.ActivityAction;
import io.github.drompincen.bugflow.protocol.api.ActivityFeedItemDto;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.protocol.api.UserRole;
import io.github.drompincen.bugflow.runtime.config.ActivityProperties;
import io.github.drompincen.bugflow.runtime.support.InMemoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

class ActivityFeedServiceTest {

    private InMemoryStore store;
    private ActivityProperties properties;
    private ActivityFeedService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        properties = new ActivityProperties();
        executor = Executors.newFixedThreadPool(3);
        service = new ActivityFeedService(store.userRepository, store.bugRepository, store.projectRepository,
                properties, executor);

        store.addUser("u1", "Tess Tester", UserRole.TESTER);
        store.addUser("u2", "Dev Eloper", UserRole.DEVELOPER);
        store.addProject("p1", "Payments");
        BugDocument bug = new BugDocument();
        bug.setBugId("b1");
        bug.setTitle("Checkout fails");
        bug.setProjectId("p1");
        bug.setVersion(0L);
        store.bugs.put("b1", bug);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void enrichesNamesTitlesAndTargets() {
        List<ActivityFeedItemDto> items = service.enrich(List.of(
                activity("a1", "b1", ActivityAction.assigned("u2"), "u1"),
                activity("a2", "b1", ActivityAction.statusChanged(BugStatus.RESOLVED), "u2")));

        ActivityFeedItemDto assigned = items.get(0);
        assertThat(assigned.performedByName()).isEqualTo("Tess Tester");
        assertThat(assigned.assignedToName()).isEqualTo("Dev Eloper");
        assertThat(assigned.bugTitle()).isEqualTo("Checkout fails");
        assertThat(assigned.projectId()).isEqualTo("p1");
        assertThat(assigned.projectName()).isEqualTo("Payments");
        assertThat(assigned.newStatus()).isNull();

        ActivityFeedItemDto status = items.get(1);
        assertThat(status.newStatus()).isEqualTo(BugStatus.RESOLVED);
        assertThat(status.assignedToName()).isNull();
        assertThat(status.performedByName()).isEqualTo("Dev Eloper");
    }

    @Test
    void saturatedExecutorDegradesToPlaceholders() {
        ActivityFeedService saturated = new ActivityFeedService(store.userRepository, store.bugRepository,
                store.projectRepository, properties, task -> {
                    throw new TaskRejectedException("pool full");
                });

        List<ActivityFeedItemDto> items = saturated.enrich(List.of(
                activity("a1", "b1", ActivityAction.reported(), "u1")));

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.performedByName()).isEqualTo("Unknown User");
            assertThat(item.bugTitle()).isEqualTo("Unknown Bug");
            assertThat(item.projectName()).isEqualTo("Unknown Project");
        });
    }

    @Test
    void missingEntitiesGetPlaceholders() {
        List<ActivityFeedItemDto> items = service.enrich(List.of(
                activity("a1", "gone", ActivityAction.reported(), "nobody")));

        ActivityFeedItemDto item = items.get(0);
        assertThat(item.performedByName()).isEqualTo("Unknown User");
        assertThat(item.bugTitle()).isEqualTo("Unknown Bug");
        assertThat(item.projectName()).isEqualTo("Unknown Project");
        assertThat(item.projectId()).isNull();
    }

    @Test
    void failedUserLookupDegradesWithoutFailingRead() {
        doThrow(new DataAccessResourceFailureException("down")).when(store.userRepository).findAllById(any());

        List<ActivityFeedItemDto> items = service.enrich(List.of(
                activity("a1", "b1", ActivityAction.commented(), "u1")));

        assertThat(items).hasSize(1);
        assertThat(items.get(0).performedByName()).isEqualTo("Unknown User");
        assertThat(items.get(0).bugTitle()).isEqualTo("Checkout fails");
    }

    @Test
    void slowLookupTimesOutToPlaceholder() throws Exception {
        properties.setEnrichmentTimeout(Duration.ofMillis(50));
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            release.await();
            return List.of();
        }).when(store.projectRepository).findAllById(any());

        try {
            List<ActivityFeedItemDto> items = service.enrich(List.of(
                    activity("a1", "b1", ActivityAction.commented(), "u1")));

            assertThat(items.get(0).projectName()).isEqualTo("Unknown Project");
            assertThat(items.get(0).performedByName()).isEqualTo("Tess Tester");
        } finally {
            release.countDown();
        }
    }

    @Test
    void emptyInputSkipsLookups() {
        assertThat(service.enrich(List.of())).isEmpty();
    }

    private static ActivityDocument activity(String id, String bugId, ActivityAction action, String authorId) {
        ActivityDocument doc = new ActivityDocument();
        doc.setActivityId(id);
        doc.setBugId(bugId);
        doc.applyAction(action);
        doc.setAuthorId(authorId);
        doc.setTimestamp(Instant.parse("2024-05-01T10:00:00Z"));
        return doc;
    }
}
