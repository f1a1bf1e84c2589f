package io.github.drompincen.bugflow.ui.board;

import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.protocol.api.BugDto;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.protocol.api.UserRole;
import io.github.drompincen.bugflow.runtime.bug.BugLifecycleService;
import io.github.drompincen.bugflow.runtime.bug.ValidationResult;
import io.github.drompincen.bugflow.runtime.policy.Actor;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LocalBoardGatewayTest {

    @Mock
    private BugLifecycleService lifecycle;

    private LocalBoardGateway gateway;
    private final Actor tester = Actor.of("qa", UserRole.TESTER);

    @BeforeEach
    void setUp() {
        gateway = new LocalBoardGateway(lifecycle);
    }

    @Test
    void fetchBugsMapsProjectBugs() {
        when(lifecycle.list("p1", null, null)).thenReturn(List.of(doc("b1", BugStatus.OPEN, false)));

        List<BugDto> bugs = gateway.fetchBugs("p1");

        assertThat(bugs).extracting(BugDto::id).containsExactly("b1");
    }

    @Test
    void validateUnwrapsValidatedBug() {
        when(lifecycle.validate("b1", tester, null))
                .thenReturn(LifecycleResult.success(new ValidationResult(doc("b1", BugStatus.RESOLVED, true), false)));

        LifecycleResult<BugDto> result = gateway.validate("b1", tester);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().validated()).isTrue();
    }

    @Test
    void updateStatusPassesFailureThrough() {
        LifecycleError error = LifecycleError.notFound("Bug", "b9");
        when(lifecycle.updateStatus("b9", BugStatus.CLOSED, tester, null)).thenReturn(LifecycleResult.failure(error));

        LifecycleResult<BugDto> result = gateway.updateStatus("b9", BugStatus.CLOSED, tester);

        assertThat(result.getError()).isEqualTo(error);
    }

    private static BugDocument doc(String id, BugStatus status, boolean validated) {
        BugDocument doc = new BugDocument();
        doc.setBugId(id);
        doc.setProjectId("p1");
        doc.setTitle("Bug " + id);
        doc.setStatus(status);
        doc.setValidated(validated);
        return doc;
    }
}
