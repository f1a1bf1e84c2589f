package io.github.drompincen.bugflow.protocol.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BugStatusTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void statusValuesInLifecycleOrder() {
        assertThat(BugStatus.values()).containsExactly(
                BugStatus.OPEN, BugStatus.IN_PROGRESS, BugStatus.RESOLVED, BugStatus.CLOSED);
    }

    @Test
    void labelsMatchWireLiterals() {
        assertThat(BugStatus.OPEN.label()).isEqualTo("Open");
        assertThat(BugStatus.IN_PROGRESS.label()).isEqualTo("In Progress");
        assertThat(BugStatus.RESOLVED.label()).isEqualTo("Resolved");
        assertThat(BugStatus.CLOSED.label()).isEqualTo("Closed");
    }

    @Test
    void fromLabelAcceptsLabelAndConstantName() {
        assertThat(BugStatus.fromLabel("In Progress")).isEqualTo(BugStatus.IN_PROGRESS);
        assertThat(BugStatus.fromLabel("in_progress")).isEqualTo(BugStatus.IN_PROGRESS);
        assertThat(BugStatus.fromLabel(" closed ")).isEqualTo(BugStatus.CLOSED);
    }

    @Test
    void fromLabelRejectsUnknownStatus() {
        assertThatThrownBy(() -> BugStatus.fromLabel("In Review"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid bug status");
    }

    @Test
    void serializesAsLabel() throws Exception {
        assertThat(mapper.writeValueAsString(BugStatus.IN_PROGRESS)).isEqualTo("\"In Progress\"");
        assertThat(mapper.readValue("\"Resolved\"", BugStatus.class)).isEqualTo(BugStatus.RESOLVED);
    }
}
