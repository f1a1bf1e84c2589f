package io.github.drompincen.bugflow.persistence.document;

import io.github.drompincen.bugflow.protocol.api.BugPriority;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.protocol.api.BugTag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class BugDocumentTest {

    @Test
    void bugFieldsWork() {
        BugDocument doc = new BugDocument();
        Instant now = Instant.now();

        doc.setBugId("b1");
        doc.setProjectId("p1");
        doc.setTitle("Checkout button unresponsive");
        doc.setStatus(BugStatus.RESOLVED);
        doc.setPriority(BugPriority.HIGH);
        doc.setTags(Set.of(BugTag.UI, BugTag.PAYMENT));
        doc.setValidated(true);
        doc.setVersion(3L);
        doc.setCreatedAt(now);

        assertThat(doc.getBugId()).isEqualTo("b1");
        assertThat(doc.getStatus()).isEqualTo(BugStatus.RESOLVED);
        assertThat(doc.getTags()).containsExactlyInAnyOrder(BugTag.UI, BugTag.PAYMENT);
        assertThat(doc.isValidated()).isTrue();
        assertThat(doc.getVersion()).isEqualTo(3L);
    }

    @Test
    void copyIsDetachedFromOriginal() {
        BugDocument doc = new BugDocument();
        doc.setBugId("b1");
        doc.setStatus(BugStatus.OPEN);
        doc.setTags(EnumSet.of(BugTag.BACKEND));
        doc.setAttachments(List.of("a.png"));
        doc.setVersion(1L);

        BugDocument copy = doc.copy();
        doc.setStatus(BugStatus.CLOSED);
        doc.getTags().add(BugTag.DATABASE);

        assertThat(copy.getBugId()).isEqualTo("b1");
        assertThat(copy.getStatus()).isEqualTo(BugStatus.OPEN);
        assertThat(copy.getTags()).containsExactly(BugTag.BACKEND);
        assertThat(copy.getAttachments()).containsExactly("a.png");
        assertThat(copy.getVersion()).isEqualTo(1L);
    }

    @Test
    void copyHandlesEmptyAndMissingTags() {
        BugDocument doc = new BugDocument();
        doc.setTags(Set.of());
        assertThat(doc.copy().getTags()).isEmpty();

        doc.setTags(null);
        assertThat(doc.copy().getTags()).isNull();
    }
}
