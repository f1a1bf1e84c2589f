package io.github.drompincen.bugflow.runtime.activity;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import io.github.drompincen.bugflow.protocol.api.ActivityDto;

public final class ActivityMapper {

    private ActivityMapper() {}

    public static ActivityDto toDto(ActivityDocument doc) {
        return new ActivityDto(doc.getActivityId(), doc.getBugId(), doc.toAction(),
                doc.getAuthorId(), doc.getSeq(), doc.getTimestamp());
    }
}
