package io.github.drompincen.bugflow.ui.board;

import io.github.drompincen.bugflow.protocol.api.BugDto;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.runtime.bug.BugLifecycleService;
import io.github.drompincen.bugflow.runtime.bug.BugMapper;
import io.github.drompincen.bugflow.runtime.bug.ValidationResult;
import io.github.drompincen.bugflow.runtime.policy.Actor;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Talks to the lifecycle engine in-process, the same way the desktop app reads
 * the store directly.
 */
@Component
public class LocalBoardGateway implements BoardGateway {

    private final BugLifecycleService lifecycle;

    public LocalBoardGateway(BugLifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public List<BugDto> fetchBugs(String projectId) {
        return lifecycle.list(projectId, null, null).stream().map(BugMapper::toDto).toList();
    }

    @Override
    public LifecycleResult<BugDto> updateStatus(String bugId, BugStatus status, Actor actor) {
        return lifecycle.updateStatus(bugId, status, actor, null).map(BugMapper::toDto);
    }

    @Override
    public LifecycleResult<BugDto> validate(String bugId, Actor actor) {
        return lifecycle.validate(bugId, actor, null).map(ValidationResult::bug).map(BugMapper::toDto);
    }
}
