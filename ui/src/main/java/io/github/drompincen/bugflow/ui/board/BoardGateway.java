package io.github.drompincen.bugflow.ui.board;

import io.github.drompincen.bugflow.protocol.api.BugDto;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.runtime.policy.Actor;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;

import java.util.List;

/**
 * The authoritative side the board reconciles against.
 */
public interface BoardGateway {

    List<BugDto> fetchBugs(String projectId);

    LifecycleResult<BugDto> updateStatus(String bugId, BugStatus status, Actor actor);

    LifecycleResult<BugDto> validate(String bugId, Actor actor);
}
