package io.github.drompincen.bugflow.runtime.comment;

import io.github.drompincen.bugflow.persistence.document.CommentDocument;
import io.github.drompincen.bugflow.persistence.document.UserDocument;
import io.github.drompincen.bugflow.persistence.repository.BugRepository;
import io.github.drompincen.bugflow.persistence.repository.CommentRepository;
import io.github.drompincen.bugflow.persistence.repository.UserRepository;
import io.github.drompincen.bugflow.protocol.api.ActivityAction;
import io.github.drompincen.bugflow.protocol.api.CreateCommentRequest;
import io.github.drompincen.bugflow.runtime.activity.ActivityLogService;
import io.github.drompincen.bugflow.runtime.config.RuntimeConfig;
import io.github.drompincen.bugflow.runtime.policy.AuthorizationPolicy;
import io.github.drompincen.bugflow.runtime.policy.Decision;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
public class CommentService {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    private final CommentRepository commentRepository;
    private final BugRepository bugRepository;
    private final UserRepository userRepository;
    private final ActivityLogService activityLog;
    private final AuthorizationPolicy policy;
    private final Clock clock;
    private final Executor executor;

    public CommentService(CommentRepository commentRepository, BugRepository bugRepository,
                          UserRepository userRepository, ActivityLogService activityLog,
                          AuthorizationPolicy policy, Clock clock,
                          @Qualifier(RuntimeConfig.ENRICHMENT_EXECUTOR) Executor executor) {
        this.commentRepository = commentRepository;
        this.bugRepository = bugRepository;
        this.userRepository = userRepository;
        this.activityLog = activityLog;
        this.policy = policy;
        this.clock = clock;
        this.executor = executor;
    }

    public LifecycleResult<CommentDocument> create(CreateCommentRequest request) {
        try {
            CompletableFuture<Boolean> bugExists =
                    CompletableFuture.supplyAsync(() -> bugRepository.existsById(request.bugId()), executor);
            CompletableFuture<Optional<UserDocument>> author =
                    CompletableFuture.supplyAsync(() -> userRepository.findById(request.authorId()), executor);

            if (!bugExists.join()) {
                return LifecycleResult.failure(LifecycleError.notFound("Bug", request.bugId()));
            }
            Optional<UserDocument> authorDoc = author.join();
            if (authorDoc.isEmpty()) {
                return LifecycleResult.failure(LifecycleError.notFound("User", request.authorId()));
            }
            Decision decision = policy.checkComment(authorDoc.get().getRole());
            if (decision.denied()) {
                log.warn("Comment on bug {} denied for {}", request.bugId(), request.authorId());
                return LifecycleResult.failure(LifecycleError.forbidden(decision));
            }

            CommentDocument comment = new CommentDocument();
            comment.setCommentId(UUID.randomUUID().toString());
            comment.setBugId(request.bugId());
            comment.setAuthorId(request.authorId());
            comment.setMessage(request.message());
            comment.setCreatedAt(clock.instant());
            CommentDocument saved = commentRepository.insert(comment);
            activityLog.append(request.bugId(), ActivityAction.commented(), request.authorId());
            log.info("Comment {} added to bug {} by {}", saved.getCommentId(), request.bugId(), request.authorId());
            return LifecycleResult.success(saved);
        } catch (CompletionException e) {
            if (e.getCause() instanceof DataAccessException dae) {
                log.error("Existence check for comment on bug {} failed", request.bugId(), dae);
                return LifecycleResult.failure(LifecycleError.infrastructure(dae.getMostSpecificCause().getMessage()));
            }
            throw e;
        } catch (DataAccessException e) {
            log.error("Saving comment on bug {} failed", request.bugId(), e);
            return LifecycleResult.failure(LifecycleError.infrastructure(e.getMostSpecificCause().getMessage()));
        }
    }

    public List<CommentDocument> listByBug(String bugId) {
        return commentRepository.findByBugIdOrderByCreatedAtAsc(bugId);
    }
}
