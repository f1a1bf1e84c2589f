package io.github.drompincen.bugflow.runtime.activity;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.persistence.document.ProjectDocument;
import io.github.drompincen.bugflow.persistence.document.UserDocument;
import io.github.drompincen.bugflow.persistence.repository.BugRepository;
import io.github.drompincen.bugflow.persistence.repository.ProjectRepository;
import io.github.drompincen.bugflow.persistence.repository.UserRepository;
import io.github.drompincen.bugflow.protocol.api.ActivityAction;
import io.github.drompincen.bugflow.protocol.api.ActivityFeedItemDto;
import io.github.drompincen.bugflow.runtime.config.ActivityProperties;
import io.github.drompincen.bugflow.runtime.config.RuntimeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Joins activities with user, bug and project names for the dashboard feed.
 * Lookups run in parallel; one that fails or times out degrades to placeholder
 * names instead of failing the read.
 */
@Service
public class ActivityFeedService {

    private static final Logger log = LoggerFactory.getLogger(ActivityFeedService.class);

    static final String UNKNOWN_USER = "Unknown User";
    static final String UNKNOWN_BUG = "Unknown Bug";
    static final String UNKNOWN_PROJECT = "Unknown Project";

    private final UserRepository userRepository;
    private final BugRepository bugRepository;
    private final ProjectRepository projectRepository;
    private final ActivityProperties properties;
    private final Executor executor;

    public ActivityFeedService(UserRepository userRepository, BugRepository bugRepository,
                               ProjectRepository projectRepository, ActivityProperties properties,
                               @Qualifier(RuntimeConfig.ENRICHMENT_EXECUTOR) Executor executor) {
        this.userRepository = userRepository;
        this.bugRepository = bugRepository;
        this.projectRepository = projectRepository;
        this.properties = properties;
        this.executor = executor;
    }

    public List<ActivityFeedItemDto> enrich(List<ActivityDocument> activities) {
        if (activities.isEmpty()) {
            return List.of();
        }
        Set<String> userIds = new HashSet<>();
        Set<String> bugIds = new HashSet<>();
        for (ActivityDocument a : activities) {
            if (a.getAuthorId() != null) userIds.add(a.getAuthorId());
            if (a.getTargetUserId() != null) userIds.add(a.getTargetUserId());
            bugIds.add(a.getBugId());
        }

        CompletableFuture<Map<String, UserDocument>> usersFuture =
                lookup(() -> userRepository.findAllById(userIds), UserDocument::getUserId);
        CompletableFuture<Map<String, BugDocument>> bugsFuture =
                lookup(() -> bugRepository.findAllById(bugIds), BugDocument::getBugId);

        Map<String, BugDocument> bugs = await(bugsFuture, "bugs");
        Set<String> projectIds = bugs.values().stream()
                .map(BugDocument::getProjectId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<String, ProjectDocument> projects = projectIds.isEmpty()
                ? Map.of()
                : await(lookup(() -> projectRepository.findAllById(projectIds), ProjectDocument::getProjectId), "projects");
        Map<String, UserDocument> users = await(usersFuture, "users");

        return activities.stream()
                .map(a -> toFeedItem(a, users, bugs, projects))
                .toList();
    }

    private ActivityFeedItemDto toFeedItem(ActivityDocument a, Map<String, UserDocument> users,
                                           Map<String, BugDocument> bugs, Map<String, ProjectDocument> projects) {
        ActivityAction action = a.toAction();
        BugDocument bug = bugs.get(a.getBugId());
        String projectId = bug != null ? bug.getProjectId() : null;
        ProjectDocument project = projectId != null ? projects.get(projectId) : null;

        String assignedToName = action instanceof ActivityAction.Assigned assigned && assigned.to() != null
                ? userName(users, assigned.to())
                : null;

        return new ActivityFeedItemDto(
                a.getActivityId(),
                a.getBugId(),
                action,
                a.getAuthorId(),
                a.getTimestamp(),
                action instanceof ActivityAction.StatusChanged sc ? sc.to() : null,
                assignedToName,
                userName(users, a.getAuthorId()),
                bug != null ? bug.getTitle() : UNKNOWN_BUG,
                projectId,
                project != null ? project.getName() : UNKNOWN_PROJECT);
    }

    private static String userName(Map<String, UserDocument> users, String userId) {
        UserDocument user = userId != null ? users.get(userId) : null;
        return user != null ? user.getName() : UNKNOWN_USER;
    }

    private <T> CompletableFuture<Map<String, T>> lookup(Supplier<Iterable<T>> query, Function<T, String> idOf) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                Map<String, T> byId = new HashMap<>();
                for (T item : query.get()) {
                    byId.put(idOf.apply(item), item);
                }
                return byId;
            }, executor);
        } catch (RejectedExecutionException e) {
            // pool saturated; await() turns this into placeholders
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> Map<String, T> await(CompletableFuture<Map<String, T>> future, String what) {
        try {
            return future.get(properties.getEnrichmentTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Timed out loading {} for activity feed, using placeholders", what);
        } catch (ExecutionException e) {
            log.warn("Failed loading {} for activity feed, using placeholders: {}", what, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted loading {} for activity feed", what);
        }
        return Map.of();
    }
}
