package io.github.drompincen.bugflow.runtime.support;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.persistence.document.CommentDocument;
import io.github.drompincen.bugflow.persistence.document.ProjectDocument;
import io.github.drompincen.bugflow.persistence.document.UserDocument;
import io.github.drompincen.bugflow.persistence.repository.ActivityRepository;
import io.github.drompincen.bugflow.persistence.repository.BugRepository;
import io.github.drompincen.bugflow.persistence.repository.CommentRepository;
import io.github.drompincen.bugflow.persistence.repository.ProjectRepository;
import io.github.drompincen.bugflow.persistence.repository.UserRepository;
import io.github.drompincen.bugflow.protocol.api.UserRole;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Map-backed repository mocks. Bug saves behave like a versioned document store:
 * reads hand out detached copies and a save whose version no longer matches the
 * stored one fails with {@link OptimisticLockingFailureException}.
 */
public class InMemoryStore {

    private static final Comparator<ActivityDocument> NEWEST_FIRST =
            Comparator.comparing(ActivityDocument::getTimestamp).thenComparingLong(ActivityDocument::getSeq).reversed();

    public final Map<String, BugDocument> bugs = new ConcurrentHashMap<>();
    public final Map<String, UserDocument> users = new ConcurrentHashMap<>();
    public final Map<String, ProjectDocument> projects = new ConcurrentHashMap<>();
    public final List<ActivityDocument> activities = new CopyOnWriteArrayList<>();
    public final List<CommentDocument> comments = new CopyOnWriteArrayList<>();

    public final BugRepository bugRepository = mock(BugRepository.class);
    public final UserRepository userRepository = mock(UserRepository.class);
    public final ProjectRepository projectRepository = mock(ProjectRepository.class);
    public final ActivityRepository activityRepository = mock(ActivityRepository.class);
    public final CommentRepository commentRepository = mock(CommentRepository.class);

    public InMemoryStore() {
        wireBugs();
        wireUsersAndProjects();
        wireActivities();
        when(commentRepository.insert(any(CommentDocument.class))).thenAnswer(inv -> {
            CommentDocument c = inv.getArgument(0);
            comments.add(c);
            return c;
        });
        when(commentRepository.findByBugIdOrderByCreatedAtAsc(anyString())).thenAnswer(inv -> comments.stream()
                .filter(c -> c.getBugId().equals(inv.getArgument(0)))
                .sorted(Comparator.comparing(CommentDocument::getCreatedAt))
                .toList());
    }

    public UserDocument addUser(String id, String name, UserRole role) {
        UserDocument u = new UserDocument();
        u.setUserId(id);
        u.setName(name);
        u.setEmail(id + "@example.com");
        u.setRole(role);
        users.put(id, u);
        return u;
    }

    public ProjectDocument addProject(String id, String name) {
        ProjectDocument p = new ProjectDocument();
        p.setProjectId(id);
        p.setName(name);
        p.setDescription(name);
        p.setCreatedAt(Instant.EPOCH);
        projects.put(id, p);
        return p;
    }

    public List<ActivityDocument> activitiesFor(String bugId) {
        return activities.stream()
                .filter(a -> a.getBugId().equals(bugId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    public BugDocument stored(String bugId) {
        return bugs.get(bugId);
    }

    private void wireBugs() {
        when(bugRepository.insert(any(BugDocument.class))).thenAnswer(inv -> {
            BugDocument doc = inv.getArgument(0);
            doc.setVersion(0L);
            bugs.put(doc.getBugId(), doc.copy());
            return doc;
        });
        when(bugRepository.save(any(BugDocument.class))).thenAnswer(inv -> {
            BugDocument doc = inv.getArgument(0);
            synchronized (bugs) {
                BugDocument current = bugs.get(doc.getBugId());
                Long currentVersion = current != null ? current.getVersion() : null;
                if (current != null && !currentVersion.equals(doc.getVersion())) {
                    throw new OptimisticLockingFailureException("Version " + doc.getVersion()
                            + " of bug " + doc.getBugId() + " is stale");
                }
                doc.setVersion(currentVersion == null ? 0L : currentVersion + 1);
                bugs.put(doc.getBugId(), doc.copy());
            }
            return doc;
        });
        doAnswer(inv -> bugs.remove((String) inv.getArgument(0))).when(bugRepository).deleteById(anyString());
        when(bugRepository.findById(anyString())).thenAnswer(inv ->
                Optional.ofNullable(bugs.get((String) inv.getArgument(0))).map(BugDocument::copy));
        when(bugRepository.existsById(anyString())).thenAnswer(inv -> bugs.containsKey((String) inv.getArgument(0)));
        when(bugRepository.findAllById(any())).thenAnswer(inv -> {
            List<BugDocument> found = new ArrayList<>();
            for (Object id : (Iterable<?>) inv.getArgument(0)) {
                BugDocument b = bugs.get((String) id);
                if (b != null) found.add(b.copy());
            }
            return found;
        });
        when(bugRepository.findAllByOrderByUpdatedAtDesc()).thenAnswer(inv -> bugs.values().stream()
                .sorted(Comparator.comparing(BugDocument::getUpdatedAt).reversed())
                .map(BugDocument::copy)
                .toList());
    }

    private void wireUsersAndProjects() {
        when(userRepository.existsById(anyString())).thenAnswer(inv -> users.containsKey((String) inv.getArgument(0)));
        when(userRepository.findById(anyString())).thenAnswer(inv ->
                Optional.ofNullable(users.get((String) inv.getArgument(0))));
        when(userRepository.findAllById(any())).thenAnswer(inv -> {
            List<UserDocument> found = new ArrayList<>();
            for (Object id : (Iterable<?>) inv.getArgument(0)) {
                UserDocument u = users.get((String) id);
                if (u != null) found.add(u);
            }
            return found;
        });
        when(projectRepository.existsById(anyString())).thenAnswer(inv ->
                projects.containsKey((String) inv.getArgument(0)));
        when(projectRepository.findAllById(any())).thenAnswer(inv -> {
            List<ProjectDocument> found = new ArrayList<>();
            for (Object id : (Iterable<?>) inv.getArgument(0)) {
                ProjectDocument p = projects.get((String) id);
                if (p != null) found.add(p);
            }
            return found;
        });
    }

    private void wireActivities() {
        when(activityRepository.insert(any(ActivityDocument.class))).thenAnswer(inv -> {
            ActivityDocument doc = inv.getArgument(0);
            synchronized (activities) {
                boolean taken = activities.stream()
                        .anyMatch(a -> a.getBugId().equals(doc.getBugId()) && a.getSeq() == doc.getSeq());
                if (taken) {
                    throw new DuplicateKeyException("bug_seq " + doc.getBugId() + "/" + doc.getSeq());
                }
                activities.add(doc);
            }
            return doc;
        });
        when(activityRepository.findTopByBugIdOrderBySeqDesc(anyString())).thenAnswer(inv -> activities.stream()
                .filter(a -> a.getBugId().equals(inv.getArgument(0)))
                .max(Comparator.comparingLong(ActivityDocument::getSeq)));
        when(activityRepository.findByBugIdOrderByTimestampDescSeqDesc(anyString())).thenAnswer(inv ->
                activitiesFor(inv.getArgument(0)));
        when(activityRepository.findAllByOrderByTimestampDescSeqDesc()).thenAnswer(inv ->
                activities.stream().sorted(NEWEST_FIRST).toList());
        when(activityRepository.findAllByOrderByTimestampDescSeqDesc(any(Pageable.class))).thenAnswer(inv -> {
            Pageable page = inv.getArgument(0);
            return activities.stream().sorted(NEWEST_FIRST).limit(page.getPageSize()).toList();
        });
    }
}
