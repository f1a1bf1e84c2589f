package io.github.drompincen.bugflow.runtime.activity;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import io.github.drompincen.bugflow.persistence.repository.ActivityRepository;
import io.github.drompincen.bugflow.protocol.api.ActivityAction;
import io.github.drompincen.bugflow.runtime.config.ActivityProperties;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit trail. Each bug has its own sequence; within a bug, records
 * get strictly increasing {@code seq} and non-decreasing timestamps, so the
 * newest-first read order is total.
 */
@Service
public class ActivityLogService {

    private static final Logger log = LoggerFactory.getLogger(ActivityLogService.class);
    private static final int MAX_INSERT_ATTEMPTS = 3;

    private final ActivityRepository activityRepository;
    private final ActivityProperties properties;
    private final Clock clock;
    private final Map<String, Cursor> cursors;

    public ActivityLogService(ActivityRepository activityRepository, ActivityProperties properties, Clock clock) {
        this.activityRepository = activityRepository;
        this.properties = properties;
        this.clock = clock;
        int capacity = Math.max(1, properties.getCursorCacheSize());
        // least recently used bugs drop out; a later append reloads from the store
        this.cursors = Collections.synchronizedMap(new LinkedHashMap<String, Cursor>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Cursor> eldest) {
                return size() > capacity;
            }
        });
    }

    public ActivityDocument append(String bugId, ActivityAction action, String authorId) {
        Objects.requireNonNull(bugId, "bugId");
        Objects.requireNonNull(action, "action");
        if (!action.isComplete()) {
            throw new IllegalArgumentException("Action " + action.kind().code() + " is missing its target");
        }
        return insert(bugId, action, authorId, null, null);
    }

    /**
     * Migrates one record written in the old colon-delimited encoding. The raw
     * string is kept alongside the decoded action. Records missing a target are
     * accepted here since they already exist.
     */
    public LifecycleResult<ActivityDocument> importLegacy(String bugId, String encodedAction, String authorId,
                                                          Instant timestamp) {
        ActivityAction action;
        try {
            action = ActivityAction.fromLegacy(encodedAction);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping legacy activity for bug {}: {}", bugId, e.getMessage());
            return LifecycleResult.failure(LifecycleError.validationFailed(
                    "Unrecognized legacy action '" + encodedAction + "'"));
        }
        return LifecycleResult.success(insert(bugId, action, authorId, timestamp, encodedAction));
    }

    public List<ActivityDocument> listByBug(String bugId) {
        return activityRepository.findByBugIdOrderByTimestampDescSeqDesc(bugId);
    }

    public List<ActivityDocument> listRecent(int limit) {
        return activityRepository.findAllByOrderByTimestampDescSeqDesc(PageRequest.of(0, limit));
    }

    public List<ActivityDocument> listAll() {
        return activityRepository.findAllByOrderByTimestampDescSeqDesc();
    }

    /**
     * Feed read. A bug filter wins over a limit; with neither, everything is
     * returned. The limit arrives raw so that malformed values are reported the
     * same way as out-of-range ones.
     */
    public LifecycleResult<List<ActivityDocument>> query(String bugId, String rawLimit) {
        if (bugId != null && !bugId.isBlank()) {
            return LifecycleResult.success(listByBug(bugId));
        }
        if (rawLimit == null || rawLimit.isBlank()) {
            return LifecycleResult.success(listAll());
        }
        int limit;
        try {
            limit = Integer.parseInt(rawLimit.trim());
        } catch (NumberFormatException e) {
            return LifecycleResult.failure(LifecycleError.validationFailed("Limit must be a positive integer"));
        }
        if (limit <= 0) {
            return LifecycleResult.failure(LifecycleError.validationFailed("Limit must be a positive integer"));
        }
        if (limit > properties.getMaxRecentLimit()) {
            return LifecycleResult.failure(LifecycleError.validationFailed(
                    "Limit must not exceed " + properties.getMaxRecentLimit()));
        }
        return LifecycleResult.success(listRecent(limit));
    }

    int cachedCursors() {
        return cursors.size();
    }

    private ActivityDocument insert(String bugId, ActivityAction action, String authorId,
                                    Instant importedAt, String legacyAction) {
        Cursor cursor = cursors.computeIfAbsent(bugId, this::loadCursor);
        for (int attempt = 1; ; attempt++) {
            ActivityDocument doc = new ActivityDocument();
            doc.setActivityId(UUID.randomUUID().toString());
            doc.setBugId(bugId);
            doc.applyAction(action);
            doc.setAuthorId(authorId);
            doc.setLegacyAction(legacyAction);
            synchronized (cursor) {
                doc.setSeq(cursor.seq + 1);
                doc.setTimestamp(importedAt != null ? importedAt : cursor.nextTimestamp(clock.instant()));
                try {
                    ActivityDocument saved = activityRepository.insert(doc);
                    cursor.seq = saved.getSeq();
                    if (cursor.lastTimestamp == null || saved.getTimestamp().isAfter(cursor.lastTimestamp)) {
                        cursor.lastTimestamp = saved.getTimestamp();
                    }
                    log.debug("Activity {} seq {} on bug {} by {}", action.kind().code(), saved.getSeq(), bugId, authorId);
                    return saved;
                } catch (DuplicateKeyException e) {
                    if (attempt >= MAX_INSERT_ATTEMPTS) {
                        throw e;
                    }
                    // another writer took this seq; resync from the store
                    log.warn("Seq {} already taken on bug {}, reloading cursor", doc.getSeq(), bugId);
                    Cursor fresh = loadCursor(bugId);
                    cursor.seq = fresh.seq;
                    cursor.lastTimestamp = fresh.lastTimestamp;
                }
            }
        }
    }

    private Cursor loadCursor(String bugId) {
        Cursor cursor = new Cursor();
        activityRepository.findTopByBugIdOrderBySeqDesc(bugId).ifPresent(last -> {
            cursor.seq = last.getSeq();
            cursor.lastTimestamp = last.getTimestamp();
        });
        return cursor;
    }

    private static final class Cursor {
        long seq;
        Instant lastTimestamp;

        Instant nextTimestamp(Instant now) {
            return lastTimestamp != null && now.isBefore(lastTimestamp) ? lastTimestamp : now;
        }
    }
}
