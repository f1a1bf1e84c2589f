package io.github.drompincen.bugflow.persistence.repository;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read and insert access to the audit trail. Nothing here updates or deletes.
 */
public interface ActivityRepository extends Repository<ActivityDocument, String> {
    <S extends ActivityDocument> S insert(S activity);
    List<ActivityDocument> findByBugIdOrderByTimestampDescSeqDesc(String bugId);
    List<ActivityDocument> findAllByOrderByTimestampDescSeqDesc();
    List<ActivityDocument> findAllByOrderByTimestampDescSeqDesc(Pageable pageable);
    Optional<ActivityDocument> findTopByBugIdOrderBySeqDesc(String bugId);
}
