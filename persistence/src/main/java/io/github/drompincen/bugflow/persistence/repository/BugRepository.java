package io.github.drompincen.bugflow.persistence.repository;

import io.github.drompincen.bugflow.persistence.document.BugDocument;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BugRepository extends MongoRepository<BugDocument, String> {
    List<BugDocument> findAllByOrderByUpdatedAtDesc();
    List<BugDocument> findByProjectIdOrderByUpdatedAtDesc(String projectId);
    List<BugDocument> findByStatusOrderByUpdatedAtDesc(BugStatus status);
    List<BugDocument> findByAssignedToOrderByUpdatedAtDesc(String assignedTo);
}
