package io.github.drompincen.bugflow.persistence.repository;

import io.github.drompincen.bugflow.persistence.document.CommentDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CommentRepository extends MongoRepository<CommentDocument, String> {
    List<CommentDocument> findByBugIdOrderByCreatedAtAsc(String bugId);
}
