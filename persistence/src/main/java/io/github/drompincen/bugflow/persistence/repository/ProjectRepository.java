package io.github.drompincen.bugflow.persistence.repository;

import io.github.drompincen.bugflow.persistence.document.ProjectDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ProjectRepository extends MongoRepository<ProjectDocument, String> {
    List<ProjectDocument> findAllByOrderByCreatedAtDesc();
}
