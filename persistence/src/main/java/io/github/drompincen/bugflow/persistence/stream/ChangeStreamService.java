package io.github.drompincen.bugflow.persistence.stream;

import io.github.drompincen.bugflow.persistence.document.ActivityDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.ChangeStreamEvent;
import org.springframework.data.mongodb.core.ChangeStreamOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.match;
import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Tails inserts on a collection. Requires MongoDB running as a replica set.
 * Since every accepted bug mutation inserts exactly one activity, watching the
 * activities collection is enough to know when board state went stale.
 */
@Service
public class ChangeStreamService {

    private static final Logger log = LoggerFactory.getLogger(ChangeStreamService.class);

    static final String ACTIVITIES = "activities";

    private final ReactiveMongoTemplate reactiveMongoTemplate;

    public ChangeStreamService(ReactiveMongoTemplate reactiveMongoTemplate) {
        this.reactiveMongoTemplate = reactiveMongoTemplate;
    }

    public <T> Flux<T> watchInserts(String collection, Class<T> type) {
        return watch(collection, type, where("operationType").is("insert"));
    }

    public Flux<ActivityDocument> watchActivities() {
        return watchInserts(ACTIVITIES, ActivityDocument.class);
    }

    private <T> Flux<T> watch(String collection, Class<T> type, Criteria criteria) {
        return reactiveMongoTemplate.changeStream(collection,
                        ChangeStreamOptions.builder()
                                .filter(Aggregation.newAggregation(match(criteria)))
                                .build(),
                        type)
                .mapNotNull(ChangeStreamEvent::getBody)
                .doOnError(e -> log.warn("Change stream error on {}: {}", collection, e.getMessage()));
    }
}
