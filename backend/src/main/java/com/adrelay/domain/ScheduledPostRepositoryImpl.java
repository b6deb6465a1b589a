package com.adrelay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class ScheduledPostRepositoryImpl implements ScheduledPostRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<ScheduledPost> completeScheduled(String postId, ScheduledPostStatus target, String failureReason,
                                                     Instant now) {
        Query query = new Query(where("id").is(postId).and("status").is(ScheduledPostStatus.SCHEDULED));
        Update update = new Update()
                .set("status", target)
                .set("statusUpdatedAt", now)
                .set("failureReason", failureReason);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), ScheduledPost.class));
    }
}
