package com.adrelay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed cursor updates.
 */
@Repository
@RequiredArgsConstructor
public class PollCursorRepositoryImpl implements PollCursorRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public PollCursor ensureCursor(String receivingAddress, Instant now) {
        Query query = new Query(where("receivingAddress").is(receivingAddress));
        Update update = new Update()
                .setOnInsert("consecutiveFailures", 0)
                .setOnInsert("updatedAt", now);
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), PollCursor.class);
    }

    @Override
    public boolean advance(String receivingAddress, Instant seenAt, String txId, Long logicalTime, Instant now) {
        Query query = new Query(where("receivingAddress").is(receivingAddress)
                .orOperator(where("lastSeenAt").is(null), where("lastSeenAt").lt(seenAt)));
        Update update = new Update()
                .set("lastSeenAt", seenAt)
                .set("lastTxId", txId)
                .set("lastLogicalTime", logicalTime)
                .set("updatedAt", now);
        return mongoTemplate.updateFirst(query, update, PollCursor.class).getModifiedCount() == 1;
    }

    @Override
    public void saveResumePoint(String receivingAddress, PollCursor.ResumePoint resumePoint, Instant now) {
        Update update = new Update()
                .set("resumePoint", resumePoint)
                .set("updatedAt", now);
        mongoTemplate.updateFirst(byAddress(receivingAddress), update, PollCursor.class);
    }

    @Override
    public void clearResumePoint(String receivingAddress, Instant now) {
        Update update = new Update()
                .unset("resumePoint")
                .set("updatedAt", now);
        mongoTemplate.updateFirst(byAddress(receivingAddress), update, PollCursor.class);
    }

    @Override
    public void recordFailure(String receivingAddress, int consecutiveFailures, Instant nextAttemptAfter,
                              String error, Instant now) {
        Update update = new Update()
                .set("consecutiveFailures", consecutiveFailures)
                .set("nextAttemptAfter", nextAttemptAfter)
                .set("lastError", error)
                .set("updatedAt", now);
        mongoTemplate.updateFirst(byAddress(receivingAddress), update, PollCursor.class);
    }

    @Override
    public void recordSuccess(String receivingAddress, Instant now) {
        Update update = new Update()
                .set("consecutiveFailures", 0)
                .unset("nextAttemptAfter")
                .unset("lastError")
                .set("updatedAt", now);
        mongoTemplate.updateFirst(byAddress(receivingAddress), update, PollCursor.class);
    }

    private static Query byAddress(String receivingAddress) {
        return new Query(Criteria.where("receivingAddress").is(receivingAddress));
    }
}
