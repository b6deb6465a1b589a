package com.adrelay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed conditional transitions for orders. The status predicate is part of every filter,
 * so racing callers (matchers, the expiry sweep, cancellations) resolve on the server.
 */
@Repository
@RequiredArgsConstructor
public class OrderRepositoryImpl implements OrderRepositoryCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Order> tryMatch(String orderId, String txId, Instant now) {
        Query query = new Query(where("id").is(orderId)
                .and("status").is(OrderStatus.PENDING)
                .and("expiresAt").gt(now));
        Update update = new Update()
                .set("status", OrderStatus.MATCHED)
                .set("matchedTxId", txId)
                .set("matchedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, Order.class));
    }

    @Override
    public long expireStale(Instant now) {
        Query query = new Query(where("status").is(OrderStatus.PENDING).and("expiresAt").lte(now));
        Update update = new Update()
                .set("status", OrderStatus.EXPIRED)
                .set("closedAt", now);
        return mongoTemplate.updateMulti(query, update, Order.class).getModifiedCount();
    }

    @Override
    public Optional<Order> cancel(String orderId, String userId, Instant now) {
        Criteria criteria = where("id").is(orderId).and("status").is(OrderStatus.PENDING);
        if (userId != null) {
            criteria = criteria.and("userId").is(userId);
        }
        Update update = new Update()
                .set("status", OrderStatus.CANCELLED)
                .set("closedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(new Query(criteria), update, RETURN_NEW, Order.class));
    }

    @Override
    public boolean markProvisioned(String orderId, Instant now) {
        Query query = new Query(where("id").is(orderId)
                .and("status").is(OrderStatus.MATCHED)
                .and("provisionedAt").is(null));
        return mongoTemplate.updateFirst(query, new Update().set("provisionedAt", now), Order.class)
                .getModifiedCount() > 0;
    }
}
