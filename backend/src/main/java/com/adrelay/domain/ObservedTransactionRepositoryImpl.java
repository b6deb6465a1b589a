package com.adrelay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed writes for observed_transactions. Relies on the unique txId index for idempotent inserts.
 */
@Repository
@RequiredArgsConstructor
public class ObservedTransactionRepositoryImpl implements ObservedTransactionRepositoryCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean insertIfAbsent(ObservedTransaction transaction) {
        try {
            mongoTemplate.insert(transaction);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public Optional<ObservedTransaction> markProcessed(String txId, ReconciliationOutcome outcome, String orderId,
                                                       String note, Instant now) {
        Query query = new Query(where("txId").is(txId).and("processed").is(false));
        Update update = new Update()
                .set("processed", true)
                .set("outcome", outcome)
                .set("orderId", orderId)
                .set("note", note)
                .set("processedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, ObservedTransaction.class));
    }

    @Override
    public Optional<ObservedTransaction> changeOutcome(String txId, Collection<ReconciliationOutcome> expected,
                                                       ReconciliationOutcome outcome, String orderId, String note,
                                                       Instant now) {
        Query query = new Query(where("txId").is(txId)
                .and("processed").is(true)
                .and("outcome").in(expected));
        Update update = new Update()
                .set("outcome", outcome)
                .set("note", note)
                .set("processedAt", now);
        if (orderId != null) {
            update.set("orderId", orderId);
        }
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, ObservedTransaction.class));
    }
}
