package com.adrelay.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class CampaignRepositoryImpl implements CampaignRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean markConfirmationEmitted(String campaignId, Instant now) {
        Query query = new Query(where("id").is(campaignId).and("confirmationEmittedAt").is(null));
        Update update = new Update().set("confirmationEmittedAt", now);
        return mongoTemplate.updateFirst(query, update, Campaign.class).getModifiedCount() == 1;
    }
}
