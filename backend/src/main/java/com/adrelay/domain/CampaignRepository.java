package com.adrelay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CampaignRepository extends MongoRepository<Campaign, String>, CampaignRepositoryCustom {

    Optional<Campaign> findByOrderId(String orderId);

    boolean existsByOrderId(String orderId);

    List<Campaign> findByConfirmationEmittedAtIsNullAndCreatedAtBefore(Instant createdBefore);
}
