package com.adrelay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for orders. Status changes go through {@link OrderRepositoryCustom}, never through save().
 */
public interface OrderRepository extends MongoRepository<Order, String>, OrderRepositoryCustom {

    Optional<Order> findFirstByReferenceCodeAndStatus(String referenceCode, OrderStatus status);

    Optional<Order> findFirstByReferenceCodeOrderByCreatedAtDesc(String referenceCode);

    /** The order that held the code at the given time. */
    Optional<Order> findFirstByReferenceCodeAndCreatedAtLessThanEqualOrderByCreatedAtDesc(String referenceCode,
                                                                                            Instant createdAt);

    boolean existsByReferenceCodeAndStatus(String referenceCode, OrderStatus status);

    /** Matched orders not yet marked provisioned; candidates for the provisioning retry. */
    List<Order> findByStatusAndProvisionedAtIsNullAndMatchedAtBefore(OrderStatus status, Instant matchedBefore);
}
