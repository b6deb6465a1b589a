package com.adrelay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AuditEntryRepository extends MongoRepository<AuditEntry, String> {

    List<AuditEntry> findByTxIdOrderByCreatedAtAsc(String txId);

    List<AuditEntry> findByOrderIdOrderByCreatedAtAsc(String orderId);
}
