package com.adrelay.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for observed_transactions. The processed flag and outcome change only through
 * {@link ObservedTransactionRepositoryCustom}.
 */
public interface ObservedTransactionRepository extends MongoRepository<ObservedTransaction, String>,
        ObservedTransactionRepositoryCustom {

    Optional<ObservedTransaction> findByTxId(String txId);

    List<ObservedTransaction> findByProcessedFalseOrderByObservedAtAsc(Pageable pageable);

    List<ObservedTransaction> findByReceivingAddressAndProcessedFalseOrderByObservedAtAsc(String receivingAddress, Pageable pageable);

    List<ObservedTransaction> findByProcessedTrueAndOutcomeInOrderByObservedAtDesc(Collection<ReconciliationOutcome> outcomes);
}
