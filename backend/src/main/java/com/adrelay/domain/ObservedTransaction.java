package com.adrelay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Incoming transfer fetched from the ledger, keyed by its ledger hash. Written once by the poller
 * (processed=false); processed flips to true exactly once, inside the same transaction as any order match.
 */
@Document(collection = "observed_transactions")
@CompoundIndexes({
        @CompoundIndex(name = "processed_address_time", def = "{'processed': 1, 'receivingAddress': 1, 'observedAt': 1}"),
        @CompoundIndex(name = "processed_outcome", def = "{'processed': 1, 'outcome': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ObservedTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String txId;
    private String receivingAddress;
    private String fromAddress;
    private String toAddress;
    private BigDecimal amount;
    private String memo;
    /** Ledger logical time (TON lt); orders transactions with the same timestamp. */
    private Long logicalTime;
    /** Ledger timestamp of the transfer. */
    private Instant observedAt;
    private Instant fetchedAt;
    private boolean processed;
    private ReconciliationOutcome outcome;
    private String orderId;
    private Instant processedAt;
    private String note;
}
