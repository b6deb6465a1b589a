package com.adrelay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One purchase intent for a distribution run. Created PENDING by order intake; leaves PENDING exactly once,
 * through a status-guarded conditional update (match, expiry sweep or cancellation).
 * The reference code is unique among PENDING orders only (partial unique index), so it can be reissued later.
 */
@Document(collection = "orders")
@CompoundIndexes({
        @CompoundIndex(name = "pending_reference_code", def = "{'referenceCode': 1}", unique = true,
                partialFilter = "{'status': 'PENDING'}"),
        @CompoundIndex(name = "reference_code_created", def = "{'referenceCode': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "status_expires", def = "{'status': 1, 'expiresAt': 1}"),
        @CompoundIndex(name = "status_provisioned_matched", def = "{'status': 1, 'provisionedAt': 1, 'matchedAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String referenceCode;
    private String userId;
    /** Sender the buyer said they would pay from. Advisory: compared and logged, never enforced. */
    private String claimedPayerAddress;
    private String receivingAddress;
    private int durationDays;
    private List<String> channelIds;
    private BigDecimal expectedAmount;
    private int postsPerDay;
    private BigDecimal discountPercent;
    private Instant createdAt;
    private Instant expiresAt;
    private OrderStatus status;
    private String matchedTxId;
    private Instant matchedAt;
    /** Set once the order's campaign exists; MATCHED orders without it are picked up by the provisioning retry. */
    private Instant provisionedAt;
    /** Set when the order is expired or cancelled. */
    private Instant closedAt;
}
