package com.adrelay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only record of an administrative correction, written whether the action succeeded or was rejected.
 */
@Document(collection = "admin_audit_log")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AuditEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String action;
    private String actor;
    private String reason;
    @Indexed
    private String txId;
    @Indexed
    private String orderId;
    private String campaignId;
    /** OK or the rejection error code. */
    private String result;
    private Instant createdAt;
}
