package com.adrelay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Provisioned output of a matched order; exactly one per order (unique orderId).
 */
@Document(collection = "campaigns")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Campaign {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String orderId;
    private String userId;
    private String referenceCode;
    private List<String> channelIds;
    private int durationDays;
    private int postsPerDay;
    private int totalPosts;
    /** First slot of day 0; equals the order's matchedAt. */
    private Instant startsAt;
    private Instant createdAt;
    /** Null until the confirmation callback has been invoked. */
    private Instant confirmationEmittedAt;
}
