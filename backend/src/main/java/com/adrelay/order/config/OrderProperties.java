package com.adrelay.order.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Order intake and lifetime. Documented in application.yml under adrelay.order.
 */
@ConfigurationProperties(prefix = "adrelay.order")
@NoArgsConstructor
@Getter
@Setter
public class OrderProperties {

    /** Seconds a pending order waits for payment. Default 1200 (20 min). */
    private long ttlSeconds = 1200L;

    /** Reference code draws before giving up with REFERENCE_CODE_EXHAUSTED. Default 10. */
    private int referenceCodeMaxAttempts = 10;

    /** Period of the PENDING -> EXPIRED sweep. Default 60. */
    private long expirySweepIntervalSeconds = 60L;

    /**
     * Addresses buyers pay to, assigned to new orders round-robin. The payment poller watches each of them.
     */
    private List<String> receivingAddresses = new ArrayList<>();
}
