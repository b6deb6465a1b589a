package com.adrelay.ingestion.adapter;

import com.adrelay.ingestion.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Chain: TON Center, then tonapi.io when TON Center could not be read (and the fallback is enabled).
 * Both report the same txIds and positions, so a resume position taken from one is valid for the other.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class ChainedTransferSource implements TransferSource {

    private final TonCenterTransferSource tonCenterTransferSource;
    private final TonApiTransferSource tonApiTransferSource;
    private final IngestionProperties properties;

    @Override
    public TransferBatch fetchSince(String receivingAddress, Instant since, LedgerPosition startAfter) {
        try {
            return tonCenterTransferSource.fetchSince(receivingAddress, since, startAfter);
        } catch (LedgerException e) {
            if (!properties.getTonapi().isEnabled()) {
                throw e;
            }
            log.warn("TON Center read of {} failed, falling back to tonapi: {}", receivingAddress, e.getMessage());
            try {
                return tonApiTransferSource.fetchSince(receivingAddress, since, startAfter);
            } catch (LedgerException fallbackFailure) {
                fallbackFailure.addSuppressed(e);
                throw fallbackFailure;
            }
        }
    }
}
