package com.adrelay.ingestion.adapter;

import com.adrelay.ingestion.config.IngestionProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TON Center v2 transfer source: pages getTransactions backwards from the newest transaction (or from a resume
 * position) until the requested start time or the page limit is reached. Only transactions with an incoming
 * internal message are transfers; external-in messages and entries without in_msg are skipped. Amounts arrive
 * in nanotons.
 */
@Slf4j
@Component
public class TonCenterTransferSource implements TransferSource {

    private static final String TEXT_PAYLOAD_TYPE = "msg.dataText";

    private final LedgerClient ledgerClient;
    private final LedgerEndpointRotator rotator;
    private final RateLimiter ledgerRateLimiter;
    private final IngestionProperties properties;
    private final ObjectMapper objectMapper;

    public TonCenterTransferSource(
            LedgerClient ledgerClient,
            @Qualifier("ledgerEndpointRotator") LedgerEndpointRotator rotator,
            @Qualifier("ledgerRateLimiter") RateLimiter ledgerRateLimiter,
            IngestionProperties properties,
            ObjectMapper objectMapper
    ) {
        this.ledgerClient = ledgerClient;
        this.rotator = rotator;
        this.ledgerRateLimiter = ledgerRateLimiter;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public TransferBatch fetchSince(String receivingAddress, Instant since, LedgerPosition startAfter) {
        int pageSize = Math.max(1, properties.getPageSize());
        int maxPages = Math.max(1, properties.getMaxPagesPerCycle());
        Map<String, LedgerTransfer> byTxId = new LinkedHashMap<>();
        LedgerPosition position = startAfter;
        Instant newestReadAt = null;
        boolean complete = false;
        for (int page = 0; page < maxPages && !complete; page++) {
            // lt/hash start a page at that transaction inclusive: ask for one more and drop it
            int limit = position == null ? pageSize : pageSize + 1;
            JsonNode result = fetchPageWithRetry(receivingAddress, limit, position);
            int fresh = 0;
            boolean reachedSince = false;
            LedgerPosition oldest = position;
            for (JsonNode item : result) {
                long itemLt = requireLong(item.path("transaction_id").path("lt"), "transaction_id.lt");
                String itemHash = requireText(item.path("transaction_id").path("hash"), "transaction_id.hash");
                if (position != null && position.matches(itemLt, itemHash)) {
                    continue;
                }
                fresh++;
                Instant timestamp = Instant.ofEpochSecond(requireLong(item.path("utime"), "utime"));
                oldest = new LedgerPosition(itemLt, itemHash);
                if (newestReadAt == null || timestamp.isAfter(newestReadAt)) {
                    newestReadAt = timestamp;
                }
                if (timestamp.isBefore(since)) {
                    reachedSince = true;
                    continue;
                }
                toIncomingTransfer(item, itemHash, itemLt, timestamp, receivingAddress)
                        .ifPresent(t -> byTxId.putIfAbsent(t.txId(), t));
            }
            complete = reachedSince || fresh < pageSize;
            position = oldest;
        }
        List<LedgerTransfer> transfers = new ArrayList<>(byTxId.values());
        transfers.sort(Comparator.comparing(LedgerTransfer::timestamp).thenComparingLong(LedgerTransfer::logicalTime));
        if (complete) {
            return TransferBatch.complete(transfers, newestReadAt);
        }
        log.info("Ledger history for {} not read back to {} within {} page(s); continuing before lt {} next cycle",
                receivingAddress, since, maxPages, position.logicalTime());
        return new TransferBatch(transfers, false, position, newestReadAt);
    }

    private JsonNode fetchPageWithRetry(String address, int limit, LedgerPosition start) {
        Long lt = start == null ? null : start.logicalTime();
        String hash = start == null ? null : start.hash();
        LedgerException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LedgerException("Interrupted during retry", e);
                }
            }
            String endpoint = rotator.nextEndpoint(System.currentTimeMillis());
            try {
                if (!ledgerRateLimiter.acquirePermission()) {
                    throw new LedgerException("Local limiter timeout before getTransactions on " + endpoint);
                }
                String body = ledgerClient.getTransactions(endpoint, address, limit, lt, hash).block();
                return parseResult(body, endpoint);
            } catch (LedgerException e) {
                lastException = e;
                rotator.coolDown(endpoint, System.currentTimeMillis() + rotator.retryDelayMs(attempt));
                log.warn("getTransactions attempt {}/{} for {} on {} failed: {}",
                        attempt + 1, rotator.getMaxAttempts(), address, endpoint, e.getMessage());
            }
        }
        throw new LedgerException("getTransactions failed for " + address + " after "
                + rotator.getMaxAttempts() + " attempt(s)", lastException);
    }

    private JsonNode parseResult(String body, String endpoint) {
        if (body == null || body.isBlank()) {
            throw new LedgerException("Empty response from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LedgerException("Unparsable getTransactions response from " + endpoint, e);
        }
        if (!root.path("ok").asBoolean(false)) {
            throw new LedgerException("getTransactions error from " + endpoint + ": " + root.path("error").asText("unknown"));
        }
        JsonNode result = root.path("result");
        if (!result.isArray()) {
            throw new LedgerException("getTransactions result is not an array (" + endpoint + ")");
        }
        return result;
    }

    private Optional<LedgerTransfer> toIncomingTransfer(JsonNode item, String txId, long lt, Instant timestamp,
                                                        String receivingAddress) {
        JsonNode inMsg = item.path("in_msg");
        if (inMsg.isMissingNode() || inMsg.isNull()) {
            return Optional.empty();
        }
        String source = inMsg.path("source").asText("");
        if (source.isBlank()) {
            return Optional.empty();
        }
        BigDecimal amount = toAmount(requireText(inMsg.path("value"), "in_msg.value"));
        String destination = inMsg.path("destination").asText("");
        if (destination.isBlank()) {
            destination = receivingAddress;
        }
        return Optional.of(new LedgerTransfer(txId, lt, source, destination, amount, memoOf(inMsg, txId), timestamp));
    }

    private BigDecimal toAmount(String baseUnits) {
        try {
            return new BigDecimal(new BigInteger(baseUnits.strip())).movePointLeft(properties.getAmountDecimals());
        } catch (NumberFormatException e) {
            throw new LedgerException("Malformed in_msg.value: " + baseUnits, e);
        }
    }

    private static String memoOf(JsonNode inMsg, String txId) {
        String message = inMsg.path("message").asText("");
        if (!message.isBlank()) {
            return message.strip();
        }
        JsonNode msgData = inMsg.path("msg_data");
        if (TEXT_PAYLOAD_TYPE.equals(msgData.path("@type").asText()) && msgData.hasNonNull("text")) {
            try {
                String decoded = new String(Base64.getDecoder().decode(msgData.path("text").asText()), StandardCharsets.UTF_8);
                return decoded.isBlank() ? null : decoded.strip();
            } catch (IllegalArgumentException e) {
                log.debug("Undecodable text payload on {}: {}", txId, e.getMessage());
            }
        }
        return null;
    }

    private static long requireLong(JsonNode node, String field) {
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().strip());
            } catch (NumberFormatException e) {
                throw new LedgerException("Malformed " + field + ": " + node.asText(), e);
            }
        }
        throw new LedgerException("Missing " + field);
    }

    private static String requireText(JsonNode node, String field) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            throw new LedgerException("Missing " + field);
        }
        return node.asText();
    }
}
