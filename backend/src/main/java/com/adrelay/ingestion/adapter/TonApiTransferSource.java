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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * tonapi.io v2 transfer source, paged with before_lt. Hashes arrive as hex and are re-encoded as standard base64
 * so txIds and positions match the ones TON Center reports for the same transaction. Senders arrive in raw
 * (workchain:hex) form; the destination is always the receiving address polled.
 */
@Slf4j
@Component
public class TonApiTransferSource implements TransferSource {

    private static final String INTERNAL_MESSAGE = "int_msg";

    private final TonApiClient tonApiClient;
    private final LedgerEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final IngestionProperties properties;
    private final ObjectMapper objectMapper;

    public TonApiTransferSource(
            TonApiClient tonApiClient,
            @Qualifier("tonApiEndpointRotator") LedgerEndpointRotator rotator,
            @Qualifier("tonApiRateLimiter") RateLimiter rateLimiter,
            IngestionProperties properties,
            ObjectMapper objectMapper
    ) {
        this.tonApiClient = tonApiClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
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
            JsonNode transactions = fetchPageWithRetry(receivingAddress, pageSize,
                    position == null ? null : position.logicalTime());
            boolean reachedSince = false;
            for (JsonNode item : transactions) {
                long lt = requireLong(item.path("lt"), "lt");
                String txId = toBase64Hash(requireText(item.path("hash"), "hash"));
                Instant timestamp = Instant.ofEpochSecond(requireLong(item.path("utime"), "utime"));
                position = new LedgerPosition(lt, txId);
                if (newestReadAt == null || timestamp.isAfter(newestReadAt)) {
                    newestReadAt = timestamp;
                }
                if (timestamp.isBefore(since)) {
                    reachedSince = true;
                    continue;
                }
                toIncomingTransfer(item, txId, lt, timestamp, receivingAddress)
                        .ifPresent(t -> byTxId.putIfAbsent(t.txId(), t));
            }
            complete = reachedSince || transactions.size() < pageSize;
        }
        List<LedgerTransfer> transfers = new ArrayList<>(byTxId.values());
        transfers.sort(Comparator.comparing(LedgerTransfer::timestamp).thenComparingLong(LedgerTransfer::logicalTime));
        if (complete) {
            return TransferBatch.complete(transfers, newestReadAt);
        }
        log.info("tonapi history for {} not read back to {} within {} page(s); continuing before lt {} next cycle",
                receivingAddress, since, maxPages, position.logicalTime());
        return new TransferBatch(transfers, false, position, newestReadAt);
    }

    private JsonNode fetchPageWithRetry(String account, int limit, Long beforeLt) {
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
                if (!rateLimiter.acquirePermission()) {
                    throw new LedgerException("Local limiter timeout before account transactions on " + endpoint);
                }
                String body = tonApiClient.getAccountTransactions(endpoint, account, limit, beforeLt).block();
                return parseTransactions(body, endpoint);
            } catch (LedgerException e) {
                lastException = e;
                rotator.coolDown(endpoint, System.currentTimeMillis() + rotator.retryDelayMs(attempt));
                log.warn("tonapi attempt {}/{} for {} on {} failed: {}",
                        attempt + 1, rotator.getMaxAttempts(), account, endpoint, e.getMessage());
            }
        }
        throw new LedgerException("tonapi account transactions failed for " + account + " after "
                + rotator.getMaxAttempts() + " attempt(s)", lastException);
    }

    private JsonNode parseTransactions(String body, String endpoint) {
        if (body == null || body.isBlank()) {
            throw new LedgerException("Empty response from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LedgerException("Unparsable tonapi response from " + endpoint, e);
        }
        if (root.hasNonNull("error")) {
            throw new LedgerException("tonapi error from " + endpoint + ": " + root.path("error").asText());
        }
        JsonNode transactions = root.path("transactions");
        if (!transactions.isArray()) {
            throw new LedgerException("tonapi transactions is not an array (" + endpoint + ")");
        }
        return transactions;
    }

    private Optional<LedgerTransfer> toIncomingTransfer(JsonNode item, String txId, long lt, Instant timestamp,
                                                        String receivingAddress) {
        JsonNode inMsg = item.path("in_msg");
        if (inMsg.isMissingNode() || inMsg.isNull() || !INTERNAL_MESSAGE.equals(inMsg.path("msg_type").asText())) {
            return Optional.empty();
        }
        String source = inMsg.path("source").path("address").asText("");
        if (source.isBlank()) {
            return Optional.empty();
        }
        BigDecimal amount = toAmount(inMsg.path("value"));
        return Optional.of(new LedgerTransfer(txId, lt, source, receivingAddress, amount, memoOf(inMsg), timestamp));
    }

    private BigDecimal toAmount(JsonNode value) {
        try {
            BigInteger baseUnits = value.isIntegralNumber()
                    ? value.bigIntegerValue()
                    : new BigInteger(requireText(value, "in_msg.value").strip());
            return new BigDecimal(baseUnits).movePointLeft(properties.getAmountDecimals());
        } catch (NumberFormatException e) {
            throw new LedgerException("Malformed in_msg.value: " + value.asText(), e);
        }
    }

    private static String memoOf(JsonNode inMsg) {
        JsonNode body = inMsg.path("decoded_body");
        for (String field : List.of("text", "comment")) {
            String text = body.path(field).asText("");
            if (!text.isBlank()) {
                return text.strip();
            }
        }
        return null;
    }

    private static String toBase64Hash(String hex) {
        try {
            return Base64.getEncoder().encodeToString(HexFormat.of().parseHex(hex.strip()));
        } catch (IllegalArgumentException e) {
            throw new LedgerException("Malformed hash: " + hex, e);
        }
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
