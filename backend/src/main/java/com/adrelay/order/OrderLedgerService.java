package com.adrelay.order;

import com.adrelay.domain.CampaignRepository;
import com.adrelay.domain.Order;
import com.adrelay.domain.OrderRepository;
import com.adrelay.domain.OrderStatus;
import com.adrelay.order.config.OrderProperties;
import com.adrelay.pricing.PricingEngine;
import com.adrelay.pricing.PricingQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persistent purchase intents. Creation prices the order and reserves a reference code among pending orders;
 * every later status change is a conditional update guarded by PENDING.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderLedgerService {

    private final OrderRepository orderRepository;
    private final CampaignRepository campaignRepository;
    private final PricingEngine pricingEngine;
    private final ReferenceCodeGenerator referenceCodeGenerator;
    private final OrderProperties properties;
    private final Clock clock;

    private final AtomicInteger addressCursor = new AtomicInteger();

    /**
     * Prices and persists a PENDING order.
     *
     * @throws com.adrelay.pricing.PricingException invalid duration or no channels
     * @throws OrderLedgerException REFERENCE_CODE_EXHAUSTED when no free code was drawn within the attempt limit
     */
    public Order createOrder(String userId, int durationDays, List<String> channelIds, String claimedPayerAddress) {
        List<String> channels = normalizeChannels(channelIds);
        PricingQuote quote = pricingEngine.quote(durationDays, channels.size());
        String receivingAddress = nextReceivingAddress();
        int maxAttempts = Math.max(1, properties.getReferenceCodeMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = referenceCodeGenerator.next();
            if (orderRepository.existsByReferenceCodeAndStatus(code, OrderStatus.PENDING)) {
                log.debug("Reference code {} in use by a pending order (attempt {})", code, attempt);
                continue;
            }
            Instant now = clock.instant();
            Order order = new Order();
            order.setReferenceCode(code);
            order.setUserId(userId);
            order.setClaimedPayerAddress(blankToNull(claimedPayerAddress));
            order.setReceivingAddress(receivingAddress);
            order.setDurationDays(durationDays);
            order.setChannelIds(channels);
            order.setExpectedAmount(quote.finalCost());
            order.setPostsPerDay(quote.postsPerDay());
            order.setDiscountPercent(quote.discountPercent());
            order.setCreatedAt(now);
            order.setExpiresAt(now.plusSeconds(properties.getTtlSeconds()));
            order.setStatus(OrderStatus.PENDING);
            try {
                Order saved = orderRepository.insert(order);
                log.info("Order {} created: ref={} user={} amount={} days={} channels={}",
                        saved.getId(), code, userId, quote.finalCost(), durationDays, channels.size());
                return saved;
            } catch (DuplicateKeyException e) {
                log.debug("Reference code {} taken concurrently (attempt {})", code, attempt);
            }
        }
        throw new OrderLedgerException(OrderLedgerException.REFERENCE_CODE_EXHAUSTED,
                "No free reference code after " + maxAttempts + " attempts");
    }

    /**
     * The PENDING order carrying the code, otherwise the most recent order that carried it.
     */
    public Optional<Order> findByReferenceCode(String referenceCode) {
        String code = ReferenceCodeGenerator.normalize(referenceCode);
        if (code == null || code.isEmpty()) {
            return Optional.empty();
        }
        Optional<Order> pending = orderRepository.findFirstByReferenceCodeAndStatus(code, OrderStatus.PENDING);
        if (pending.isPresent()) {
            return pending;
        }
        return orderRepository.findFirstByReferenceCodeOrderByCreatedAtDesc(code);
    }

    /**
     * The most recent order that carried the code and was created at or before the given time.
     */
    public Optional<Order> findByReferenceCodeAt(String referenceCode, Instant at) {
        String code = ReferenceCodeGenerator.normalize(referenceCode);
        if (code == null || code.isEmpty()) {
            return Optional.empty();
        }
        return orderRepository.findFirstByReferenceCodeAndCreatedAtLessThanEqualOrderByCreatedAtDesc(code, at);
    }

    public Optional<Order> findById(String orderId) {
        return orderRepository.findById(orderId);
    }

    /**
     * PENDING and unexpired -> MATCHED. Present only for the single caller that won the transition.
     */
    public Optional<Order> tryMatch(String orderId, String txId) {
        return orderRepository.tryMatch(orderId, txId, clock.instant());
    }

    public long expireStale() {
        long expired = orderRepository.expireStale(clock.instant());
        if (expired > 0) {
            log.info("Expired {} pending order(s)", expired);
        }
        return expired;
    }

    /**
     * PENDING -> CANCELLED. A non-null userId must own the order.
     *
     * @throws OrderLedgerException ORDER_NOT_FOUND, ORDER_NOT_CANCELLABLE
     */
    public Order cancel(String orderId, String userId) {
        Optional<Order> cancelled = orderRepository.cancel(orderId, blankToNull(userId), clock.instant());
        if (cancelled.isPresent()) {
            log.info("Order {} cancelled", orderId);
            return cancelled.get();
        }
        Order existing = orderRepository.findById(orderId)
                .filter(o -> userId == null || userId.isBlank() || userId.equals(o.getUserId()))
                .orElseThrow(() -> new OrderLedgerException(OrderLedgerException.ORDER_NOT_FOUND,
                        "Order not found: " + orderId));
        throw new OrderLedgerException(OrderLedgerException.ORDER_NOT_CANCELLABLE,
                "Order " + orderId + " is " + existing.getStatus());
    }

    /**
     * MATCHED orders matched before the cutoff that are not marked provisioned. An order whose campaign already
     * exists is marked on the way and left out.
     */
    public List<Order> findMatchedWithoutCampaign(Instant matchedBefore) {
        List<Order> result = new ArrayList<>();
        for (Order order : orderRepository.findByStatusAndProvisionedAtIsNullAndMatchedAtBefore(
                OrderStatus.MATCHED, matchedBefore)) {
            if (campaignRepository.existsByOrderId(order.getId())) {
                orderRepository.markProvisioned(order.getId(), clock.instant());
            } else {
                result.add(order);
            }
        }
        return result;
    }

    public void markProvisioned(String orderId) {
        orderRepository.markProvisioned(orderId, clock.instant());
    }

    public List<String> receivingAddresses() {
        return List.copyOf(properties.getReceivingAddresses());
    }

    private String nextReceivingAddress() {
        List<String> addresses = properties.getReceivingAddresses();
        if (addresses == null || addresses.isEmpty()) {
            throw new OrderLedgerException(OrderLedgerException.NO_RECEIVING_ADDRESS,
                    "No receiving address configured");
        }
        int i = Math.floorMod(addressCursor.getAndIncrement(), addresses.size());
        return addresses.get(i);
    }

    private static List<String> normalizeChannels(List<String> channelIds) {
        if (channelIds == null) {
            return List.of();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String id : channelIds) {
            if (id != null && !id.isBlank()) {
                distinct.add(id.strip());
            }
        }
        return List.copyOf(distinct);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
