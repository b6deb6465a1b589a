package com.adrelay.order;

import com.adrelay.domain.CampaignRepository;
import com.adrelay.domain.Order;
import com.adrelay.domain.OrderRepository;
import com.adrelay.domain.OrderStatus;
import com.adrelay.order.config.OrderProperties;
import com.adrelay.pricing.PricingEngine;
import com.adrelay.pricing.PricingException;
import com.adrelay.pricing.config.PricingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String ADDRESS_A = "EQAddressA";
    private static final String ADDRESS_B = "EQAddressB";

    @Mock
    OrderRepository orderRepository;
    @Mock
    CampaignRepository campaignRepository;
    @Mock
    ReferenceCodeGenerator referenceCodeGenerator;

    private OrderProperties properties;
    private OrderLedgerService service;

    @BeforeEach
    void setUp() {
        properties = new OrderProperties();
        properties.setReceivingAddresses(List.of(ADDRESS_A, ADDRESS_B));
        service = new OrderLedgerService(orderRepository, campaignRepository,
                new PricingEngine(new PricingProperties()), referenceCodeGenerator, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void insertReturnsArgument() {
        when(orderRepository.insert(any(Order.class))).thenAnswer(inv -> {
            Order o = inv.getArgument(0);
            o.setId("order-" + o.getReferenceCode());
            return o;
        });
    }

    @Test
    @DisplayName("createOrder persists a priced PENDING order expiring after the TTL")
    void createOrder_persistsPendingOrder() {
        when(referenceCodeGenerator.next()).thenReturn("AB1234");
        insertReturnsArgument();

        Order order = service.createOrder("user-1", 7, List.of(" news ", "tech", "news", " "), null);

        assertThat(order.getId()).isEqualTo("order-AB1234");
        assertThat(order.getReferenceCode()).isEqualTo("AB1234");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getChannelIds()).containsExactly("news", "tech");
        assertThat(order.getExpectedAmount()).isEqualByComparingTo("11.49");
        assertThat(order.getPostsPerDay()).isEqualTo(3);
        assertThat(order.getDiscountPercent()).isEqualByComparingTo("5.6");
        assertThat(order.getCreatedAt()).isEqualTo(NOW);
        assertThat(order.getExpiresAt()).isEqualTo(NOW.plusSeconds(1200));
        assertThat(order.getReceivingAddress()).isEqualTo(ADDRESS_A);
        assertThat(order.getClaimedPayerAddress()).isNull();
    }

    @Test
    @DisplayName("createOrder redraws when a code is held by a pending order or lost on insert")
    void createOrder_retriesOnCollision() {
        when(referenceCodeGenerator.next()).thenReturn("AA0001", "BB0002", "CC0003");
        when(orderRepository.existsByReferenceCodeAndStatus("AA0001", OrderStatus.PENDING)).thenReturn(true);
        when(orderRepository.existsByReferenceCodeAndStatus("BB0002", OrderStatus.PENDING)).thenReturn(false);
        when(orderRepository.existsByReferenceCodeAndStatus("CC0003", OrderStatus.PENDING)).thenReturn(false);
        when(orderRepository.insert(any(Order.class)))
                .thenThrow(new DuplicateKeyException("dup"))
                .thenAnswer(inv -> inv.getArgument(0));

        Order order = service.createOrder("user-1", 3, List.of("news"), "EQpayer");

        assertThat(order.getReferenceCode()).isEqualTo("CC0003");
        assertThat(order.getClaimedPayerAddress()).isEqualTo("EQpayer");
        verify(orderRepository, times(2)).insert(any(Order.class));
    }

    @Test
    void createOrder_exhaustedCodes_throws() {
        properties.setReferenceCodeMaxAttempts(3);
        when(referenceCodeGenerator.next()).thenReturn("AA0001");
        when(orderRepository.existsByReferenceCodeAndStatus("AA0001", OrderStatus.PENDING)).thenReturn(true);

        assertThatThrownBy(() -> service.createOrder("user-1", 3, List.of("news"), null))
                .isInstanceOf(OrderLedgerException.class)
                .extracting("errorCode").isEqualTo(OrderLedgerException.REFERENCE_CODE_EXHAUSTED);
        verify(referenceCodeGenerator, times(3)).next();
        verify(orderRepository, never()).insert(any(Order.class));
    }

    @Test
    void createOrder_invalidDuration_noSideEffects() {
        assertThatThrownBy(() -> service.createOrder("user-1", 0, List.of("news"), null))
                .isInstanceOf(PricingException.class);
        assertThatThrownBy(() -> service.createOrder("user-1", 7, List.of(" "), null))
                .isInstanceOf(PricingException.class)
                .extracting("errorCode").isEqualTo(PricingException.INVALID_CHANNEL_COUNT);
        verify(orderRepository, never()).insert(any(Order.class));
    }

    @Test
    void createOrder_assignsReceivingAddressesRoundRobin() {
        when(referenceCodeGenerator.next()).thenReturn("AA0001", "AA0002", "AA0003");
        insertReturnsArgument();

        List<String> assigned = List.of(
                service.createOrder("u", 1, List.of("c"), null).getReceivingAddress(),
                service.createOrder("u", 1, List.of("c"), null).getReceivingAddress(),
                service.createOrder("u", 1, List.of("c"), null).getReceivingAddress());

        assertThat(assigned).containsExactly(ADDRESS_A, ADDRESS_B, ADDRESS_A);
    }

    @Test
    void createOrder_noReceivingAddress_throws() {
        properties.setReceivingAddresses(List.of());

        assertThatThrownBy(() -> service.createOrder("u", 1, List.of("c"), null))
                .isInstanceOf(OrderLedgerException.class)
                .extracting("errorCode").isEqualTo(OrderLedgerException.NO_RECEIVING_ADDRESS);
    }

    @Test
    @DisplayName("findByReferenceCode normalises the code and prefers the pending order")
    void findByReferenceCode_prefersPending() {
        Order pending = order("o-pending", OrderStatus.PENDING);
        when(orderRepository.findFirstByReferenceCodeAndStatus("AB1234", OrderStatus.PENDING))
                .thenReturn(Optional.of(pending));

        assertThat(service.findByReferenceCode(" ab1234 ")).contains(pending);
        verify(orderRepository, never()).findFirstByReferenceCodeOrderByCreatedAtDesc(anyString());
    }

    @Test
    void findByReferenceCode_fallsBackToLatest() {
        Order expired = order("o-old", OrderStatus.EXPIRED);
        when(orderRepository.findFirstByReferenceCodeAndStatus("AB1234", OrderStatus.PENDING)).thenReturn(Optional.empty());
        when(orderRepository.findFirstByReferenceCodeOrderByCreatedAtDesc("AB1234")).thenReturn(Optional.of(expired));

        assertThat(service.findByReferenceCode("AB1234")).contains(expired);
        assertThat(service.findByReferenceCode("  ")).isEmpty();
        assertThat(service.findByReferenceCode(null)).isEmpty();
    }

    @Test
    void findByReferenceCodeAt_normalizesAndQueriesByCreationTime() {
        Order expired = order("o-old", OrderStatus.EXPIRED);
        when(orderRepository.findFirstByReferenceCodeAndCreatedAtLessThanEqualOrderByCreatedAtDesc("AB1234", NOW))
                .thenReturn(Optional.of(expired));

        assertThat(service.findByReferenceCodeAt(" ab1234 ", NOW)).contains(expired);
        assertThat(service.findByReferenceCodeAt(null, NOW)).isEmpty();
    }

    @Test
    void tryMatch_delegatesWithClockTime() {
        Order matched = order("o1", OrderStatus.MATCHED);
        when(orderRepository.tryMatch("o1", "tx1", NOW)).thenReturn(Optional.of(matched));

        assertThat(service.tryMatch("o1", "tx1")).contains(matched);
    }

    @Test
    void expireStale_returnsCount() {
        when(orderRepository.expireStale(NOW)).thenReturn(4L);

        assertThat(service.expireStale()).isEqualTo(4L);
    }

    @Test
    void cancel_pendingOrder_returnsCancelled() {
        Order cancelled = order("o1", OrderStatus.CANCELLED);
        when(orderRepository.cancel("o1", "user-1", NOW)).thenReturn(Optional.of(cancelled));

        assertThat(service.cancel("o1", "user-1")).isSameAs(cancelled);
    }

    @Test
    void cancel_matchedOrder_notCancellable() {
        when(orderRepository.cancel("o1", null, NOW)).thenReturn(Optional.empty());
        when(orderRepository.findById("o1")).thenReturn(Optional.of(order("o1", OrderStatus.MATCHED)));

        assertThatThrownBy(() -> service.cancel("o1", null))
                .isInstanceOf(OrderLedgerException.class)
                .extracting("errorCode").isEqualTo(OrderLedgerException.ORDER_NOT_CANCELLABLE);
    }

    @Test
    void cancel_otherUsersOrder_reportedAsNotFound() {
        when(orderRepository.cancel("o1", "intruder", NOW)).thenReturn(Optional.empty());
        when(orderRepository.findById("o1")).thenReturn(Optional.of(order("o1", OrderStatus.PENDING)));

        assertThatThrownBy(() -> service.cancel("o1", "intruder"))
                .isInstanceOf(OrderLedgerException.class)
                .extracting("errorCode").isEqualTo(OrderLedgerException.ORDER_NOT_FOUND);
    }

    @Test
    @DisplayName("findMatchedWithoutCampaign has no lower bound and marks orders whose campaign exists")
    void findMatchedWithoutCampaign_skipsAndMarksProvisionedOrders() {
        Order provisioned = order("o1", OrderStatus.MATCHED);
        Order orphan = order("o2", OrderStatus.MATCHED);
        orphan.setMatchedAt(NOW.minusSeconds(30 * 86_400));
        when(orderRepository.findByStatusAndProvisionedAtIsNullAndMatchedAtBefore(OrderStatus.MATCHED, NOW))
                .thenReturn(List.of(provisioned, orphan));
        when(campaignRepository.existsByOrderId("o1")).thenReturn(true);
        when(campaignRepository.existsByOrderId(eq("o2"))).thenReturn(false);

        assertThat(service.findMatchedWithoutCampaign(NOW)).containsExactly(orphan);
        verify(orderRepository).markProvisioned("o1", NOW);
        verify(orderRepository, never()).markProvisioned(eq("o2"), any());
    }

    @Test
    void markProvisioned_stampsClockTime() {
        service.markProvisioned("o1");

        verify(orderRepository).markProvisioned("o1", NOW);
    }

    private static Order order(String id, OrderStatus status) {
        Order o = new Order();
        o.setId(id);
        o.setReferenceCode("AB1234");
        o.setUserId("user-1");
        o.setStatus(status);
        return o;
    }
}
