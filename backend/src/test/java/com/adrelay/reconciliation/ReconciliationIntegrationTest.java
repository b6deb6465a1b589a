package com.adrelay.reconciliation;

import com.adrelay.campaign.CampaignFulfillment;
import com.adrelay.domain.Campaign;
import com.adrelay.domain.CampaignProvisionedEvent;
import com.adrelay.domain.CampaignRepository;
import com.adrelay.domain.ObservedTransaction;
import com.adrelay.domain.ObservedTransactionRepository;
import com.adrelay.domain.Order;
import com.adrelay.domain.OrderRepository;
import com.adrelay.domain.OrderStatus;
import com.adrelay.domain.PollCursorRepository;
import com.adrelay.domain.ReconciliationOutcome;
import com.adrelay.domain.ScheduledPostRepository;
import com.adrelay.ingestion.adapter.LedgerTransfer;
import com.adrelay.ingestion.adapter.TransferBatch;
import com.adrelay.ingestion.adapter.TransferSource;
import com.adrelay.ingestion.poller.PaymentPoller;
import com.adrelay.ingestion.poller.PollCycleResult;
import com.adrelay.order.OrderLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@RecordApplicationEvents
@Testcontainers
class ReconciliationIntegrationTest {

    private static final String ADDRESS = "EQTestReceivingAddressAAAAAAAAAAAAAAAAAAAAAAAAAA";

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @MockBean
    TransferSource transferSource;

    @Autowired
    PaymentPoller paymentPoller;
    @Autowired
    OrderLedgerService orderLedgerService;
    @Autowired
    ReconciliationMatcher reconciliationMatcher;
    @Autowired
    CampaignFulfillment campaignFulfillment;
    @Autowired
    OrderRepository orderRepository;
    @Autowired
    ObservedTransactionRepository observedTransactionRepository;
    @Autowired
    CampaignRepository campaignRepository;
    @Autowired
    ScheduledPostRepository scheduledPostRepository;
    @Autowired
    PollCursorRepository pollCursorRepository;
    @Autowired
    ApplicationEvents applicationEvents;

    @BeforeEach
    void clean() {
        orderRepository.deleteAll();
        observedTransactionRepository.deleteAll();
        campaignRepository.deleteAll();
        scheduledPostRepository.deleteAll();
        pollCursorRepository.deleteAll();
    }

    @Test
    @DisplayName("paid order: matched, 42 posts provisioned, one confirmation; redelivery changes nothing")
    void paidOrderEndToEnd() {
        Order order = orderLedgerService.createOrder("user-1", 7, List.of("@alpha", "@beta"), null);
        assertThat(order.getExpectedAmount()).isEqualByComparingTo("11.49");
        LedgerTransfer payment = transfer("tx-paid", order.getReferenceCode().toLowerCase(), "11.49");
        when(transferSource.fetchSince(eq(ADDRESS), any(), any())).thenReturn(batch(payment));

        PollCycleResult first = paymentPoller.pollOnce(ADDRESS);

        assertThat(first.status()).isEqualTo(PollCycleResult.Status.COMPLETED);
        assertThat(first.inserted()).isEqualTo(1);
        Order matched = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(matched.getStatus()).isEqualTo(OrderStatus.MATCHED);
        assertThat(matched.getMatchedTxId()).isEqualTo("tx-paid");
        Campaign campaign = campaignRepository.findByOrderId(order.getId()).orElseThrow();
        assertThat(campaign.getTotalPosts()).isEqualTo(42);
        assertThat(scheduledPostRepository.countByCampaignId(campaign.getId())).isEqualTo(42);
        assertThat(campaign.getConfirmationEmittedAt()).isNotNull();
        assertThat(observedTransactionRepository.findByTxId("tx-paid").orElseThrow().getOutcome())
                .isEqualTo(ReconciliationOutcome.MATCHED);
        assertThat(applicationEvents.stream(CampaignProvisionedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.userId()).isEqualTo("user-1");
                    assertThat(e.channelCount()).isEqualTo(2);
                    assertThat(e.totalPosts()).isEqualTo(42);
                });

        PollCycleResult second = paymentPoller.pollOnce(ADDRESS);

        assertThat(second.inserted()).isZero();
        assertThat(campaignRepository.count()).isEqualTo(1);
        assertThat(scheduledPostRepository.count()).isEqualTo(42);
        assertThat(applicationEvents.stream(CampaignProvisionedEvent.class)).hasSize(1);
    }

    @Test
    @DisplayName("a second payment for a matched order is LATE")
    void secondPaymentLate() {
        Order order = orderLedgerService.createOrder("user-1", 1, List.of("@alpha"), null);
        when(transferSource.fetchSince(eq(ADDRESS), any(), any())).thenReturn(batch(
                transfer("tx-1", order.getReferenceCode(), "0.29"),
                transfer("tx-2", order.getReferenceCode(), "0.29")));

        paymentPoller.pollOnce(ADDRESS);

        assertThat(List.of(
                observedTransactionRepository.findByTxId("tx-1").orElseThrow().getOutcome(),
                observedTransactionRepository.findByTxId("tx-2").orElseThrow().getOutcome()))
                .containsExactlyInAnyOrder(ReconciliationOutcome.MATCHED, ReconciliationOutcome.LATE);
        assertThat(campaignRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("a correct payment after expiry is LATE and provisions nothing")
    void paymentAfterExpiryLate() {
        Order order = orderLedgerService.createOrder("user-1", 7, List.of("@alpha", "@beta"), null);
        order.setExpiresAt(Instant.now().minusSeconds(1));
        orderRepository.save(order);
        when(transferSource.fetchSince(eq(ADDRESS), any(), any()))
                .thenReturn(batch(transfer("tx-late", order.getReferenceCode(), "11.49")));

        paymentPoller.pollOnce(ADDRESS);

        assertThat(observedTransactionRepository.findByTxId("tx-late").orElseThrow().getOutcome())
                .isEqualTo(ReconciliationOutcome.LATE);
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(campaignRepository.count()).isZero();
    }

    @Test
    @DisplayName("underpaid and unknown-memo transfers are recorded for manual review")
    void unresolvedOutcomes() {
        Order order = orderLedgerService.createOrder("user-1", 7, List.of("@alpha", "@beta"), null);
        when(transferSource.fetchSince(eq(ADDRESS), any(), any())).thenReturn(batch(
                transfer("tx-under", order.getReferenceCode(), "10.00"),
                transfer("tx-unknown", "hello", "5")));

        paymentPoller.pollOnce(ADDRESS);

        assertThat(observedTransactionRepository.findByTxId("tx-under").orElseThrow().getOutcome())
                .isEqualTo(ReconciliationOutcome.UNDERPAID);
        assertThat(observedTransactionRepository.findByTxId("tx-unknown").orElseThrow().getOutcome())
                .isEqualTo(ReconciliationOutcome.UNTRACKED);
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    @DisplayName("two concurrent matches of one order: exactly one wins")
    void concurrentTryMatch() throws Exception {
        Order order = orderLedgerService.createOrder("user-1", 7, List.of("@alpha", "@beta"), null);

        List<Optional<Order>> results = runConcurrently(
                () -> orderLedgerService.tryMatch(order.getId(), "tx-a"),
                () -> orderLedgerService.tryMatch(order.getId(), "tx-b"));

        assertThat(results).filteredOn(Optional::isPresent).hasSize(1);
    }

    @Test
    @DisplayName("two transactions racing for one order: one MATCHED, the other closed, one campaign")
    void concurrentReconciliation() throws Exception {
        Order order = orderLedgerService.createOrder("user-1", 7, List.of("@alpha", "@beta"), null);
        ObservedTransaction a = observed("tx-a", order.getReferenceCode());
        ObservedTransaction b = observed("tx-b", order.getReferenceCode());
        observedTransactionRepository.insertIfAbsent(a);
        observedTransactionRepository.insertIfAbsent(b);

        runConcurrently(() -> reconciliationMatcher.reconcile(a), () -> reconciliationMatcher.reconcile(b));
        reconciliationMatcher.reconcilePending();

        List<ReconciliationOutcome> outcomes = List.of(
                observedTransactionRepository.findByTxId("tx-a").orElseThrow().getOutcome(),
                observedTransactionRepository.findByTxId("tx-b").orElseThrow().getOutcome());
        assertThat(outcomes).containsOnlyOnce(ReconciliationOutcome.MATCHED);
        assertThat(outcomes).filteredOn(o -> o != ReconciliationOutcome.MATCHED)
                .singleElement()
                .isIn(ReconciliationOutcome.CONFLICTED, ReconciliationOutcome.LATE);
        assertThat(campaignRepository.count()).isEqualTo(1);
        assertThat(scheduledPostRepository.count()).isEqualTo(42);
    }

    @Test
    @DisplayName("provisioning the same matched order twice yields one campaign and one confirmation")
    void provisionTwice() {
        Order order = orderLedgerService.createOrder("user-1", 7, List.of("@alpha", "@beta"), null);
        Order matched = orderLedgerService.tryMatch(order.getId(), "tx-1").orElseThrow();

        Campaign first = campaignFulfillment.fulfill(matched);
        Campaign second = campaignFulfillment.fulfill(matched);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(scheduledPostRepository.count()).isEqualTo(42);
        assertThat(applicationEvents.stream(CampaignProvisionedEvent.class)).hasSize(1);
    }

    @SafeVarargs
    private static <T> List<T> runConcurrently(Callable<T>... tasks) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(tasks.length);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> f : futures) {
                results.add(f.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static TransferBatch batch(LedgerTransfer... transfers) {
        return TransferBatch.complete(List.of(transfers), Instant.now());
    }

    private static LedgerTransfer transfer(String txId, String memo, String amount) {
        return new LedgerTransfer(txId, txId.hashCode() & 0xffffL, "EQPayer", ADDRESS, new BigDecimal(amount), memo,
                Instant.now());
    }

    private static ObservedTransaction observed(String txId, String memo) {
        ObservedTransaction tx = new ObservedTransaction();
        tx.setTxId(txId);
        tx.setReceivingAddress(ADDRESS);
        tx.setFromAddress("EQPayer");
        tx.setAmount(new BigDecimal("11.49"));
        tx.setMemo(memo);
        tx.setObservedAt(Instant.now());
        tx.setFetchedAt(Instant.now());
        return tx;
    }
}
