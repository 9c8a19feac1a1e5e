package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.config.ExecutionProperties;
import com.tradeflow.backend.config.VenueResilienceConfig;
import com.tradeflow.backend.exception.InvariantViolationException;
import com.tradeflow.backend.exception.PermanentVenueException;
import com.tradeflow.backend.exception.TransientVenueException;
import com.tradeflow.backend.model.ExecutionResult;
import com.tradeflow.backend.model.FillEvent;
import com.tradeflow.backend.model.OrderPurpose;
import com.tradeflow.backend.model.OrderState;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.model.TradingNotification;
import com.tradeflow.backend.service.AlertService;
import com.tradeflow.backend.service.MetricsService;
import com.tradeflow.backend.service.NotificationSink;
import com.tradeflow.backend.service.TradeJournal;
import com.tradeflow.backend.service.portfolio.PortfolioStore;
import com.tradeflow.backend.trading.pipeline.ApprovedOrder;
import com.tradeflow.backend.util.MoneyUtils;
import com.tradeflow.backend.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static com.tradeflow.backend.util.TestFixtures.NOW;
import static com.tradeflow.backend.util.TestFixtures.order;
import static com.tradeflow.backend.util.TestFixtures.portfolioStore;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ExecutionCoordinatorTest {

    private final ExecutorService venueCallExecutor = Executors.newCachedThreadPool();
    private final List<ExecutorService> pools = new ArrayList<>();

    private ExecutionProperties properties;
    private PortfolioStore portfolioStore;
    private ScriptedVenue venue;
    private TradeJournal tradeJournal;
    private NotificationSink notificationSink;
    private AlertService alertService;
    private SimpleMeterRegistry meterRegistry;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        properties = new ExecutionProperties();
        properties.setVenueTimeoutMs(50);
        properties.setStatusPollAttempts(3);
        properties.setStatusPollDelayMs(1);
        properties.setMaxResubmissions(3);
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setBaseDelayMs(1);
        properties.getRetry().setMaxDelayMs(5);
        properties.getRetry().setJitterFactor(0.0);

        portfolioStore = portfolioStore(10_000, new MutableClock(NOW));
        venue = new ScriptedVenue();
        tradeJournal = mock(TradeJournal.class);
        notificationSink = mock(NotificationSink.class);
        alertService = mock(AlertService.class);
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new MetricsService(meterRegistry);
    }

    @AfterEach
    void tearDown() {
        venueCallExecutor.shutdownNow();
        pools.forEach(ExecutorService::shutdownNow);
    }

    @Test
    void fullFillUpdatesPortfolioOnce() {
        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "2", "100"));

        assertThat(result.state()).isEqualTo(OrderState.FILLED);
        assertThat(result.filledQuantity()).isEqualByComparingTo("2");
        assertThat(result.averagePrice()).isEqualByComparingTo("100");
        assertThat(result.fillUpdates()).isEqualTo(1);
        assertThat(result.venueAttempts()).isEqualTo(1);

        PortfolioSnapshot snapshot = portfolioStore.snapshot();
        assertThat(snapshot.position("BTC/USDT").orElseThrow().quantity()).isEqualByComparingTo("2");
        assertThat(snapshot.availableCapital()).isEqualByComparingTo("9800");
        verify(tradeJournal).recordApprovedOrder(any());
        verify(tradeJournal).recordExecutionResult(result);
        verify(tradeJournal).upsertPortfolio(any());
        verify(notificationSink, times(1)).publish(any());
    }

    @Test
    void timeoutsExhaustRetryBudgetWithoutTouchingPortfolio() {
        venue.defaultSubmit = request -> {
            sleep(300);
            return filled(request, request.quantity());
        };
        PortfolioSnapshot before = portfolioStore.snapshot();

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "ETH/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        assertThat(result.state()).isEqualTo(OrderState.FAILED);
        assertThat(result.reasonCode()).isEqualTo(ExecutionCoordinator.RETRY_BUDGET_EXHAUSTED);
        assertThat(result.venueAttempts()).isEqualTo(3);
        assertThat(result.fillUpdates()).isZero();
        assertThat(result.filledQuantity()).isEqualByComparingTo("0");

        PortfolioSnapshot after = portfolioStore.snapshot();
        assertThat(after.openPositions()).isEmpty();
        assertThat(after.availableCapital()).isEqualByComparingTo(before.availableCapital());
        assertThat(meterRegistry.counter("venue_retries_total", "venue", "paper").count()).isEqualTo(2.0);

        ArgumentCaptor<TradingNotification> captor = ArgumentCaptor.forClass(TradingNotification.class);
        verify(notificationSink, times(1)).publish(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(TradingNotification.Type.EXECUTION);
        assertThat(captor.getValue().reasonCode()).isEqualTo(ExecutionCoordinator.RETRY_BUDGET_EXHAUSTED);
        verify(tradeJournal, never()).upsertPortfolio(any());
    }

    @Test
    void transientFailureIsRetriedThenFills() {
        venue.submits.add(request -> {
            throw TransientVenueException.rateLimited("paper", "slow down");
        });

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        assertThat(result.state()).isEqualTo(OrderState.FILLED);
        assertThat(result.venueAttempts()).isEqualTo(2);
        assertThat(venue.requests).hasSize(2);
        assertThat(meterRegistry.counter("venue_retries_total", "venue", "paper").count()).isEqualTo(1.0);
    }

    @Test
    void partialFillIsResubmittedAndAppliedAsTwoFills() {
        venue.submits.add(request -> new VenueOrderReport("V-" + request.clientOrderId(),
                VenueOrderReport.Status.PARTIALLY_FILLED, MoneyUtils.bd("40"), MoneyUtils.bd("10"), null));
        venue.submits.add(request -> filled(request, request.quantity()));

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "SOL/USDT", Side.BUY, OrderPurpose.OPEN, "100", "10"));

        assertThat(result.state()).isEqualTo(OrderState.FILLED);
        assertThat(result.fillUpdates()).isEqualTo(2);
        assertThat(result.filledQuantity()).isEqualByComparingTo("100");
        assertThat(venue.requests).extracting(VenueOrderRequest::quantity)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(MoneyUtils.bd("100"), MoneyUtils.bd("60"));
        assertThat(venue.requests).extracting(VenueOrderRequest::clientOrderId).containsExactly("o1-1", "o1-2");

        PortfolioSnapshot snapshot = portfolioStore.snapshot();
        assertThat(snapshot.position("SOL/USDT").orElseThrow().quantity()).isEqualByComparingTo("100");
        assertThat(snapshot.availableCapital()).isEqualByComparingTo("9000");
        verify(notificationSink, times(1)).publish(any());
    }

    @Test
    void resubmissionLimitEndsOrderAsFailedWithFillsKept() {
        properties.setMaxResubmissions(1);
        venue.defaultSubmit = request -> new VenueOrderReport("V-" + request.clientOrderId(),
                VenueOrderReport.Status.PARTIALLY_FILLED, MoneyUtils.bd("10"), MoneyUtils.bd("10"), null);

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "SOL/USDT", Side.BUY, OrderPurpose.OPEN, "100", "10"));

        assertThat(result.state()).isEqualTo(OrderState.FAILED);
        assertThat(result.reasonCode()).isEqualTo(ExecutionCoordinator.RESUBMISSION_LIMIT_REACHED);
        assertThat(result.filledQuantity()).isEqualByComparingTo("20");
        assertThat(result.fillUpdates()).isEqualTo(2);
        assertThat(portfolioStore.snapshot().position("SOL/USDT").orElseThrow().quantity()).isEqualByComparingTo("20");
        assertThat(portfolioStore.snapshot().availableCapital()).isEqualByComparingTo("9800");
    }

    @Test
    void permanentVenueErrorRejectsWithoutRetry() {
        venue.submits.add(request -> {
            throw new PermanentVenueException("paper", "INSUFFICIENT_BALANCE", "not enough margin");
        });

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        assertThat(result.state()).isEqualTo(OrderState.REJECTED);
        assertThat(result.reasonCode()).isEqualTo("INSUFFICIENT_BALANCE");
        assertThat(result.venueAttempts()).isEqualTo(1);
        assertThat(portfolioStore.snapshot().availableCapital()).isEqualByComparingTo("10000");
    }

    @Test
    void venueRejectedReportRejectsOrder() {
        venue.submits.add(request -> new VenueOrderReport("V-1", VenueOrderReport.Status.REJECTED,
                MoneyUtils.ZERO, null, "market closed"));

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        assertThat(result.state()).isEqualTo(OrderState.REJECTED);
        assertThat(result.reasonCode()).isEqualTo(ExecutionCoordinator.VENUE_REJECTED);
        assertThat(result.message()).isEqualTo("market closed");
    }

    @Test
    void openOrderIsPolledUntilFilled() {
        venue.submits.add(request -> accepted(request));
        venue.statuses.add(id -> new VenueOrderReport(id, VenueOrderReport.Status.FILLED,
                MoneyUtils.bd("3"), MoneyUtils.bd("100"), null));

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "BTC/USDT", Side.SELL, OrderPurpose.OPEN, "3", "100"));

        assertThat(result.state()).isEqualTo(OrderState.FILLED);
        assertThat(result.venueAttempts()).isEqualTo(2);
        assertThat(venue.statusCalls.get()).isEqualTo(1);
        assertThat(portfolioStore.snapshot().position("BTC/USDT").orElseThrow().side()).isEqualTo(Side.SELL);
    }

    @Test
    void orderStillOpenAfterPollingFailsUnresolved() {
        venue.submits.add(request -> accepted(request));
        venue.defaultStatus = id -> new VenueOrderReport(id, VenueOrderReport.Status.ACCEPTED,
                MoneyUtils.ZERO, null, null);

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        assertThat(result.state()).isEqualTo(OrderState.FAILED);
        assertThat(result.reasonCode()).isEqualTo(ExecutionCoordinator.STATUS_UNRESOLVED);
        assertThat(venue.statusCalls.get()).isEqualTo(3);
        assertThat(venue.cancelled).containsExactly("V-o1-1");
        assertThat(portfolioStore.snapshot().availableCapital()).isEqualByComparingTo("10000");
    }

    @Test
    void openOrderBeyondAvailableCapitalIsRejectedBeforeReachingVenue() {
        portfolioStore = portfolioStore(100, new MutableClock(NOW));

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "2", "100"));

        assertThat(result.state()).isEqualTo(OrderState.REJECTED);
        assertThat(result.reasonCode()).isEqualTo(ExecutionCoordinator.INSUFFICIENT_CAPITAL);
        assertThat(venue.requests).isEmpty();
    }

    @Test
    void closeOrderRealizesPnlWithoutReservation() {
        ExecutionCoordinator coordinator = coordinator(Runnable::run);
        coordinator.execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        ExecutionResult close = coordinator.execute(order("o2", "BTC/USDT", Side.SELL, OrderPurpose.CLOSE, "1", "120"));

        assertThat(close.state()).isEqualTo(OrderState.FILLED);
        PortfolioSnapshot snapshot = portfolioStore.snapshot();
        assertThat(snapshot.openPositions()).isEmpty();
        assertThat(snapshot.dailyRealizedPnl()).isEqualByComparingTo("20");
        assertThat(snapshot.totalCapital()).isEqualByComparingTo("10020");
    }

    @Test
    void closeOnInstrumentAlreadyFlatIsRejectedWithoutVenueCall() {
        ExecutionCoordinator coordinator = coordinator(Runnable::run);
        coordinator.execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));
        coordinator.execute(order("o2", "BTC/USDT", Side.SELL, OrderPurpose.CLOSE, "1", "100"));

        ExecutionResult second = coordinator.execute(order("o3", "BTC/USDT", Side.SELL, OrderPurpose.CLOSE, "1", "100"));

        assertThat(second.state()).isEqualTo(OrderState.REJECTED);
        assertThat(second.reasonCode()).isEqualTo(ExecutionCoordinator.NO_POSITION_TO_CLOSE);
        assertThat(second.venueAttempts()).isZero();
        assertThat(venue.requests).extracting(VenueOrderRequest::orderId).containsExactly("o1", "o2");
        assertThat(portfolioStore.snapshot().openPositions()).isEmpty();
        assertThat(portfolioStore.snapshot().availableCapital()).isEqualByComparingTo("10000");
    }

    @Test
    void closeLargerThanOpenPositionIsCappedToPositionQuantity() {
        ExecutionCoordinator coordinator = coordinator(Runnable::run);
        coordinator.execute(order("o1", "ETH/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        ExecutionResult close = coordinator.execute(order("o2", "ETH/USDT", Side.SELL, OrderPurpose.CLOSE, "3", "110"));

        assertThat(close.state()).isEqualTo(OrderState.FILLED);
        assertThat(close.requestedQuantity()).isEqualByComparingTo("1");
        assertThat(close.filledQuantity()).isEqualByComparingTo("1");
        assertThat(venue.requests.get(1).quantity()).isEqualByComparingTo("1");
        PortfolioSnapshot snapshot = portfolioStore.snapshot();
        assertThat(snapshot.openPositions()).isEmpty();
        assertThat(snapshot.dailyRealizedPnl()).isEqualByComparingTo("10");
    }

    @Test
    void closeWithSameSideAsPositionIsRejected() {
        ExecutionCoordinator coordinator = coordinator(Runnable::run);
        coordinator.execute(order("o1", "SOL/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        ExecutionResult close = coordinator.execute(order("o2", "SOL/USDT", Side.BUY, OrderPurpose.CLOSE, "1", "100"));

        assertThat(close.state()).isEqualTo(OrderState.REJECTED);
        assertThat(close.reasonCode()).isEqualTo(ExecutionCoordinator.NO_POSITION_TO_CLOSE);
        assertThat(portfolioStore.snapshot().position("SOL/USDT").orElseThrow().quantity()).isEqualByComparingTo("1");
    }

    @Test
    void invariantViolationFailsOrderAndAlerts() {
        portfolioStore.applyFill(new FillEvent("seed", "seed", "BTC/USDT", "binance", Side.BUY, OrderPurpose.OPEN,
                MoneyUtils.bd("1"), MoneyUtils.bd("100"), null, null, NOW));

        ExecutionResult result = coordinator(Runnable::run)
                .execute(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        assertThat(result.state()).isEqualTo(OrderState.FAILED);
        assertThat(result.reasonCode()).isEqualTo(ExecutionCoordinator.INVARIANT_VIOLATION);
        verify(alertService).invariantViolated(eq(PortfolioStore.SINGLE_POSITION_PER_VENUE), eq("BTC/USDT"),
                eq("o1"), anyString());
        assertThat(portfolioStore.snapshot().position("BTC/USDT").orElseThrow().quantity()).isEqualByComparingTo("1");
        verify(notificationSink, times(1)).publish(any());
    }

    @Test
    void cancellationStopsOrderWaitingOnVenueStatus() throws Exception {
        properties.setStatusPollDelayMs(10_000);
        CountDownLatch submitted = new CountDownLatch(1);
        venue.submits.add(request -> {
            submitted.countDown();
            return accepted(request);
        });
        ExecutionCoordinator coordinator = coordinator(pool(1));

        OrderHandle handle = coordinator.submit(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));
        assertThat(submitted.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(coordinator.cancel("o1")).isTrue();

        ExecutionResult result = handle.result().get(2, TimeUnit.SECONDS);
        assertThat(result.state()).isEqualTo(OrderState.CANCELLED);
        assertThat(result.reasonCode()).isEqualTo(ExecutionCoordinator.CANCELLED);
        assertThat(portfolioStore.snapshot().availableCapital()).isEqualByComparingTo("10000");
        assertThat(coordinator.cancel("o1")).isFalse();
        assertThat(coordinator.inFlightOrderIds()).isEmpty();
        assertThat(venue.statusCalls.get()).isZero();
        assertThat(venue.cancelled).isEmpty();
    }

    @Test
    void venueCallInFlightDuringCancellationStillAppliesItsFill() throws Exception {
        properties.setVenueTimeoutMs(5_000);
        CountDownLatch callStarted = new CountDownLatch(1);
        CountDownLatch releaseCall = new CountDownLatch(1);
        venue.submits.add(request -> {
            callStarted.countDown();
            await(releaseCall);
            return new VenueOrderReport("V-" + request.clientOrderId(), VenueOrderReport.Status.PARTIALLY_FILLED,
                    MoneyUtils.bd("40"), MoneyUtils.bd("10"), null);
        });
        ExecutionCoordinator coordinator = coordinator(pool(1));

        OrderHandle handle = coordinator.submit(order("o1", "SOL/USDT", Side.BUY, OrderPurpose.OPEN, "100", "10"));
        assertThat(callStarted.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(coordinator.cancel("o1")).isTrue();
        releaseCall.countDown();

        ExecutionResult result = handle.result().get(5, TimeUnit.SECONDS);
        assertThat(result.state()).isEqualTo(OrderState.CANCELLED);
        assertThat(result.filledQuantity()).isEqualByComparingTo("40");
        assertThat(result.fillUpdates()).isEqualTo(1);
        assertThat(venue.requests).hasSize(1);
        assertThat(venue.statusCalls.get()).isZero();

        PortfolioSnapshot snapshot = portfolioStore.snapshot();
        assertThat(snapshot.position("SOL/USDT").orElseThrow().quantity()).isEqualByComparingTo("40");
        assertThat(snapshot.availableCapital()).isEqualByComparingTo("9600");
        verify(tradeJournal).upsertPortfolio(any());
    }

    @Test
    void cancellationDuringRetryBackoffMakesNoFurtherVenueCall() throws Exception {
        properties.getRetry().setBaseDelayMs(10_000);
        properties.getRetry().setMaxDelayMs(10_000);
        CountDownLatch firstAttempt = new CountDownLatch(1);
        venue.submits.add(request -> {
            firstAttempt.countDown();
            throw TransientVenueException.rateLimited("paper", "slow down");
        });
        ExecutionCoordinator coordinator = coordinator(pool(1));

        OrderHandle handle = coordinator.submit(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));
        assertThat(firstAttempt.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(coordinator.cancel("o1")).isTrue();

        ExecutionResult result = handle.result().get(2, TimeUnit.SECONDS);
        assertThat(result.state()).isEqualTo(OrderState.CANCELLED);
        assertThat(result.venueAttempts()).isEqualTo(1);
        assertThat(venue.requests).hasSize(1);
        assertThat(portfolioStore.snapshot().openPositions()).isEmpty();
        assertThat(portfolioStore.snapshot().availableCapital()).isEqualByComparingTo("10000");
    }

    @Test
    void queuedOrderCancelledBeforeItStartsNeverReachesVenue() throws Exception {
        properties.setVenueTimeoutMs(5_000);
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        venue.submits.add(request -> {
            firstStarted.countDown();
            await(releaseFirst);
            return filled(request, request.quantity());
        });
        ExecutionCoordinator coordinator = coordinator(pool(2));
        ApprovedOrder first = order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100");

        OrderHandle firstHandle = coordinator.submit(first);
        assertThat(firstStarted.await(2, TimeUnit.SECONDS)).isTrue();
        OrderHandle secondHandle = coordinator.submit(order("o2", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "100"));

        assertThat(coordinator.isInFlight("BTC/USDT")).isTrue();
        assertThat(coordinator.inFlightOrderIds()).containsExactlyInAnyOrder("o1", "o2");
        assertThatThrownBy(() -> coordinator.submit(first)).isInstanceOf(InvariantViolationException.class);
        assertThat(coordinator.cancel("o2")).isTrue();
        releaseFirst.countDown();

        assertThat(firstHandle.result().get(2, TimeUnit.SECONDS).state()).isEqualTo(OrderState.FILLED);
        ExecutionResult second = secondHandle.result().get(2, TimeUnit.SECONDS);
        assertThat(second.state()).isEqualTo(OrderState.CANCELLED);
        assertThat(second.venueAttempts()).isZero();
        assertThat(venue.requests).hasSize(1);
        assertThat(coordinator.isInFlight("BTC/USDT")).isFalse();
    }

    @Test
    void ordersForSameInstrumentRunOneAtATimeInSubmissionOrder() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        venue.defaultSubmit = request -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            sleep(10);
            active.decrementAndGet();
            return filled(request, request.quantity());
        };
        ExecutionCoordinator coordinator = coordinator(pool(4));

        List<OrderHandle> handles = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            handles.add(coordinator.submit(order("o" + i, "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "10")));
        }
        for (OrderHandle handle : handles) {
            assertThat(handle.result().get(5, TimeUnit.SECONDS).state()).isEqualTo(OrderState.FILLED);
        }

        assertThat(maxActive.get()).isEqualTo(1);
        assertThat(venue.requests).extracting(VenueOrderRequest::orderId)
                .containsExactly("o1", "o2", "o3", "o4", "o5");
        assertThat(portfolioStore.snapshot().position("BTC/USDT").orElseThrow().quantity()).isEqualByComparingTo("5");
    }

    @Test
    void ordersForDifferentInstrumentsRunConcurrently() throws Exception {
        properties.setVenueTimeoutMs(5_000);
        CountDownLatch ethReachedVenue = new CountDownLatch(1);
        venue.defaultSubmit = request -> {
            if (request.instrument().equals("ETH/USDT")) {
                ethReachedVenue.countDown();
            } else {
                await(ethReachedVenue);
            }
            return filled(request, request.quantity());
        };
        ExecutionCoordinator coordinator = coordinator(pool(2));

        OrderHandle btc = coordinator.submit(order("o1", "BTC/USDT", Side.BUY, OrderPurpose.OPEN, "1", "10"));
        OrderHandle eth = coordinator.submit(order("o2", "ETH/USDT", Side.BUY, OrderPurpose.OPEN, "1", "10"));

        assertThat(eth.result().get(2, TimeUnit.SECONDS).state()).isEqualTo(OrderState.FILLED);
        assertThat(btc.result().get(2, TimeUnit.SECONDS).state()).isEqualTo(OrderState.FILLED);
    }

    private ExecutionCoordinator coordinator(Executor executor) {
        VenueCallGuard guard = new VenueCallGuard(
                VenueResilienceConfig.timeLimiter(properties.getVenueTimeoutMs()), venueCallExecutor);
        return new ExecutionCoordinator(
                new VenueRegistry(List.of(venue)),
                guard,
                VenueResilienceConfig.backoff(properties.getRetry()),
                portfolioStore,
                tradeJournal,
                notificationSink,
                alertService,
                metricsService,
                properties,
                executor,
                new MutableClock(NOW));
    }

    private ExecutorService pool(int threads) {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        pools.add(pool);
        return pool;
    }

    private static VenueOrderReport filled(VenueOrderRequest request, BigDecimal quantity) {
        return new VenueOrderReport("V-" + request.clientOrderId(), VenueOrderReport.Status.FILLED,
                quantity, request.referencePrice(), null);
    }

    private static VenueOrderReport accepted(VenueOrderRequest request) {
        return new VenueOrderReport("V-" + request.clientOrderId(), VenueOrderReport.Status.ACCEPTED,
                MoneyUtils.ZERO, null, null);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(3, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    /**
     * Venue whose responses are queued per test; falls back to filling everything
     * at the reference price.
     */
    private static final class ScriptedVenue implements VenueAdapter {

        private final ConcurrentLinkedDeque<Function<VenueOrderRequest, VenueOrderReport>> submits =
                new ConcurrentLinkedDeque<>();
        private final ConcurrentLinkedDeque<Function<String, VenueOrderReport>> statuses = new ConcurrentLinkedDeque<>();
        private final List<VenueOrderRequest> requests = new CopyOnWriteArrayList<>();
        private final AtomicInteger statusCalls = new AtomicInteger();
        private final List<String> cancelled = new CopyOnWriteArrayList<>();
        private volatile Function<VenueOrderRequest, VenueOrderReport> defaultSubmit =
                request -> filled(request, request.quantity());
        private volatile Function<String, VenueOrderReport> defaultStatus = id -> {
            throw new PermanentVenueException("paper", "UNKNOWN_ORDER", "Unknown order " + id);
        };

        @Override
        public String name() {
            return "paper";
        }

        @Override
        public VenueOrderReport submitOrder(VenueOrderRequest request) {
            requests.add(request);
            Function<VenueOrderRequest, VenueOrderReport> step = submits.poll();
            return (step != null ? step : defaultSubmit).apply(request);
        }

        @Override
        public VenueOrderReport getOrderStatus(String venueOrderId) {
            statusCalls.incrementAndGet();
            Function<String, VenueOrderReport> step = statuses.poll();
            return (step != null ? step : defaultStatus).apply(venueOrderId);
        }

        @Override
        public void cancelOrder(String venueOrderId) {
            cancelled.add(venueOrderId);
        }
    }
}
