package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.config.ExecutionProperties;
import com.tradeflow.backend.exception.InvariantViolationException;
import com.tradeflow.backend.exception.PermanentVenueException;
import com.tradeflow.backend.exception.TransientVenueException;
import com.tradeflow.backend.exception.VenueException;
import com.tradeflow.backend.model.ExecutionResult;
import com.tradeflow.backend.model.FillEvent;
import com.tradeflow.backend.model.OrderPurpose;
import com.tradeflow.backend.model.OrderState;
import com.tradeflow.backend.model.Position;
import com.tradeflow.backend.model.TradingNotification;
import com.tradeflow.backend.service.AlertService;
import com.tradeflow.backend.service.MetricsService;
import com.tradeflow.backend.service.NotificationSink;
import com.tradeflow.backend.service.TradeJournal;
import com.tradeflow.backend.service.portfolio.PortfolioStore;
import com.tradeflow.backend.trading.pipeline.ApprovedOrder;
import com.tradeflow.backend.util.MoneyUtils;
import io.github.resilience4j.core.IntervalFunction;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Drives approved orders through PENDING, SUBMITTED, PARTIALLY_FILLED and a terminal
 * state against their venue.
 * <p>
 * Orders for the same instrument run strictly one after another, so every fill of an
 * order is applied to the portfolio before the next order for that instrument starts.
 * Orders for different instruments run concurrently on the trading executor. This is
 * the only component that writes to the {@link PortfolioStore}.
 */
@Slf4j
@Service
public class ExecutionCoordinator {

    public static final String RETRY_BUDGET_EXHAUSTED = "RETRY_BUDGET_EXHAUSTED";
    public static final String VENUE_REJECTED = "VENUE_REJECTED";
    public static final String INSUFFICIENT_CAPITAL = "INSUFFICIENT_CAPITAL";
    public static final String INVARIANT_VIOLATION = "INVARIANT_VIOLATION";
    public static final String CANCELLED = "CANCELLED";
    public static final String RESUBMISSION_LIMIT_REACHED = "RESUBMISSION_LIMIT_REACHED";
    public static final String STATUS_UNRESOLVED = "STATUS_UNRESOLVED";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";
    public static final String NO_POSITION_TO_CLOSE = "NO_POSITION_TO_CLOSE";

    private static final String STATE_MACHINE = "ORDER_STATE_TRANSITION";

    private final VenueRegistry venueRegistry;
    private final VenueCallGuard venueCallGuard;
    private final IntervalFunction venueBackoff;
    private final PortfolioStore portfolioStore;
    private final TradeJournal tradeJournal;
    private final NotificationSink notificationSink;
    private final AlertService alertService;
    private final MetricsService metricsService;
    private final ExecutionProperties executionProperties;
    private final Executor tradingExecutor;
    private final Clock clock;

    private final Map<String, OrderHandle> inFlight = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ExecutionResult>> instrumentTails = new HashMap<>();

    public ExecutionCoordinator(VenueRegistry venueRegistry,
                                VenueCallGuard venueCallGuard,
                                IntervalFunction venueBackoff,
                                PortfolioStore portfolioStore,
                                TradeJournal tradeJournal,
                                NotificationSink notificationSink,
                                AlertService alertService,
                                MetricsService metricsService,
                                ExecutionProperties executionProperties,
                                @Qualifier("tradingExecutor") Executor tradingExecutor,
                                Clock clock) {
        this.venueRegistry = venueRegistry;
        this.venueCallGuard = venueCallGuard;
        this.venueBackoff = venueBackoff;
        this.portfolioStore = portfolioStore;
        this.tradeJournal = tradeJournal;
        this.notificationSink = notificationSink;
        this.alertService = alertService;
        this.metricsService = metricsService;
        this.executionProperties = executionProperties;
        this.tradingExecutor = tradingExecutor;
        this.clock = clock;
    }

    /**
     * Queues the order behind any earlier order for the same instrument and returns
     * immediately.
     */
    public OrderHandle submit(ApprovedOrder order) {
        OrderHandle handle = new OrderHandle(order);
        if (inFlight.putIfAbsent(order.orderId(), handle) != null) {
            throw new InvariantViolationException("UNIQUE_ORDER_ID", "Order " + order.orderId() + " submitted twice");
        }
        tradeJournal.recordApprovedOrder(order);
        CompletableFuture<ExecutionResult> next;
        synchronized (instrumentTails) {
            CompletableFuture<ExecutionResult> tail = instrumentTails.get(order.instrument());
            CompletableFuture<ExecutionResult> previous = tail == null
                    ? CompletableFuture.completedFuture(null)
                    : tail.exceptionally(error -> null);
            next = previous.thenApplyAsync(ignored -> run(handle), tradingExecutor);
            instrumentTails.put(order.instrument(), next);
        }
        next.whenComplete((result, error) -> {
            inFlight.remove(order.orderId());
            synchronized (instrumentTails) {
                instrumentTails.remove(order.instrument(), next);
            }
            handle.complete(result != null ? result : unexpectedFailure(order, error));
        });
        return handle;
    }

    /**
     * Synchronous form of {@link #submit(ApprovedOrder)}.
     */
    public ExecutionResult execute(ApprovedOrder order) {
        return submit(order).result().join();
    }

    public boolean cancel(String orderId) {
        OrderHandle handle = inFlight.get(orderId);
        if (handle == null) {
            return false;
        }
        log.info("Cancellation requested orderId={} instrument={}", orderId, handle.instrument());
        return handle.cancel();
    }

    @PreDestroy
    public void cancelAll() {
        if (!inFlight.isEmpty()) {
            log.info("Cancelling {} in-flight orders", inFlight.size());
        }
        inFlight.values().forEach(OrderHandle::cancel);
    }

    public boolean isInFlight(String instrument) {
        return inFlight.values().stream().anyMatch(handle -> handle.instrument().equals(instrument));
    }

    public List<String> inFlightOrderIds() {
        return List.copyOf(inFlight.keySet());
    }

    ExecutionResult run(OrderHandle handle) {
        ApprovedOrder order = handle.order();
        MDC.put("orderId", order.orderId());
        MDC.put("instrument", order.instrument());
        OrderRun run = new OrderRun(order);
        try {
            ExecutionResult result = drive(handle, run);
            finish(order, run, result);
            return result;
        } catch (InvariantViolationException e) {
            alertService.invariantViolated(e.getInvariant(), order.instrument(), order.orderId(), e.getMessage());
            ExecutionResult result = run.result(OrderState.FAILED, INVARIANT_VIOLATION, e.getMessage(), clock);
            finish(order, run, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Order processing failed orderId={} instrument={}", order.orderId(), order.instrument(), e);
            ExecutionResult result = run.result(OrderState.FAILED, UNEXPECTED_ERROR, e.getMessage(), clock);
            finish(order, run, result);
            return result;
        } finally {
            MDC.remove("orderId");
            MDC.remove("instrument");
        }
    }

    private ExecutionResult drive(OrderHandle handle, OrderRun run) {
        ApprovedOrder order = handle.order();
        if (handle.isCancelRequested()) {
            return terminal(run, OrderState.CANCELLED, CANCELLED, "Cancelled before submission");
        }
        if (order.purpose() == OrderPurpose.OPEN && !portfolioStore.reserve(order.orderId(), reservationAmount(order))) {
            return terminal(run, OrderState.REJECTED, INSUFFICIENT_CAPITAL,
                    "Available capital cannot cover " + reservationAmount(order));
        }
        if (order.purpose() == OrderPurpose.CLOSE) {
            // the position may have shrunk or closed since approval
            Optional<Position> open = portfolioStore.snapshot().position(order.instrument())
                    .filter(position -> position.side() != order.side());
            if (open.isEmpty()) {
                return terminal(run, OrderState.REJECTED, NO_POSITION_TO_CLOSE,
                        "No open " + order.side().opposite() + " position on " + order.instrument() + " to close");
            }
            if (open.get().quantity().compareTo(run.target) < 0) {
                log.info("Capping close orderId={} from {} to open quantity {}",
                        order.orderId(), run.target, open.get().quantity());
                run.target = open.get().quantity();
            }
        }

        VenueAdapter venue = venueRegistry.resolve(order.venue());
        int submission = 0;
        while (true) {
            if (handle.isCancelRequested()) {
                return terminal(run, OrderState.CANCELLED, CANCELLED, "Cancelled after " + run.filled + " filled");
            }
            submission++;
            BigDecimal remaining = run.remaining();
            VenueOrderRequest request = new VenueOrderRequest(
                    order.orderId() + "-" + submission,
                    order.orderId(),
                    order.instrument(),
                    order.side(),
                    remaining,
                    order.priceConstraint(),
                    order.referencePrice());

            VenueCallResult<VenueOrderReport> submitted = callWithRetry(handle, run, venue, "submitOrder",
                    () -> venue.submitOrder(request));
            if (!submitted.isSuccess()) {
                return terminalFor(run, submitted);
            }
            VenueOrderReport report = submitted.value();
            if (report.status() == VenueOrderReport.Status.REJECTED) {
                return terminal(run, OrderState.REJECTED, VENUE_REJECTED, report.message());
            }
            run.transition(OrderState.SUBMITTED);
            log.info("Order submitted orderId={} venueOrderId={} qty={} submission={}",
                    order.orderId(), report.venueOrderId(), remaining, submission);

            SubmissionFills fills = new SubmissionFills(report.venueOrderId());
            applyFills(order, run, fills, report);

            int polls = 0;
            while (report.isOpen() && polls < executionProperties.getStatusPollAttempts()) {
                if (waitOrCancelled(handle, Duration.ofMillis(executionProperties.getStatusPollDelayMs()))) {
                    return terminal(run, OrderState.CANCELLED, CANCELLED, "Cancelled while awaiting venue status");
                }
                polls++;
                String venueOrderId = report.venueOrderId();
                VenueCallResult<VenueOrderReport> polled = callWithRetry(handle, run, venue, "getOrderStatus",
                        () -> venue.getOrderStatus(venueOrderId));
                if (!polled.isSuccess()) {
                    return terminalFor(run, polled);
                }
                report = polled.value();
                applyFills(order, run, fills, report);
            }

            if (run.remaining().signum() <= 0) {
                return terminal(run, OrderState.FILLED, null, "Filled " + run.filled);
            }
            switch (report.status()) {
                case REJECTED -> {
                    return terminal(run, OrderState.REJECTED, VENUE_REJECTED, report.message());
                }
                case ACCEPTED -> {
                    withdraw(venue, report.venueOrderId());
                    return terminal(run, OrderState.FAILED, STATUS_UNRESOLVED,
                            "Venue still reports the order open after " + polls + " status checks");
                }
                default -> {
                    run.transition(OrderState.PARTIALLY_FILLED);
                    if (submission > executionProperties.getMaxResubmissions()) {
                        return terminal(run, OrderState.FAILED, RESUBMISSION_LIMIT_REACHED,
                                "Filled " + run.filled + " of " + run.target
                                        + " after " + submission + " submissions");
                    }
                    log.info("Partial fill orderId={} filled={} remaining={}, re-submitting",
                            order.orderId(), run.filled, run.remaining());
                }
            }
        }
    }

    /**
     * Applies the increase in cumulative filled quantity since the last report of this
     * submission as one fill event.
     */
    private void applyFills(ApprovedOrder order, OrderRun run, SubmissionFills fills, VenueOrderReport report) {
        BigDecimal cumulative = MoneyUtils.scale(report.cumulativeFilledQuantity());
        BigDecimal delta = MoneyUtils.subtract(cumulative, fills.cumulative);
        if (delta.signum() <= 0) {
            return;
        }
        BigDecimal avg = report.averagePrice() != null ? MoneyUtils.scale(report.averagePrice()) : order.referencePrice();
        BigDecimal price = MoneyUtils.subtract(MoneyUtils.multiply(cumulative, avg), fills.notional)
                .divide(delta, MoneyUtils.SCALE, RoundingMode.HALF_UP);

        FillEvent fill = new FillEvent(
                fills.venueOrderId + ":" + cumulative.toPlainString(),
                order.orderId(),
                order.instrument(),
                order.venue(),
                order.side(),
                order.purpose(),
                delta,
                price,
                order.stopLossPrice(),
                order.takeProfitPrice(),
                clock.instant());
        if (portfolioStore.applyFill(fill)) {
            run.recordFill(delta, price);
        }
        fills.cumulative = cumulative;
        fills.notional = MoneyUtils.multiply(cumulative, avg);
    }

    private <T> VenueCallResult<T> callWithRetry(OrderHandle handle, OrderRun run, VenueAdapter venue,
                                                 String operation, Supplier<T> call) {
        int maxAttempts = executionProperties.getRetry().getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            if (handle.isCancelRequested()) {
                return VenueCallResult.cancelled();
            }
            run.venueAttempts++;
            try {
                return VenueCallResult.success(venueCallGuard.call(venue.name(), operation, call));
            } catch (PermanentVenueException e) {
                log.warn("Venue {} rejected {} orderId={} code={} message={}",
                        venue.name(), operation, run.order.orderId(), e.getCode(), e.getMessage());
                return VenueCallResult.permanent(e);
            } catch (TransientVenueException e) {
                if (attempt >= maxAttempts) {
                    log.error("Venue {} {} failed after {} attempts orderId={} last={}",
                            venue.name(), operation, attempt, run.order.orderId(), e.getMessage());
                    return VenueCallResult.exhausted(e);
                }
                Duration delay = Duration.ofMillis(venueBackoff.apply(attempt));
                metricsService.recordVenueRetry(venue.name());
                log.warn("Transient venue failure {} {} attempt {}/{} orderId={} code={}, retrying in {}ms",
                        venue.name(), operation, attempt, maxAttempts, run.order.orderId(), e.getCode(), delay.toMillis());
                if (waitOrCancelled(handle, delay)) {
                    return VenueCallResult.cancelled();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return VenueCallResult.cancelled();
            }
        }
    }

    /**
     * Best-effort withdrawal of an order still resting at the venue once polling gives up.
     */
    private void withdraw(VenueAdapter venue, String venueOrderId) {
        try {
            venueCallGuard.call(venue.name(), "cancelOrder", () -> {
                venue.cancelOrder(venueOrderId);
                return venueOrderId;
            });
        } catch (VenueException e) {
            log.warn("Could not withdraw venue order {} from {}: {}", venueOrderId, venue.name(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean waitOrCancelled(OrderHandle handle, Duration delay) {
        try {
            return handle.awaitCancellation(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private ExecutionResult terminalFor(OrderRun run, VenueCallResult<?> outcome) {
        return switch (outcome.kind()) {
            case RETRY_EXHAUSTED -> terminal(run, OrderState.FAILED, RETRY_BUDGET_EXHAUSTED,
                    outcome.error().getMessage());
            case PERMANENT_FAILURE -> terminal(run, OrderState.REJECTED,
                    Optional.ofNullable(outcome.error().getCode()).orElse(VENUE_REJECTED), outcome.error().getMessage());
            case CANCELLED -> terminal(run, OrderState.CANCELLED, CANCELLED, "Cancelled after " + run.filled + " filled");
            case SUCCESS -> throw new IllegalStateException("Successful call is not terminal");
        };
    }

    private ExecutionResult terminal(OrderRun run, OrderState state, String reasonCode, String message) {
        run.transition(state);
        return run.result(state, reasonCode, message, clock);
    }

    private void finish(ApprovedOrder order, OrderRun run, ExecutionResult result) {
        portfolioStore.release(order.orderId());
        metricsService.recordOrderTerminal(result.state().name());
        if (result.isSuccess()) {
            log.info("Order {} FILLED qty={} avgPrice={} attempts={} fills={}",
                    order.orderId(), result.filledQuantity(), result.averagePrice(), result.venueAttempts(), result.fillUpdates());
        } else {
            log.warn("Order {} {} reason={} filled={}/{} message={}",
                    order.orderId(), result.state(), result.reasonCode(), result.filledQuantity(),
                    result.requestedQuantity(), result.message());
        }
        tradeJournal.recordExecutionResult(result);
        if (run.fillUpdates > 0) {
            tradeJournal.upsertPortfolio(portfolioStore.snapshot());
        }
        notificationSink.publish(new TradingNotification(
                TradingNotification.Type.EXECUTION,
                order.instrument(),
                order.orderId(),
                result.reasonCode() != null ? result.reasonCode() : result.state().name(),
                result.state() + ": " + (result.message() != null ? result.message() : order.rationale()),
                result.completedAt()));
    }

    private ExecutionResult unexpectedFailure(ApprovedOrder order, Throwable error) {
        return new ExecutionResult(order.orderId(), order.instrument(), order.venue(), OrderState.FAILED,
                order.approvedQuantity(), MoneyUtils.ZERO, null, 0, 0, UNEXPECTED_ERROR,
                error != null ? error.getMessage() : null, clock.instant());
    }

    private BigDecimal reservationAmount(ApprovedOrder order) {
        BigDecimal price = order.priceConstraint() != null && order.priceConstraint().limitPrice() != null
                ? order.referencePrice().max(order.priceConstraint().limitPrice())
                : order.referencePrice();
        return MoneyUtils.multiply(order.approvedQuantity(), price);
    }

    private static final class SubmissionFills {
        private final String venueOrderId;
        private BigDecimal cumulative = MoneyUtils.ZERO;
        private BigDecimal notional = MoneyUtils.ZERO;

        private SubmissionFills(String venueOrderId) {
            this.venueOrderId = venueOrderId;
        }
    }

    /**
     * Mutable progress of one order. Confined to the thread running the order.
     */
    private static final class OrderRun {
        private final ApprovedOrder order;
        private BigDecimal target;
        private OrderState state = OrderState.PENDING;
        private BigDecimal filled = MoneyUtils.ZERO;
        private BigDecimal filledNotional = MoneyUtils.ZERO;
        private int venueAttempts;
        private int fillUpdates;

        private OrderRun(ApprovedOrder order) {
            this.order = order;
            this.target = order.approvedQuantity();
        }

        private void transition(OrderState target) {
            if (!state.canTransitionTo(target)) {
                throw new InvariantViolationException(STATE_MACHINE,
                        "Order " + order.orderId() + " cannot move from " + state + " to " + target);
            }
            state = target;
        }

        private void recordFill(BigDecimal quantity, BigDecimal price) {
            filled = MoneyUtils.add(filled, quantity);
            filledNotional = MoneyUtils.add(filledNotional, MoneyUtils.multiply(quantity, price));
            fillUpdates++;
        }

        private BigDecimal remaining() {
            return MoneyUtils.subtract(target, filled);
        }

        private ExecutionResult result(OrderState terminal, String reasonCode, String message, Clock clock) {
            BigDecimal averagePrice = filled.signum() > 0 ? MoneyUtils.divide(filledNotional, filled) : null;
            return new ExecutionResult(order.orderId(), order.instrument(), order.venue(), terminal,
                    target, filled, averagePrice, venueAttempts, fillUpdates,
                    reasonCode, message, clock.instant());
        }
    }
}
