package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.config.ExecutionProperties;
import com.tradeflow.backend.exception.PermanentVenueException;
import com.tradeflow.backend.exception.TransientVenueException;
import com.tradeflow.backend.model.MarketSnapshot;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.service.marketdata.MarketSnapshotStore;
import com.tradeflow.backend.trading.pipeline.PriceConstraint;
import com.tradeflow.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated venue filling at the latest market price. A limit order that is not
 * marketable stays open until a later status check finds it marketable.
 * <p>
 * Orders are keyed by client order id: a repeated submission returns the order
 * already placed for that id instead of placing a second one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "execution.paper.enabled", havingValue = "true", matchIfMissing = true)
public class PaperVenueAdapter implements VenueAdapter {

    public static final String NAME = "paper";

    private final MarketSnapshotStore snapshotStore;
    private final ExecutionProperties executionProperties;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, PaperOrder> orders = new ConcurrentHashMap<>();
    private final Map<String, PaperOrder> ordersByClientId = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public VenueOrderReport submitOrder(VenueOrderRequest request) {
        if (request.quantity() == null || request.quantity().signum() <= 0) {
            throw new PermanentVenueException(NAME, "INVALID_QUANTITY", "Quantity must be positive: " + request.quantity());
        }
        evictExpired();
        PaperOrder order = ordersByClientId.computeIfAbsent(request.clientOrderId(), clientOrderId -> place(request));
        if (order.request != request) {
            log.info("Duplicate submission clientOrderId={} maps to paper order {}",
                    request.clientOrderId(), order.venueOrderId);
        }
        return evaluate(order);
    }

    @Override
    public VenueOrderReport getOrderStatus(String venueOrderId) {
        PaperOrder order = orders.get(venueOrderId);
        if (order == null) {
            throw new PermanentVenueException(NAME, "UNKNOWN_ORDER", "Unknown paper order " + venueOrderId);
        }
        return evaluate(order);
    }

    @Override
    public void cancelOrder(String venueOrderId) {
        PaperOrder order = orders.remove(venueOrderId);
        if (order != null) {
            ordersByClientId.remove(order.request.clientOrderId(), order);
            log.debug("Paper order {} cancelled", venueOrderId);
        }
    }

    int knownOrders() {
        return orders.size();
    }

    private PaperOrder place(VenueOrderRequest request) {
        PaperOrder order = new PaperOrder("PAPER-" + sequence.incrementAndGet(), request, clock.instant());
        orders.put(order.venueOrderId, order);
        log.debug("Paper order {} accepted for {} {} {}",
                order.venueOrderId, request.side(), request.quantity(), request.instrument());
        return order;
    }

    private synchronized VenueOrderReport evaluate(PaperOrder order) {
        if (order.finalReport != null) {
            return order.finalReport;
        }
        MarketSnapshot snapshot = snapshotStore.latest(order.request.instrument())
                .orElseThrow(() -> new TransientVenueException(NAME, "NO_PRICE",
                        "No market price for " + order.request.instrument()));
        BigDecimal price = snapshot.price();
        if (!marketable(order.request, price)) {
            return new VenueOrderReport(order.venueOrderId, VenueOrderReport.Status.ACCEPTED,
                    MoneyUtils.ZERO, null, "Resting limit " + order.request.priceConstraint().limitPrice());
        }
        BigDecimal ratio = MoneyUtils.bd(executionProperties.getPaper().getFillRatio());
        BigDecimal filled = MoneyUtils.floorQuantity(order.request.quantity().multiply(ratio));
        VenueOrderReport.Status status = filled.compareTo(order.request.quantity()) >= 0
                ? VenueOrderReport.Status.FILLED
                : VenueOrderReport.Status.PARTIALLY_FILLED;
        order.finalReport = new VenueOrderReport(order.venueOrderId, status, filled, price, null);
        return order.finalReport;
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minusMillis(executionProperties.getPaper().getOrderRetentionMs());
        orders.values().removeIf(order -> {
            if (order.placedAt.isBefore(cutoff)) {
                ordersByClientId.remove(order.request.clientOrderId(), order);
                return true;
            }
            return false;
        });
    }

    private boolean marketable(VenueOrderRequest request, BigDecimal price) {
        PriceConstraint constraint = request.priceConstraint();
        if (constraint == null || constraint.orderType() == PriceConstraint.OrderType.MARKET) {
            return true;
        }
        return request.side() == Side.BUY
                ? price.compareTo(constraint.limitPrice()) <= 0
                : price.compareTo(constraint.limitPrice()) >= 0;
    }

    private static final class PaperOrder {
        private final String venueOrderId;
        private final VenueOrderRequest request;
        private final Instant placedAt;
        private VenueOrderReport finalReport;

        private PaperOrder(String venueOrderId, VenueOrderRequest request, Instant placedAt) {
            this.venueOrderId = venueOrderId;
            this.request = request;
            this.placedAt = placedAt;
        }
    }
}
