package com.tradeflow.backend.service.portfolio;

import com.tradeflow.backend.config.PortfolioProperties;
import com.tradeflow.backend.exception.InvariantViolationException;
import com.tradeflow.backend.model.FillEvent;
import com.tradeflow.backend.model.OrderPurpose;
import com.tradeflow.backend.model.PortfolioSnapshot;
import com.tradeflow.backend.model.Position;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.trading.pipeline.TradingDayClock;
import com.tradeflow.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative portfolio state. Writes are mutually exclusive and atomic with
 * respect to readers; readers only ever see immutable snapshots. Only the
 * execution coordinator writes.
 */
@Slf4j
@Service
public class PortfolioStore {

    public static final String NON_NEGATIVE_CAPITAL = "AVAILABLE_CAPITAL_NON_NEGATIVE";
    public static final String SINGLE_POSITION_PER_VENUE = "SINGLE_POSITION_PER_INSTRUMENT_VENUE";
    public static final String CLOSE_REDUCES_ONLY = "CLOSE_REDUCES_EXISTING_POSITION";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final TradingDayClock tradingDayClock;

    private BigDecimal totalCapital;
    private BigDecimal cash;
    private BigDecimal dailyRealizedPnl = MoneyUtils.ZERO;
    private LocalDate tradingDay;
    private long version;
    private final Map<String, Position> positions = new HashMap<>();
    private final Map<String, BigDecimal> reservations = new HashMap<>();
    private final Set<String> appliedFills = new HashSet<>();

    public PortfolioStore(PortfolioProperties portfolioProperties, TradingDayClock tradingDayClock) {
        this.tradingDayClock = tradingDayClock;
        this.totalCapital = MoneyUtils.bd(portfolioProperties.getInitialCapital());
        this.cash = this.totalCapital;
        this.tradingDay = tradingDayClock.currentTradingDay();
    }

    public PortfolioSnapshot snapshot() {
        lock.readLock().lock();
        try {
            LocalDate currentDay = tradingDayClock.currentTradingDay();
            BigDecimal pnl = currentDay.equals(tradingDay) ? dailyRealizedPnl : MoneyUtils.ZERO;
            return new PortfolioSnapshot(
                    totalCapital,
                    availableLocked(),
                    positions,
                    pnl,
                    currentDay,
                    version,
                    tradingDayClock.now()
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sets capital aside for an order that has not filled yet.
     *
     * @return false when the reservation would push available capital below zero
     */
    public boolean reserve(String orderId, BigDecimal amount) {
        BigDecimal scaled = MoneyUtils.scale(amount);
        lock.writeLock().lock();
        try {
            BigDecimal after = MoneyUtils.subtract(availableLocked(), scaled);
            if (after.signum() < 0) {
                return false;
            }
            reservations.merge(orderId, scaled, MoneyUtils::add);
            version++;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void release(String orderId) {
        lock.writeLock().lock();
        try {
            if (reservations.remove(orderId) != null) {
                version++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean hasApplied(String fillId) {
        lock.readLock().lock();
        try {
            return appliedFills.contains(fillId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies one fill atomically. A fill id that was already applied is ignored.
     *
     * @return true when the fill changed the portfolio, false for a replay
     * @throws InvariantViolationException if the fill would break a portfolio invariant;
     *                                     the portfolio is left untouched
     */
    public boolean applyFill(FillEvent fill) {
        if (fill.quantity() == null || fill.quantity().signum() <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + fill.quantity());
        }
        lock.writeLock().lock();
        try {
            if (appliedFills.contains(fill.fillId())) {
                log.warn("Ignoring replayed fill fillId={} orderId={}", fill.fillId(), fill.orderId());
                return false;
            }
            rollTradingDayLocked();

            Position existing = positions.get(fill.instrument());
            if (existing != null && !existing.venue().equals(fill.venue())) {
                throw new InvariantViolationException(SINGLE_POSITION_PER_VENUE,
                        "Fill on venue " + fill.venue() + " for " + fill.instrument()
                                + " while a position is open on " + existing.venue());
            }
            checkPurposeLocked(fill, existing);

            BigDecimal quantity = MoneyUtils.scale(fill.quantity());
            BigDecimal price = MoneyUtils.scale(fill.price());
            BigDecimal newCash = cash;
            BigDecimal realized = MoneyUtils.ZERO;
            Position updated;

            if (existing == null) {
                newCash = MoneyUtils.subtract(newCash, MoneyUtils.multiply(quantity, price));
                updated = new Position(fill.instrument(), fill.venue(), fill.side(), quantity, price,
                        fill.stopLossPrice(), fill.takeProfitPrice(), fill.filledAt());
            } else if (existing.side() == fill.side()) {
                BigDecimal combined = MoneyUtils.add(existing.quantity(), quantity);
                BigDecimal avgEntry = MoneyUtils.add(
                                MoneyUtils.multiply(existing.quantity(), existing.entryPrice()),
                                MoneyUtils.multiply(quantity, price))
                        .divide(combined, MoneyUtils.SCALE, RoundingMode.HALF_UP);
                newCash = MoneyUtils.subtract(newCash, MoneyUtils.multiply(quantity, price));
                updated = new Position(existing.instrument(), existing.venue(), existing.side(), combined, avgEntry,
                        fill.stopLossPrice() != null ? fill.stopLossPrice() : existing.stopLossPrice(),
                        fill.takeProfitPrice() != null ? fill.takeProfitPrice() : existing.takeProfitPrice(),
                        existing.openedAt());
            } else {
                realized = realizedPnl(existing, quantity, price);
                // release the closed margin at entry plus the realized result
                newCash = MoneyUtils.add(newCash, MoneyUtils.add(MoneyUtils.multiply(quantity, existing.entryPrice()), realized));
                BigDecimal remaining = MoneyUtils.subtract(existing.quantity(), quantity);
                updated = remaining.signum() > 0
                        ? new Position(existing.instrument(), existing.venue(), existing.side(), remaining,
                        existing.entryPrice(), existing.stopLossPrice(), existing.takeProfitPrice(), existing.openedAt())
                        : null;
            }

            BigDecimal reservation = reservations.getOrDefault(fill.orderId(), MoneyUtils.ZERO);
            boolean opening = existing == null || existing.side() == fill.side();
            BigDecimal consumed = opening
                    ? MoneyUtils.min(reservation, MoneyUtils.multiply(quantity, price))
                    : MoneyUtils.ZERO;
            BigDecimal reservedAfter = MoneyUtils.subtract(totalReservedLocked(), consumed);
            BigDecimal availableAfter = MoneyUtils.subtract(newCash, reservedAfter);
            if (availableAfter.signum() < 0) {
                throw new InvariantViolationException(NON_NEGATIVE_CAPITAL,
                        "Fill " + fill.fillId() + " would leave available capital at " + availableAfter);
            }

            cash = newCash;
            if (consumed.signum() > 0) {
                BigDecimal left = MoneyUtils.subtract(reservation, consumed);
                if (left.signum() > 0) {
                    reservations.put(fill.orderId(), left);
                } else {
                    reservations.remove(fill.orderId());
                }
            }
            if (updated == null) {
                positions.remove(fill.instrument());
            } else {
                positions.put(fill.instrument(), updated);
            }
            if (realized.signum() != 0) {
                totalCapital = MoneyUtils.add(totalCapital, realized);
                dailyRealizedPnl = MoneyUtils.add(dailyRealizedPnl, realized);
            }
            appliedFills.add(fill.fillId());
            version++;
            log.info("Portfolio fill applied fillId={} instrument={} side={} qty={} price={} realized={} available={}",
                    fill.fillId(), fill.instrument(), fill.side(), quantity, price, realized, availableAfter);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * An opening fill may only start or add to a same-side position; a closing fill may
     * only reduce an opposite-side position, never open or flip one.
     */
    private void checkPurposeLocked(FillEvent fill, Position existing) {
        if (fill.purpose() == OrderPurpose.CLOSE) {
            if (existing == null || existing.side() == fill.side()) {
                throw new InvariantViolationException(CLOSE_REDUCES_ONLY,
                        "Closing fill " + fill.fillId() + " has no " + fill.side().opposite()
                                + " position on " + fill.instrument() + " to reduce");
            }
            if (MoneyUtils.scale(fill.quantity()).compareTo(existing.quantity()) > 0) {
                throw new InvariantViolationException(CLOSE_REDUCES_ONLY,
                        "Closing fill " + fill.fillId() + " for " + fill.quantity()
                                + " exceeds open quantity " + existing.quantity() + " on " + fill.instrument());
            }
        } else if (existing != null && existing.side() != fill.side()) {
            throw new InvariantViolationException(SINGLE_POSITION_PER_VENUE,
                    "Opening fill " + fill.fillId() + " on " + fill.instrument()
                            + " against an open " + existing.side() + " position");
        }
    }

    private BigDecimal realizedPnl(Position position, BigDecimal quantity, BigDecimal exitPrice) {
        BigDecimal diff = position.side() == Side.BUY
                ? MoneyUtils.subtract(exitPrice, position.entryPrice())
                : MoneyUtils.subtract(position.entryPrice(), exitPrice);
        return MoneyUtils.multiply(diff, quantity);
    }

    private void rollTradingDayLocked() {
        LocalDate currentDay = tradingDayClock.currentTradingDay();
        if (!currentDay.equals(tradingDay)) {
            log.info("Trading day rolled from {} to {}, resetting daily realized pnl {}", tradingDay, currentDay, dailyRealizedPnl);
            tradingDay = currentDay;
            dailyRealizedPnl = MoneyUtils.ZERO;
        }
    }

    private BigDecimal availableLocked() {
        return MoneyUtils.subtract(cash, totalReservedLocked());
    }

    private BigDecimal totalReservedLocked() {
        return reservations.values().stream().reduce(MoneyUtils.ZERO, MoneyUtils::add);
    }
}
