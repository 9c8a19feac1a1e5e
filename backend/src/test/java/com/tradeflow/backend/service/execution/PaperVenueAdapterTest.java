package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.config.ExecutionProperties;
import com.tradeflow.backend.exception.PermanentVenueException;
import com.tradeflow.backend.exception.TransientVenueException;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.service.marketdata.MarketSnapshotStore;
import com.tradeflow.backend.trading.pipeline.PriceConstraint;
import com.tradeflow.backend.util.MoneyUtils;
import com.tradeflow.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static com.tradeflow.backend.util.TestFixtures.NOW;
import static com.tradeflow.backend.util.TestFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaperVenueAdapterTest {

    private MarketSnapshotStore snapshotStore;
    private ExecutionProperties properties;
    private PaperVenueAdapter adapter;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        snapshotStore = new MarketSnapshotStore(clock);
        snapshotStore.update(snapshot("BTC/USDT", "100", NOW, Map.of()));
        properties = new ExecutionProperties();
        adapter = new PaperVenueAdapter(snapshotStore, properties, clock);
    }

    @Test
    void marketOrderFillsAtLatestPrice() {
        VenueOrderReport report = adapter.submitOrder(request(Side.BUY, "2", PriceConstraint.market()));

        assertThat(report.status()).isEqualTo(VenueOrderReport.Status.FILLED);
        assertThat(report.cumulativeFilledQuantity()).isEqualByComparingTo("2");
        assertThat(report.averagePrice()).isEqualByComparingTo("100");
        assertThat(report.venueOrderId()).startsWith("PAPER-");
    }

    @Test
    void fillRatioProducesPartialFill() {
        properties.getPaper().setFillRatio(0.4);

        VenueOrderReport report = adapter.submitOrder(request(Side.SELL, "100", PriceConstraint.market()));

        assertThat(report.status()).isEqualTo(VenueOrderReport.Status.PARTIALLY_FILLED);
        assertThat(report.cumulativeFilledQuantity()).isEqualByComparingTo("40");
    }

    @Test
    void nonMarketableLimitRestsUntilPriceCrosses() {
        VenueOrderReport resting = adapter.submitOrder(
                request(Side.BUY, "1", PriceConstraint.limit(MoneyUtils.bd("95"))));
        assertThat(resting.isOpen()).isTrue();
        assertThat(adapter.getOrderStatus(resting.venueOrderId()).isOpen()).isTrue();

        snapshotStore.update(snapshot("BTC/USDT", "94", NOW.plusSeconds(1), Map.of()));

        VenueOrderReport filled = adapter.getOrderStatus(resting.venueOrderId());
        assertThat(filled.status()).isEqualTo(VenueOrderReport.Status.FILLED);
        assertThat(filled.averagePrice()).isEqualByComparingTo("94");
    }

    @Test
    void repeatedClientOrderIdReturnsTheOrderAlreadyPlaced() {
        VenueOrderReport first = adapter.submitOrder(request(Side.BUY, "1", PriceConstraint.market()));
        snapshotStore.update(snapshot("BTC/USDT", "101", NOW.plusSeconds(1), Map.of()));

        VenueOrderReport retried = adapter.submitOrder(request(Side.BUY, "1", PriceConstraint.market()));

        assertThat(retried.venueOrderId()).isEqualTo(first.venueOrderId());
        assertThat(retried.cumulativeFilledQuantity()).isEqualByComparingTo("1");
        assertThat(retried.averagePrice()).isEqualByComparingTo("100");
        assertThat(adapter.knownOrders()).isEqualTo(1);
        assertThat(adapter.getOrderStatus(first.venueOrderId()).status()).isEqualTo(VenueOrderReport.Status.FILLED);
    }

    @Test
    void cancelledRestingOrderIsForgotten() {
        VenueOrderReport resting = adapter.submitOrder(
                request(Side.BUY, "1", PriceConstraint.limit(MoneyUtils.bd("95"))));

        adapter.cancelOrder(resting.venueOrderId());

        assertThat(adapter.knownOrders()).isZero();
        assertThatThrownBy(() -> adapter.getOrderStatus(resting.venueOrderId()))
                .isInstanceOf(PermanentVenueException.class)
                .hasFieldOrPropertyWithValue("code", "UNKNOWN_ORDER");
    }

    @Test
    void ordersOlderThanRetentionAreEvictedOnNextSubmission() {
        properties.getPaper().setOrderRetentionMs(60_000);
        VenueOrderReport resting = adapter.submitOrder(
                request(Side.BUY, "1", PriceConstraint.limit(MoneyUtils.bd("95"))));

        clock.advance(Duration.ofMinutes(2));
        adapter.submitOrder(new VenueOrderRequest("o2-1", "o2", "BTC/USDT", Side.BUY, MoneyUtils.bd("1"),
                PriceConstraint.market(), MoneyUtils.bd("100")));

        assertThat(adapter.knownOrders()).isEqualTo(1);
        assertThatThrownBy(() -> adapter.getOrderStatus(resting.venueOrderId()))
                .isInstanceOf(PermanentVenueException.class);
    }

    @Test
    void missingPriceIsTransient() {
        VenueOrderRequest request = new VenueOrderRequest("o1-1", "o1", "XRP/USDT", Side.BUY,
                MoneyUtils.bd("1"), PriceConstraint.market(), MoneyUtils.bd("1"));

        assertThatThrownBy(() -> adapter.submitOrder(request))
                .isInstanceOf(TransientVenueException.class)
                .hasFieldOrPropertyWithValue("code", "NO_PRICE");
    }

    @Test
    void invalidQuantityAndUnknownOrderArePermanent() {
        assertThatThrownBy(() -> adapter.submitOrder(request(Side.BUY, "0", PriceConstraint.market())))
                .isInstanceOf(PermanentVenueException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_QUANTITY");
        assertThatThrownBy(() -> adapter.getOrderStatus("PAPER-404"))
                .isInstanceOf(PermanentVenueException.class)
                .hasFieldOrPropertyWithValue("code", "UNKNOWN_ORDER");
    }

    private static VenueOrderRequest request(Side side, String quantity, PriceConstraint constraint) {
        return new VenueOrderRequest("o1-1", "o1", "BTC/USDT", side, MoneyUtils.bd(quantity), constraint,
                MoneyUtils.bd("100"));
    }
}
