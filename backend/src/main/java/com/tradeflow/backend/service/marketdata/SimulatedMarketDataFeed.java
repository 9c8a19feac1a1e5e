package com.tradeflow.backend.service.marketdata;

import com.tradeflow.backend.config.MarketDataProperties;
import com.tradeflow.backend.exception.MarketDataUnavailableException;
import com.tradeflow.backend.model.MarketSnapshot;
import com.tradeflow.backend.util.MoneyUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Random-walk prices and volumes per instrument with indicators computed over a
 * rolling window. Each call advances the walk by one step.
 */
@Component
@ConditionalOnProperty(name = "market-data.simulated", havingValue = "true", matchIfMissing = true)
public class SimulatedMarketDataFeed implements MarketDataFeed {

    private static final double BASE_VOLUME = 1000.0;

    private final MarketDataProperties properties;
    private final Clock clock;
    private final Random random;
    private final Map<String, Series> series = new ConcurrentHashMap<>();

    @Autowired
    public SimulatedMarketDataFeed(MarketDataProperties properties, Clock clock) {
        this(properties, clock, new Random());
    }

    SimulatedMarketDataFeed(MarketDataProperties properties, Clock clock, Random random) {
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    @Override
    public MarketSnapshot getSnapshot(String instrument) {
        Double seed = properties.getSeedPrices().get(instrument);
        if (seed == null) {
            throw new MarketDataUnavailableException("No simulated price source for " + instrument);
        }
        Series s = series.computeIfAbsent(instrument, key -> new Series(seed, properties.getWindow()));
        synchronized (s) {
            double drift = random.nextGaussian() * properties.getVolatility();
            double price = Math.max(s.lastPrice() * (1.0 + drift), 1e-8);
            double volume = BASE_VOLUME * Math.exp(random.nextGaussian() * 0.5);
            s.append(price, volume);

            List<Double> closes = new ArrayList<>(s.closes);
            List<Double> volumes = new ArrayList<>(s.volumes);
            Map<String, Double> indicators = new HashMap<>();
            indicators.put(Indicators.CHANGE_5, Indicators.change(closes, 5));
            indicators.put(Indicators.VOLUME_RATIO, Indicators.ratioToAverage(volumes, 20));
            indicators.put(Indicators.MA_20, Indicators.sma(closes, 20));
            indicators.put(Indicators.MA_50, Indicators.sma(closes, 50));
            indicators.put(Indicators.RSI_14, Indicators.rsi(closes, 14));
            return new MarketSnapshot(instrument, MoneyUtils.bd(price), indicators, clock.instant());
        }
    }

    private static final class Series {
        private final int window;
        private final Deque<Double> closes = new ArrayDeque<>();
        private final Deque<Double> volumes = new ArrayDeque<>();

        private Series(double seed, int window) {
            this.window = window;
            closes.addLast(seed);
            volumes.addLast(BASE_VOLUME);
        }

        private double lastPrice() {
            return closes.peekLast();
        }

        private void append(double price, double volume) {
            closes.addLast(price);
            volumes.addLast(volume);
            while (closes.size() > window) {
                closes.pollFirst();
                volumes.pollFirst();
            }
        }
    }
}
