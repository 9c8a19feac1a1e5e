package com.tradeflow.backend.service.marketdata;

import com.tradeflow.backend.model.MarketSnapshot;

public interface MarketDataFeed {

    /**
     * @throws com.tradeflow.backend.exception.MarketDataUnavailableException when no
     *                                                                       current data exists
     */
    MarketSnapshot getSnapshot(String instrument);
}
