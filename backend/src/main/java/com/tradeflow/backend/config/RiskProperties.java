package com.tradeflow.backend.config;

import com.tradeflow.backend.trading.pipeline.RiskLimits;
import com.tradeflow.backend.util.MoneyUtils;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @Positive
    private double maxPositionSizeFraction = 0.1;

    @Positive
    private double maxDailyLossFraction = 0.05;

    @Positive
    private double stopLossFraction = 0.02;

    @Positive
    private double takeProfitFraction = 0.05;

    @Positive
    private double minTradableQuantity = 0.00001;

    @Min(0)
    @Max(23)
    private int dailyResetHourUtc = 0;

    public RiskLimits toLimits() {
        return new RiskLimits(
                MoneyUtils.bd(maxPositionSizeFraction),
                MoneyUtils.bd(maxDailyLossFraction),
                MoneyUtils.bd(stopLossFraction),
                MoneyUtils.bd(takeProfitFraction),
                MoneyUtils.bd(minTradableQuantity),
                dailyResetHourUtc
        );
    }
}
