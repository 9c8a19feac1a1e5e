package com.tradeflow.backend.config;

import com.tradeflow.backend.trading.pipeline.PriceConstraint;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    @NotBlank
    private String defaultVenue = "paper";

    private PriceConstraint.OrderType orderType = PriceConstraint.OrderType.MARKET;

    // Limit price distance from the reference price when orderType is LIMIT
    @PositiveOrZero
    private double limitOffsetFraction = 0.001;

    private Retry retry = new Retry();

    @Min(1)
    private long venueTimeoutMs = 5000;

    // Re-submissions of the remaining quantity after a partial fill
    @Min(0)
    private int maxResubmissions = 3;

    @Min(1)
    private int statusPollAttempts = 10;

    @Min(0)
    private long statusPollDelayMs = 500;

    private Paper paper = new Paper();

    private ProtectiveExit protectiveExit = new ProtectiveExit();

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @Positive
        private long baseDelayMs = 500;

        @Positive
        private long maxDelayMs = 10000;

        @PositiveOrZero
        @Max(1)
        private double jitterFactor = 0.2;
    }

    @Data
    public static class Paper {
        private boolean enabled = true;

        // Fraction of the requested quantity filled per submission, 1.0 fills everything
        @Positive
        @Max(1)
        private double fillRatio = 1.0;

        // How long a paper order stays known for status checks and duplicate submissions
        @Positive
        private long orderRetentionMs = 600000;
    }

    @Data
    public static class ProtectiveExit {
        private boolean enabled = true;

        @Positive
        private long intervalMs = 5000;
    }
}
