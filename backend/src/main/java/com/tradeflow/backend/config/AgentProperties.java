package com.tradeflow.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "agents")
@Data
@Validated
public class AgentProperties {

    private boolean enabled = true;

    @Min(1)
    private long maxSnapshotAgeSeconds = 120;

    private Agent scalping = new Agent(true, 30, 0.1);

    private Agent swing = new Agent(true, 300, 0.1);

    private Agent research = new Agent(true, 300, 0.05);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Agent {
        private boolean enabled = true;

        @Min(1)
        private long intervalSeconds = 60;

        // Fraction of available capital suggested per proposal
        @Positive
        private double sizingFraction = 0.1;
    }
}
