package com.tradeflow.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "portfolio")
@Data
@Validated
public class PortfolioProperties {

    @Positive
    private double initialCapital = 100.0;
}
