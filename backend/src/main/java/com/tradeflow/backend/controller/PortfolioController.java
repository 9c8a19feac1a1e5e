package com.tradeflow.backend.controller;

import com.tradeflow.backend.dto.PortfolioSummaryDTO;
import com.tradeflow.backend.service.portfolio.PortfolioValuationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
public class PortfolioController {

    private final PortfolioValuationService portfolioValuationService;

    /**
     * Current portfolio with open positions marked to the latest market price.
     */
    @GetMapping
    public ResponseEntity<PortfolioSummaryDTO> getPortfolio() {
        return ResponseEntity.ok(portfolioValuationService.summary());
    }
}
