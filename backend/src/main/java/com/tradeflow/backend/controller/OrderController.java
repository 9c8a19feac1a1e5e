package com.tradeflow.backend.controller;

import com.tradeflow.backend.exception.NotFoundException;
import com.tradeflow.backend.service.execution.ExecutionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final ExecutionCoordinator executionCoordinator;

    @GetMapping("/in-flight")
    public ResponseEntity<List<String>> getInFlightOrders() {
        return ResponseEntity.ok(executionCoordinator.inFlightOrderIds());
    }

    /**
     * Requests cooperative cancellation. The order stops before its next venue call;
     * the result arrives through the execution notification.
     */
    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String orderId) {
        if (!executionCoordinator.inFlightOrderIds().contains(orderId)) {
            throw new NotFoundException("No in-flight order " + orderId);
        }
        boolean requested = executionCoordinator.cancel(orderId);
        log.info("Cancel requested via API orderId={} newlyRequested={}", orderId, requested);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("orderId", orderId, "cancelRequested", true));
    }
}
