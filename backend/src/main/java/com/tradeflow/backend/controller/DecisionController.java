package com.tradeflow.backend.controller;

import com.tradeflow.backend.trading.pipeline.DecisionJournal;
import com.tradeflow.backend.trading.pipeline.DecisionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/decisions")
@RequiredArgsConstructor
public class DecisionController {

    static final int MAX_LIMIT = 1000;

    private final DecisionJournal decisionJournal;

    /**
     * Most recent candidate decisions, newest first, with approval or rejection details.
     */
    @GetMapping
    public ResponseEntity<List<DecisionRecord>> getRecentDecisions(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return ResponseEntity.ok(decisionJournal.recent(limit));
    }
}
