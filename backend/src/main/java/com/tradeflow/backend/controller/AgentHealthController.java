package com.tradeflow.backend.controller;

import com.tradeflow.backend.model.AgentHealth;
import com.tradeflow.backend.service.agent.AgentHealthRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentHealthController {

    private final AgentHealthRegistry agentHealthRegistry;

    @GetMapping("/health")
    public ResponseEntity<List<AgentHealth>> getAgentHealth() {
        return ResponseEntity.ok(agentHealthRegistry.snapshot());
    }
}
