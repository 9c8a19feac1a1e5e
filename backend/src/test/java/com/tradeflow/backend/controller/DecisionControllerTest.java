package com.tradeflow.backend.controller;

import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.trading.pipeline.DecisionJournal;
import com.tradeflow.backend.trading.pipeline.RejectionReason;
import com.tradeflow.backend.trading.pipeline.RiskVerdict;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static com.tradeflow.backend.util.TestFixtures.NOW;
import static com.tradeflow.backend.util.TestFixtures.decision;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "pipeline.scheduler-enabled=false",
        "agents.enabled=false",
        "execution.protective-exit.enabled=false"
})
@AutoConfigureMockMvc
class DecisionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DecisionJournal decisionJournal;

    @Test
    void recentDecisionsAreNewestFirstWithRejectionDetails() throws Exception {
        decisionJournal.rejected(decision("SOL/USDT", Side.SELL, "1", "150"),
                RiskVerdict.reject(RejectionReason.SIZE_TOO_SMALL, "below minimum; scalping: momentum"), NOW);

        mockMvc.perform(get("/api/decisions").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].instrument").value("SOL/USDT"))
                .andExpect(jsonPath("$[0].disposition").value("REJECTED"))
                .andExpect(jsonPath("$[0].reasonCode").value("SIZE_TOO_SMALL"))
                .andExpect(jsonPath("$[0].rationale").value("below minimum; scalping: momentum"));
    }

    @Test
    void limitOutsideRangeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/decisions").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
        mockMvc.perform(get("/api/decisions").param("limit", "1001"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/decisions").param("limit", "many"))
                .andExpect(status().isBadRequest());
    }
}
