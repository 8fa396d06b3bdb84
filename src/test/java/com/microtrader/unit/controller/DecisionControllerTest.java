package com.microtrader.unit.controller;

import static com.microtrader.unit.support.TestFixtures.T0;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.microtrader.api.controller.DecisionController;
import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.RejectionReason;
import com.microtrader.exception.GlobalExceptionHandler;
import com.microtrader.observability.DecisionLogger;
import com.microtrader.observability.GateDecision;
import com.microtrader.observability.GateDecision.DecisionOutcome;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for DecisionController.
 */
class DecisionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private DecisionLogger decisionLogger;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new DecisionController(decisionLogger))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getRecentDecisions_defaultsToFifty() throws Exception {
        when(decisionLogger.getRecentDecisions(50)).thenReturn(List.of(GateDecision.builder()
                .timestamp(T0)
                .instrumentId("ETH/USDT")
                .direction(Direction.LONG)
                .score(new BigDecimal("0.9000"))
                .confidence(new BigDecimal("0.8500"))
                .outcome(DecisionOutcome.REJECTED)
                .rejectionReason(RejectionReason.CONCURRENCY_CAP_REACHED)
                .detail("8 of 8 slots in use")
                .build()));

        mockMvc.perform(get("/api/decisions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].instrumentId").value("ETH/USDT"))
                .andExpect(jsonPath("$[0].outcome").value("REJECTED"))
                .andExpect(jsonPath("$[0].rejectionReason").value("CONCURRENCY_CAP_REACHED"));
    }

    @Test
    void getRecentDecisions_limitOutOfRange_returns400() throws Exception {
        mockMvc.perform(get("/api/decisions").param("limit", "5000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.details.limit").value(5000));

        verify(decisionLogger, never()).getRecentDecisions(anyInt());
    }

    @Test
    void getRecentDecisions_nonNumericLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/decisions").param("limit", "many"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Invalid value for parameter 'limit'"));
    }
}
