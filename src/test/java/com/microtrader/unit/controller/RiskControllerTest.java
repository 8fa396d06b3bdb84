package com.microtrader.unit.controller;

import static com.microtrader.unit.support.TestFixtures.DAY0;
import static com.microtrader.unit.support.TestFixtures.T0;
import static com.microtrader.unit.support.TestFixtures.defaultLimits;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.microtrader.api.controller.RiskController;
import com.microtrader.domain.enums.RiskState;
import com.microtrader.domain.model.AccountSnapshot;
import com.microtrader.exception.BusinessException;
import com.microtrader.exception.ErrorCode;
import com.microtrader.exception.GlobalExceptionHandler;
import com.microtrader.risk.RiskManager;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for RiskController: status and circuit breaker reset.
 */
class RiskControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RiskManager riskManager;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new RiskController(riskManager))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static AccountSnapshot account(String balance, RiskState state) {
        return AccountSnapshot.builder()
                .balance(new BigDecimal(balance))
                .peakBalance(new BigDecimal("100.00"))
                .dayStartBalance(new BigDecimal("100.00"))
                .dailyPnl(new BigDecimal(balance).subtract(new BigDecimal("100.00")))
                .sessionBaseline(new BigDecimal("100.00"))
                .tradingDay(DAY0)
                .riskState(state)
                .openPositions(2)
                .reservedSlots(1)
                .committedCapital(new BigDecimal("30.00"))
                .takenAt(T0)
                .build();
    }

    @Test
    void getStatus_returnsAccountAndLimits() throws Exception {
        when(riskManager.snapshot()).thenReturn(account("97.50", RiskState.NORMAL));
        when(riskManager.getLimits()).thenReturn(defaultLimits());

        mockMvc.perform(get("/api/risk/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskState").value("NORMAL"))
                .andExpect(jsonPath("$.balance").value(97.50))
                .andExpect(jsonPath("$.dailyPnl").value(-2.50))
                .andExpect(jsonPath("$.openPositions").value(2))
                .andExpect(jsonPath("$.reservedSlots").value(1))
                .andExpect(jsonPath("$.limits.maxConcurrentPositions").value(8))
                .andExpect(jsonPath("$.limits.dailyLossLimit").value(0.10));
    }

    @Test
    void resetCircuitBreaker_returnsNewState() throws Exception {
        when(riskManager.resetCircuitBreaker("ops")).thenReturn(RiskState.DAY_LIMIT_REACHED);
        when(riskManager.snapshot()).thenReturn(account("85.00", RiskState.DAY_LIMIT_REACHED));

        mockMvc.perform(post("/api/risk/circuit-breaker/reset").param("operator", "ops"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskState").value("DAY_LIMIT_REACHED"))
                .andExpect(jsonPath("$.balance").value(85.00))
                .andExpect(jsonPath("$.resetBy").value("ops"));
    }

    @Test
    void resetCircuitBreaker_notHalted_returns409() throws Exception {
        when(riskManager.resetCircuitBreaker("api"))
                .thenThrow(new BusinessException(
                        ErrorCode.CONFLICT, "Circuit breaker is not tripped", Map.of("riskState", "NORMAL")));

        mockMvc.perform(post("/api/risk/circuit-breaker/reset"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("CONFLICT"))
                .andExpect(jsonPath("$.error.details.riskState").value("NORMAL"))
                .andExpect(jsonPath("$.error.path").value("/api/risk/circuit-breaker/reset"));
    }
}
