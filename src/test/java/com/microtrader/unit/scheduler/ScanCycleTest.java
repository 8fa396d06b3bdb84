package com.microtrader.unit.scheduler;

import static com.microtrader.unit.support.TestFixtures.T0;
import static com.microtrader.unit.support.TestFixtures.opportunity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.microtrader.domain.enums.RiskState;
import com.microtrader.domain.model.Opportunity;
import com.microtrader.execution.ExecutionCoordinator;
import com.microtrader.execution.ExecutionSummary;
import com.microtrader.risk.RiskManager;
import com.microtrader.scanner.MarketScanner;
import com.microtrader.scheduler.ScanCycle;
import com.microtrader.scheduler.ShutdownSignal;
import com.microtrader.scoring.OpportunityScorer;
import com.microtrader.unit.support.MutableClock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScanCycleTest {

    @Mock
    private RiskManager riskManager;

    @Mock
    private MarketScanner marketScanner;

    @Mock
    private OpportunityScorer opportunityScorer;

    @Mock
    private ExecutionCoordinator executionCoordinator;

    private ShutdownSignal shutdownSignal;
    private ScanCycle scanCycle;

    @BeforeEach
    void setUp() {
        shutdownSignal = new ShutdownSignal();
        scanCycle = new ScanCycle(
                riskManager,
                marketScanner,
                opportunityScorer,
                executionCoordinator,
                shutdownSignal,
                new MutableClock(T0));
    }

    @Test
    @DisplayName("Ranked opportunities are handed to execution with the cycle timestamp")
    void normalCycle() {
        List<Opportunity> ranked = List.of(opportunity("ETH/USDT", "0.9"));
        ExecutionSummary summary = ExecutionSummary.builder().considered(1).filled(1).build();
        when(riskManager.getState()).thenReturn(RiskState.NORMAL);
        when(marketScanner.scan()).thenReturn(Stream.empty());
        when(opportunityScorer.rank(any(), eq(T0))).thenReturn(ranked);
        when(executionCoordinator.execute(ranked)).thenReturn(summary);

        assertThat(scanCycle.run()).contains(summary);
    }

    @Test
    @DisplayName("No opportunities means nothing is executed")
    void nothingRanked() {
        when(riskManager.getState()).thenReturn(RiskState.NORMAL);
        when(marketScanner.scan()).thenReturn(Stream.empty());
        when(opportunityScorer.rank(any(), eq(T0))).thenReturn(List.of());

        Optional<ExecutionSummary> result = scanCycle.run();

        assertThat(result).contains(ExecutionSummary.empty());
        verify(executionCoordinator, never()).execute(anyList());
    }

    @Test
    @DisplayName("The scan is skipped while entries are blocked")
    void skippedWhenNotNormal() {
        when(riskManager.getState()).thenReturn(RiskState.DAY_LIMIT_REACHED);

        assertThat(scanCycle.run()).isEmpty();

        verifyNoInteractions(marketScanner, opportunityScorer, executionCoordinator);
    }

    @Test
    @DisplayName("The scan is skipped after shutdown is raised")
    void skippedOnShutdown() {
        shutdownSignal.raise();

        assertThat(scanCycle.run()).isEmpty();

        verifyNoInteractions(riskManager, marketScanner);
    }

    @Test
    @DisplayName("A failing cycle is contained and the next one runs")
    void failureContained() {
        when(riskManager.getState()).thenReturn(RiskState.NORMAL);
        when(marketScanner.scan()).thenThrow(new IllegalStateException("boom")).thenReturn(Stream.empty());
        when(opportunityScorer.rank(any(), eq(T0))).thenReturn(List.of());

        assertThat(scanCycle.run()).isEmpty();
        assertThat(scanCycle.run()).isPresent();
    }

    @Test
    @DisplayName("A cycle started while another is running returns immediately")
    void noOverlap() throws Exception {
        CountDownLatch executing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<Opportunity> ranked = List.of(opportunity("ETH/USDT", "0.9"));
        when(riskManager.getState()).thenReturn(RiskState.NORMAL);
        when(marketScanner.scan()).thenReturn(Stream.empty());
        when(opportunityScorer.rank(any(), eq(T0))).thenReturn(ranked);
        when(executionCoordinator.execute(ranked)).thenAnswer(invocation -> {
            executing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return ExecutionSummary.empty();
        });

        CompletableFuture<Optional<ExecutionSummary>> first = CompletableFuture.supplyAsync(scanCycle::run);
        assertThat(executing.await(5, TimeUnit.SECONDS)).isTrue();

        Optional<ExecutionSummary> second = scanCycle.run();
        release.countDown();

        assertThat(second).isEmpty();
        assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
        verify(marketScanner).scan();
    }
}
