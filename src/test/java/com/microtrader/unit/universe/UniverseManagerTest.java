package com.microtrader.unit.universe;

import static com.microtrader.unit.support.TestFixtures.T0;
import static com.microtrader.unit.support.TestFixtures.retryPolicy;
import static com.microtrader.unit.support.TestFixtures.settingsBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.microtrader.domain.enums.LiquidityTier;
import com.microtrader.domain.model.Instrument;
import com.microtrader.exception.TransientGatewayException;
import com.microtrader.gateway.BoundedRetry;
import com.microtrader.gateway.MarketGateway;
import com.microtrader.universe.UniverseManager;
import com.microtrader.unit.support.MutableClock;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UniverseManagerTest {

    @Mock
    private MarketGateway marketGateway;

    private UniverseManager universeManager;

    @BeforeEach
    void setUp() {
        universeManager = new UniverseManager(
                marketGateway,
                new BoundedRetry(retryPolicy(2), duration -> {}),
                settingsBuilder().universeMaxSymbols(3).build(),
                new MutableClock(T0));
    }

    private static Instrument listed(String id, LiquidityTier tier, String volume) {
        return Instrument.builder()
                .id(id)
                .liquidityTier(tier)
                .minOrderSize(new BigDecimal("5"))
                .volume24h(new BigDecimal(volume))
                .build();
    }

    @Test
    @DisplayName("Universe is empty before the first refresh")
    void emptyInitially() {
        assertThat(universeManager.instruments()).isEmpty();
        assertThat(universeManager.getLastRefreshedAt()).isNull();
    }

    @Test
    @DisplayName("Refresh filters by volume, de-duplicates, orders by tier then id and limits")
    void refreshSelects() {
        when(marketGateway.listInstruments()).thenReturn(List.of(
                listed("PEPE/USDT", LiquidityTier.LOW, "20000000"),
                listed("SOL/USDT", LiquidityTier.HIGH, "450000000"),
                listed("BONK/USDT", LiquidityTier.HIGH, "800000"),
                listed("DOGE/USDT", LiquidityTier.MEDIUM, "180000000"),
                listed("BTC/USDT", LiquidityTier.HIGH, "2500000000"),
                listed("SOL/USDT", LiquidityTier.HIGH, "450000000")));

        assertThat(universeManager.refresh()).isTrue();

        assertThat(universeManager.instruments())
                .extracting(Instrument::getId)
                .containsExactly("BTC/USDT", "SOL/USDT", "DOGE/USDT");
        assertThat(universeManager.getLastRefreshedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("A failed refresh keeps the previous universe")
    void failureKeepsPrevious() {
        when(marketGateway.listInstruments())
                .thenReturn(List.of(listed("ETH/USDT", LiquidityTier.HIGH, "1200000000")))
                .thenThrow(new TransientGatewayException(TransientGatewayException.Kind.TIMEOUT, "slow"));
        universeManager.refresh();

        assertThat(universeManager.refresh()).isFalse();

        assertThat(universeManager.instruments()).extracting(Instrument::getId).containsExactly("ETH/USDT");
    }

    @Test
    @DisplayName("A refresh with nothing eligible keeps the previous universe")
    void emptyResultKeepsPrevious() {
        when(marketGateway.listInstruments())
                .thenReturn(List.of(listed("ETH/USDT", LiquidityTier.HIGH, "1200000000")))
                .thenReturn(List.of(listed("BONK/USDT", LiquidityTier.LOW, "10")));
        universeManager.refresh();

        assertThat(universeManager.refresh()).isFalse();

        assertThat(universeManager.instruments()).extracting(Instrument::getId).containsExactly("ETH/USDT");
    }
}
