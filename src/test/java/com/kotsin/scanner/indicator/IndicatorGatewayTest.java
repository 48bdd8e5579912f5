package com.kotsin.scanner.indicator;

import com.kotsin.scanner.ScannerTestFixtures;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.IndicatorSnapshot;
import com.kotsin.scanner.retry.RetryHandler;
import com.kotsin.scanner.util.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IndicatorGateway")
class IndicatorGatewayTest {

    @Mock
    private IndicatorSnapshotProvider provider;

    private IndicatorGateway gateway;
    private final List<Candle> history = ScannerTestFixtures.reversalSequence();

    @BeforeEach
    void setUp() {
        gateway = new IndicatorGateway(provider, new RetryHandler(1, 5), ScannerTestFixtures.registry(p -> {
            p.getIndicator().setPermitTimeout(Duration.ZERO);
            p.getIndicator().setCircuitFailureThreshold(2);
        }));
    }

    @Test
    @DisplayName("Returns the provider snapshot")
    void testFetch_Success() {
        IndicatorSnapshot snapshot = IndicatorSnapshot.builder().rsi(55.0).build();
        when(provider.getSnapshot("SPY", "5m", history)).thenReturn(snapshot);

        Optional<IndicatorSnapshot> result = gateway.fetch("SPY", "5m", history);

        assertTrue(result.isPresent());
        assertEquals(55.0, result.get().getRsi());
    }

    @Test
    @DisplayName("Provider failure after retries is an empty result")
    void testFetch_ProviderFails() {
        when(provider.getSnapshot(anyString(), anyString(), anyList())).thenThrow(new IllegalStateException("timeout"));

        assertTrue(gateway.fetch("SPY", "5m", history).isEmpty());
        verify(provider, times(2)).getSnapshot(anyString(), anyString(), anyList());
    }

    @Test
    @DisplayName("Open circuit skips the provider")
    void testFetch_CircuitOpens() {
        when(provider.getSnapshot(anyString(), anyString(), anyList())).thenThrow(new IllegalStateException("down"));

        gateway.fetch("SPY", "5m", history);
        gateway.fetch("SPY", "5m", history);
        assertEquals(CircuitBreaker.State.OPEN, gateway.getCircuitState());

        assertTrue(gateway.fetch("SPY", "5m", history).isEmpty());
        verify(provider, times(4)).getSnapshot(anyString(), anyString(), anyList());
    }

    @Test
    @DisplayName("Exhausted API budget skips the fetch")
    void testFetch_BudgetExhausted() {
        gateway.updateBudget(1);
        when(provider.getSnapshot(any(), any(), any())).thenReturn(new IndicatorSnapshot());

        assertTrue(gateway.fetch("SPY", "5m", history).isPresent());
        assertTrue(gateway.fetch("SPY", "5m", history).isEmpty());
        verify(provider, times(1)).getSnapshot(any(), any(), any());
    }
}
